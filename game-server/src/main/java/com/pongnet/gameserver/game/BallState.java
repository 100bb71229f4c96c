package com.pongnet.gameserver.game;

/**
 * Ball position (top-left corner) and per-tick velocity. Mutated only inside a tick.
 */
public final class BallState {
    private int x;
    private int y;
    private int vx;
    private int vy;

    void place(int x, int y, int vx, int vy) {
        this.x = x;
        this.y = y;
        this.vx = vx;
        this.vy = vy;
    }

    void advance() {
        x += vx;
        y += vy;
    }

    void setX(int x) {
        this.x = x;
    }

    void setY(int y) {
        this.y = y;
    }

    void setVx(int vx) {
        this.vx = vx;
    }

    void setVy(int vy) {
        this.vy = vy;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    public int vx() {
        return vx;
    }

    public int vy() {
        return vy;
    }
}
