package com.pongnet.gameserver.game;

public final class ScoreState {
    private int left;
    private int right;

    void increment(PeerRole side) {
        switch (side) {
            case LEFT -> left++;
            case RIGHT -> right++;
            case OBSERVER -> throw new SimulationFaultException("Observers cannot score");
        }
    }

    void reset() {
        left = 0;
        right = 0;
    }

    public int of(PeerRole side) {
        return side == PeerRole.LEFT ? left : right;
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }
}
