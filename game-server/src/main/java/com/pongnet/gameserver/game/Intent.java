package com.pongnet.gameserver.game;

import java.util.Optional;

/**
 * Paddle direction requested by a player for the next tick.
 */
public enum Intent {
    UP(-1),
    DOWN(1),
    NONE(0);

    private final int direction;

    Intent(int direction) {
        this.direction = direction;
    }

    public int delta(int speed) {
        return direction * speed;
    }

    /** Maps {@code up}, {@code down} and the empty payload; anything else is not an intent. */
    public static Optional<Intent> fromPayload(String payload) {
        return switch (payload) {
            case "up" -> Optional.of(UP);
            case "down" -> Optional.of(DOWN);
            case "" -> Optional.of(NONE);
            default -> Optional.empty();
        };
    }
}
