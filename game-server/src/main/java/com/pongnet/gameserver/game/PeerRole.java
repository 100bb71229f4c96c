package com.pongnet.gameserver.game;

import java.util.List;

public enum PeerRole {
    LEFT("left"),
    RIGHT("right"),
    OBSERVER("spectator");

    /** Player slots in assignment order. */
    public static final List<PeerRole> PLAYERS = List.of(LEFT, RIGHT);

    private final String wireName;

    PeerRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isPlayer() {
        return this != OBSERVER;
    }

    public PeerRole opponent() {
        return switch (this) {
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case OBSERVER -> throw new IllegalStateException("Observers have no opponent");
        };
    }
}
