package com.pongnet.gameserver.game;

/**
 * Lifecycle of the single authoritative match.
 * <p>
 * Normal play cycles {@code AWAITING_PLAYERS -> IN_PROGRESS -> GAME_OVER -> AWAITING_REMATCH -> IN_PROGRESS}.
 * Terminating the session (no players left, abandoned rematch, simulation fault) returns to
 * {@code AWAITING_PLAYERS} from any other phase.
 */
public enum GamePhase {
    AWAITING_PLAYERS,
    IN_PROGRESS,
    GAME_OVER,
    AWAITING_REMATCH;

    public boolean canTransitionTo(GamePhase next) {
        if (next == AWAITING_PLAYERS) {
            return this != AWAITING_PLAYERS;
        }
        return switch (this) {
            case AWAITING_PLAYERS, AWAITING_REMATCH -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == GAME_OVER;
            case GAME_OVER -> next == AWAITING_REMATCH;
        };
    }

    public boolean isGameOver() {
        return this == GAME_OVER || this == AWAITING_REMATCH;
    }
}
