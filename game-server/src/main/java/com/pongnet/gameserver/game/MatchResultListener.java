package com.pongnet.gameserver.game;

@FunctionalInterface
public interface MatchResultListener {
    /** Called outside the tick lock; implementations must not block for long. */
    void onMatchCompleted(MatchResult result);
}
