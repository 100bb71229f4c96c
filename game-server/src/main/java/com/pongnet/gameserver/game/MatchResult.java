package com.pongnet.gameserver.game;

/**
 * A completed game, reported once when it ends by reaching the win score or by forfeit.
 *
 * @param loser {@code null} when the losing slot was never authenticated
 */
public record MatchResult(
        PeerRole winningSide,
        String winner,
        String loser,
        int leftScore,
        int rightScore,
        boolean forfeit
) {
}
