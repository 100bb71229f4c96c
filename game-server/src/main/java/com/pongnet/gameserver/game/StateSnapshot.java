package com.pongnet.gameserver.game;

/**
 * One tick's immutable view of the match, as sent to every connection.
 *
 * @param winner winning side while the game is over, otherwise {@code null}
 */
public record StateSnapshot(
        long tick,
        GamePhase phase,
        int leftPaddleY,
        int rightPaddleY,
        int ballX,
        int ballY,
        int leftScore,
        int rightScore,
        PeerRole winner,
        boolean forfeit,
        int winScore
) {
    public boolean gameOver() {
        return phase.isGameOver();
    }

    /**
     * {@code "<leftY> <rightY> <ballX> <ballY> <leftScore> <rightScore>"}, followed by
     * {@code " gameover <winScore> <side>"} and {@code " forfeit"} while the game is over.
     */
    public String toWireLine() {
        StringBuilder line = new StringBuilder(48)
                .append(leftPaddleY).append(' ')
                .append(rightPaddleY).append(' ')
                .append(ballX).append(' ')
                .append(ballY).append(' ')
                .append(leftScore).append(' ')
                .append(rightScore);
        if (gameOver() && winner != null) {
            line.append(" gameover ").append(winScore).append(' ').append(winner.wireName());
            if (forfeit) {
                line.append(" forfeit");
            }
        }
        return line.toString();
    }
}
