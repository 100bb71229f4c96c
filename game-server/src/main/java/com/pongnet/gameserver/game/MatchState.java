package com.pongnet.gameserver.game;

import com.pongnet.gameserver.config.GameProperties;

/**
 * Paddles, ball, score and phase of the one running match. Owned by {@link SimulationEngine}
 * and only touched while its tick lock is held.
 */
final class MatchState {
    private final GameProperties props;
    private final BallState ball = new BallState();
    private final ScoreState score = new ScoreState();
    private GamePhase phase = GamePhase.AWAITING_PLAYERS;
    private int leftPaddleY;
    private int rightPaddleY;
    private PeerRole winner;
    private boolean forfeit;

    MatchState(GameProperties props) {
        this.props = props;
        resetForNewMatch();
    }

    void resetForNewMatch() {
        leftPaddleY = props.initialPaddleY();
        rightPaddleY = props.initialPaddleY();
        score.reset();
        winner = null;
        forfeit = false;
        serveTowards(PeerRole.LEFT);
    }

    void serveTowards(PeerRole side) {
        int vx = side == PeerRole.LEFT ? -props.ballSpeed() : props.ballSpeed();
        ball.place(props.centreBallX(), props.centreBallY(), vx, 0);
    }

    void movePaddle(PeerRole side, Intent intent) {
        int moved = clamp(paddleY(side) + intent.delta(props.paddleSpeed()), 0, props.maxPaddleY());
        if (side == PeerRole.LEFT) {
            leftPaddleY = moved;
        } else {
            rightPaddleY = moved;
        }
    }

    void declareWinner(PeerRole side, boolean byForfeit) {
        this.winner = side;
        this.forfeit = byForfeit;
    }

    void checkInvariants() {
        if (leftPaddleY < 0 || leftPaddleY > props.maxPaddleY()
                || rightPaddleY < 0 || rightPaddleY > props.maxPaddleY()) {
            throw new SimulationFaultException("Paddle out of bounds: left=" + leftPaddleY + " right=" + rightPaddleY);
        }
        if (ball.x() < 0 || ball.x() > props.maxBallX() || ball.y() < 0 || ball.y() > props.maxBallY()) {
            throw new SimulationFaultException("Ball out of bounds at (" + ball.x() + ", " + ball.y() + ")");
        }
        if (score.left() < 0 || score.right() < 0) {
            throw new SimulationFaultException("Negative score " + score.left() + "-" + score.right());
        }
        if (phase.isGameOver() && winner == null) {
            throw new SimulationFaultException("Game over without a winner");
        }
    }

    StateSnapshot snapshot(long tick) {
        return new StateSnapshot(tick, phase, leftPaddleY, rightPaddleY, ball.x(), ball.y(),
                score.left(), score.right(), phase.isGameOver() ? winner : null, forfeit, props.winScore());
    }

    int paddleY(PeerRole side) {
        return side == PeerRole.LEFT ? leftPaddleY : rightPaddleY;
    }

    BallState ball() {
        return ball;
    }

    ScoreState score() {
        return score;
    }

    GamePhase phase() {
        return phase;
    }

    void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
