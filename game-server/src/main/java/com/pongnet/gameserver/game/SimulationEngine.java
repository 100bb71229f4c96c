package com.pongnet.gameserver.game;

import com.pongnet.gameserver.config.GameProperties;
import com.pongnet.gameserver.session.PlayerSlot;
import com.pongnet.gameserver.session.SessionRegistry;
import com.pongnet.gameserver.session.SnapshotSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The authoritative game loop. Every tick samples both players' latest intents, advances the
 * match by one step under {@link #tickLock} and publishes an immutable {@link StateSnapshot}.
 * <p>
 * Collision rules, all in integer court units:
 * <ul>
 *     <li>top and bottom walls mirror the ball back into the court and invert {@code vy};</li>
 *     <li>a ball crossing a paddle face while overlapping the paddle vertically is placed on the
 *     face, {@code vx} is inverted and {@code vy} becomes the distance between the ball centre and
 *     the paddle centre divided by {@code max(1, (paddleHeight / 2) / maxBallSpeedY)}, clamped to
 *     {@code maxBallSpeedY};</li>
 *     <li>a ball leaving a side scores for the other side and is served from the centre towards
 *     the scorer with {@code vy = 0}.</li>
 * </ul>
 */
public class SimulationEngine {
    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private final GameProperties props;
    private final SessionRegistry registry;
    private final RematchCoordinator rematch;
    private final MatchResultListener resultListener;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final MatchState state;
    private final int deflectDivisor;
    private long tick;
    private volatile StateSnapshot latest;

    private ScheduledExecutorService ticker;

    public SimulationEngine(GameProperties props,
                            SessionRegistry registry,
                            RematchCoordinator rematch,
                            MatchResultListener resultListener) {
        this.props = props;
        this.registry = registry;
        this.rematch = rematch;
        this.resultListener = resultListener;
        this.state = new MatchState(props);
        this.deflectDivisor = Math.max(1, (props.paddleHeight() / 2) / props.maxBallSpeedY());
        this.latest = state.snapshot(0);
    }

    public synchronized void start() {
        if (ticker != null) return;
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pong-tick");
            t.setDaemon(true);
            return t;
        });
        long periodNanos = props.tickInterval().toNanos();
        ticker.scheduleAtFixedRate(this::runTick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        log.info("Simulation started at {} ticks/s", props.tickRate());
    }

    public synchronized void stop() {
        if (ticker == null) return;
        ticker.shutdownNow();
        try {
            ticker.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        ticker = null;
        log.info("Simulation stopped after {} ticks", tick);
    }

    void runTick() {
        // an exception escaping here would cancel the schedule
        try {
            advanceTick();
        } catch (SimulationFaultException e) {
            log.error("Simulation fault at tick {}, terminating session", tick, e);
            terminateSession();
        } catch (RuntimeException e) {
            log.error("Unexpected error at tick {}", tick, e);
        }
    }

    /**
     * Runs one tick and returns the snapshot it published. Called by the scheduler; tests call it
     * directly to replay exact tick sequences.
     */
    public StateSnapshot advanceTick() {
        MatchResult completed = null;
        StateSnapshot snapshot;
        tickLock.lock();
        try {
            tick++;
            Intent left = registry.takeIntent(PeerRole.LEFT);
            Intent right = registry.takeIntent(PeerRole.RIGHT);

            switch (state.phase()) {
                case AWAITING_PLAYERS -> {
                    if (registry.bothSeated()) startMatch();
                }
                case IN_PROGRESS -> completed = step(left, right);
                case GAME_OVER -> transition(GamePhase.AWAITING_REMATCH);
                case AWAITING_REMATCH -> evaluateRematch();
            }
            if (state.phase() != GamePhase.AWAITING_PLAYERS && !registry.hasPlayers()) {
                log.info("Both player seats are empty, resetting the session");
                abortToAwaitingPlayers();
            }
            state.checkInvariants();
            snapshot = publish();
        } finally {
            tickLock.unlock();
        }
        notifyCompleted(completed);
        return snapshot;
    }

    /**
     * Releases a player's seat. Leaving a game in progress forfeits it to the opponent, and the
     * final snapshot is published right away.
     */
    public void removePlayer(PeerRole role, SnapshotSink connection) {
        MatchResult completed = null;
        tickLock.lock();
        try {
            boolean holder = registry.holds(role, connection);
            if (holder && state.phase() == GamePhase.IN_PROGRESS) {
                completed = finishMatch(role.opponent(), true);
                log.info("{} left during the game, {} wins by forfeit", role.wireName(), role.opponent().wireName());
            }
            registry.release(role, connection);
            if (completed != null) {
                publish();
            }
        } finally {
            tickLock.unlock();
        }
        notifyCompleted(completed);
    }

    /**
     * Records a rematch request. Only accepted while the game is over and the role holds an
     * authenticated seat.
     */
    public boolean markReady(PeerRole role) {
        tickLock.lock();
        try {
            if (!state.phase().isGameOver()) {
                log.debug("Ignoring ready from {} during {}", role.wireName(), state.phase());
                return false;
            }
            return rematch.markReady(role);
        } finally {
            tickLock.unlock();
        }
    }

    MatchState matchState() {
        return state;
    }

    public StateSnapshot latestSnapshot() {
        return latest;
    }

    public GamePhase phase() {
        return latest.phase();
    }

    private MatchResult step(Intent leftIntent, Intent rightIntent) {
        state.movePaddle(PeerRole.LEFT, leftIntent);
        state.movePaddle(PeerRole.RIGHT, rightIntent);

        BallState ball = state.ball();
        int previousX = ball.x();
        ball.advance();
        bounceOffWalls(ball);
        bounceOffPaddles(ball, previousX);

        PeerRole scorer = null;
        if (ball.x() < 0) {
            scorer = PeerRole.RIGHT;
        } else if (ball.x() > props.maxBallX()) {
            scorer = PeerRole.LEFT;
        }
        if (scorer == null) {
            return null;
        }
        state.score().increment(scorer);
        state.serveTowards(scorer);
        log.debug("Point to {}: {}-{}", scorer.wireName(), state.score().left(), state.score().right());
        if (state.score().of(scorer) >= props.winScore()) {
            return finishMatch(scorer, false);
        }
        return null;
    }

    private void bounceOffWalls(BallState ball) {
        if (ball.y() < 0) {
            ball.setY(-ball.y());
            ball.setVy(-ball.vy());
        } else if (ball.y() > props.maxBallY()) {
            ball.setY(2 * props.maxBallY() - ball.y());
            ball.setVy(-ball.vy());
        }
    }

    private void bounceOffPaddles(BallState ball, int previousX) {
        int leftFace = props.leftPaddleX() + props.paddleWidth();
        int rightFace = props.rightPaddleX();
        if (ball.vx() < 0 && previousX >= leftFace && ball.x() <= leftFace
                && overlapsVertically(ball, state.paddleY(PeerRole.LEFT))) {
            ball.setX(leftFace);
            ball.setVx(-ball.vx());
            ball.setVy(deflection(ball, state.paddleY(PeerRole.LEFT)));
        } else if (ball.vx() > 0 && previousX + props.ballSize() <= rightFace && ball.x() + props.ballSize() >= rightFace
                && overlapsVertically(ball, state.paddleY(PeerRole.RIGHT))) {
            ball.setX(rightFace - props.ballSize());
            ball.setVx(-ball.vx());
            ball.setVy(deflection(ball, state.paddleY(PeerRole.RIGHT)));
        }
    }

    private boolean overlapsVertically(BallState ball, int paddleY) {
        return ball.y() + props.ballSize() >= paddleY && ball.y() <= paddleY + props.paddleHeight();
    }

    private int deflection(BallState ball, int paddleY) {
        int offset = (ball.y() + props.ballSize() / 2) - (paddleY + props.paddleHeight() / 2);
        return MatchState.clamp(offset / deflectDivisor, -props.maxBallSpeedY(), props.maxBallSpeedY());
    }

    private void startMatch() {
        state.resetForNewMatch();
        rematch.reset();
        transition(GamePhase.IN_PROGRESS);
        log.info("Match started: {} (left) vs {} (right)", usernameOf(PeerRole.LEFT), usernameOf(PeerRole.RIGHT));
    }

    private void evaluateRematch() {
        switch (rematch.evaluate()) {
            case BOTH_READY -> {
                state.resetForNewMatch();
                rematch.reset();
                transition(GamePhase.IN_PROGRESS);
                log.info("Rematch started: {} vs {}", usernameOf(PeerRole.LEFT), usernameOf(PeerRole.RIGHT));
            }
            case ABANDONED -> {
                log.warn("Rematch abandoned: a player left while the other was ready");
                abortToAwaitingPlayers();
            }
            case WAITING -> {
            }
        }
    }

    private MatchResult finishMatch(PeerRole winner, boolean byForfeit) {
        state.declareWinner(winner, byForfeit);
        transition(GamePhase.GAME_OVER);
        rematch.reset();
        log.info("Game over: {} wins {}-{}{}", winner.wireName(), state.score().left(), state.score().right(),
                byForfeit ? " by forfeit" : "");
        return new MatchResult(winner, usernameOf(winner), usernameOf(winner.opponent()),
                state.score().left(), state.score().right(), byForfeit);
    }

    private void abortToAwaitingPlayers() {
        rematch.reset();
        state.resetForNewMatch();
        transition(GamePhase.AWAITING_PLAYERS);
    }

    private void terminateSession() {
        tickLock.lock();
        try {
            registry.disconnectAll();
            if (state.phase() != GamePhase.AWAITING_PLAYERS) {
                state.setPhase(GamePhase.AWAITING_PLAYERS);
            }
            state.resetForNewMatch();
            publish();
        } finally {
            tickLock.unlock();
        }
    }

    private void transition(GamePhase next) {
        GamePhase current = state.phase();
        if (!current.canTransitionTo(next)) {
            throw new SimulationFaultException("Illegal phase transition " + current + " -> " + next);
        }
        state.setPhase(next);
        log.debug("Phase {} -> {}", current, next);
    }

    private StateSnapshot publish() {
        StateSnapshot snapshot = state.snapshot(tick);
        latest = snapshot;
        registry.broadcastSnapshot(snapshot);
        return snapshot;
    }

    private String usernameOf(PeerRole role) {
        return registry.seatedSlot(role).map(PlayerSlot::username).orElse(null);
    }

    private void notifyCompleted(MatchResult result) {
        if (result == null || resultListener == null) return;
        try {
            resultListener.onMatchCompleted(result);
        } catch (RuntimeException e) {
            log.error("Match result listener failed for {}", result, e);
        }
    }
}
