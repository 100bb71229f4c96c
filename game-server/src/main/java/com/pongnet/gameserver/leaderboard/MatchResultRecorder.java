package com.pongnet.gameserver.leaderboard;

import com.pongnet.gameserver.game.MatchResult;
import com.pongnet.gameserver.game.MatchResultListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Persists finished matches off the tick thread.
 */
@Component
public class MatchResultRecorder implements MatchResultListener {
    private static final Logger log = LoggerFactory.getLogger(MatchResultRecorder.class);

    private final LeaderboardService leaderboardService;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "leaderboard-writer");
        t.setDaemon(true);
        return t;
    });

    public MatchResultRecorder(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @Override
    public void onMatchCompleted(MatchResult result) {
        log.info("Match finished {}-{} won by {}{}", result.leftScore(), result.rightScore(),
                result.winner(), result.forfeit() ? " (forfeit)" : "");
        if (result.winner() == null) {
            log.warn("Match won by the {} side has no recorded username, skipping", result.winningSide().wireName());
            return;
        }
        try {
            writer.execute(() -> record(result.winner()));
        } catch (RejectedExecutionException e) {
            log.warn("Leaderboard writer is shut down, dropping win for {}", result.winner());
        }
    }

    private void record(String username) {
        try {
            leaderboardService.recordWin(username);
        } catch (RuntimeException e) {
            log.error("Failed to record win for {}", username, e);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        writer.shutdown();
        if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Leaderboard writer did not drain in time");
            writer.shutdownNow();
        }
    }
}
