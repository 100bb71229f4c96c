package com.pongnet.gameserver.session;

import com.pongnet.gameserver.game.GamePhase;
import com.pongnet.gameserver.game.Intent;
import com.pongnet.gameserver.game.PeerRole;
import com.pongnet.gameserver.game.StateSnapshot;
import com.pongnet.gameserver.user.AuthException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private static final StateSnapshot SNAPSHOT =
            new StateSnapshot(1, GamePhase.IN_PROGRESS, 215, 215, 318, 238, 0, 0, null, false, 5);

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void seatsAreHandedOutLeftThenRightThenObserver() {
        assertThat(registry.assignRole(new Sink())).isEqualTo(PeerRole.LEFT);
        assertThat(registry.assignRole(new Sink())).isEqualTo(PeerRole.RIGHT);
        assertThat(registry.assignRole(new Sink())).isEqualTo(PeerRole.OBSERVER);
        assertThat(registry.assignRole(new Sink())).isEqualTo(PeerRole.OBSERVER);
        assertThat(registry.playerCount()).isEqualTo(2);
        assertThat(registry.observerCount()).isEqualTo(2);
    }

    @Test
    void releasedSeatGoesToTheNextConnection() {
        Sink left = new Sink();
        registry.assignRole(left);
        registry.assignRole(new Sink());

        assertThat(registry.release(PeerRole.LEFT, left)).isTrue();
        assertThat(registry.assignRole(new Sink())).isEqualTo(PeerRole.LEFT);
    }

    @Test
    void releaseIgnoresConnectionsThatNoLongerHoldTheSeat() {
        Sink left = new Sink();
        registry.assignRole(left);

        assertThat(registry.release(PeerRole.LEFT, new Sink())).isFalse();
        assertThat(registry.holds(PeerRole.LEFT, left)).isTrue();
    }

    @Test
    void sameUserCannotTakeBothSeats() {
        Sink left = new Sink();
        Sink right = new Sink();
        registry.assignRole(left);
        registry.assignRole(right);
        registry.seat(PeerRole.LEFT, left, "alice");

        assertThatThrownBy(() -> registry.seat(PeerRole.RIGHT, right, "alice"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).reason())
                .isEqualTo(AuthException.Reason.ALREADY_SEATED);
        assertThat(registry.seatedSlot(PeerRole.RIGHT)).isEmpty();
        assertThat(registry.bothSeated()).isFalse();
    }

    @Test
    void seatingRequiresHoldingTheSlot() {
        registry.assignRole(new Sink());

        assertThatThrownBy(() -> registry.seat(PeerRole.LEFT, new Sink(), "alice"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void intentIsConsumedOnce() {
        Sink left = new Sink();
        registry.assignRole(left);
        registry.slot(PeerRole.LEFT).orElseThrow().offerIntent(Intent.UP);

        assertThat(registry.takeIntent(PeerRole.LEFT)).isEqualTo(Intent.UP);
        assertThat(registry.takeIntent(PeerRole.LEFT)).isEqualTo(Intent.NONE);
        assertThat(registry.takeIntent(PeerRole.RIGHT)).isEqualTo(Intent.NONE);
    }

    @Test
    void concurrentJoinsNeverShareASeat() throws Exception {
        int joiners = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PeerRole>> roles = new ArrayList<>();
        try {
            for (int i = 0; i < joiners; i++) {
                Callable<PeerRole> join = () -> {
                    start.await();
                    return registry.assignRole(new Sink());
                };
                roles.add(pool.submit(join));
            }
            start.countDown();

            List<PeerRole> assigned = new ArrayList<>();
            for (Future<PeerRole> role : roles) {
                assigned.add(role.get(5, TimeUnit.SECONDS));
            }
            assertThat(assigned).containsOnlyOnce(PeerRole.LEFT, PeerRole.RIGHT);
            assertThat(assigned).filteredOn(r -> r == PeerRole.OBSERVER).hasSize(joiners - 2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void broadcastSurvivesAFailingPeer() {
        Sink healthy = new Sink();
        registry.assignRole(new SnapshotSink() {
            @Override
            public void offer(StateSnapshot snapshot) {
                throw new IllegalStateException("broken");
            }

            @Override
            public void disconnect() {
            }
        });
        registry.assignRole(healthy);

        registry.broadcastSnapshot(SNAPSHOT);

        assertThat(healthy.last).isSameAs(SNAPSHOT);
    }

    @Test
    void disconnectAllReachesPlayersAndObservers() {
        Sink left = new Sink();
        Sink observer = new Sink();
        registry.assignRole(left);
        registry.assignRole(new Sink());
        registry.assignRole(observer);

        registry.disconnectAll();

        assertThat(left.disconnected).isTrue();
        assertThat(observer.disconnected).isTrue();
    }

    private static final class Sink implements SnapshotSink {
        volatile StateSnapshot last;
        volatile boolean disconnected;

        @Override
        public void offer(StateSnapshot snapshot) {
            last = snapshot;
        }

        @Override
        public void disconnect() {
            disconnected = true;
        }
    }
}
