package com.pongnet.gameserver.game;

import com.pongnet.gameserver.session.PlayerSlot;
import com.pongnet.gameserver.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Collects the {@code ready} signals of both players after a game is over. Callers hold the
 * engine's tick lock, so flag changes never interleave with a restart.
 */
public class RematchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RematchCoordinator.class);

    public enum Outcome {
        /** Keep waiting: a flag is missing, or a seat is empty and nobody is ready yet. */
        WAITING,
        BOTH_READY,
        /** A seat is empty while the remaining player is ready; waiting could last forever. */
        ABANDONED
    }

    private final SessionRegistry registry;

    public RematchCoordinator(SessionRegistry registry) {
        this.registry = registry;
    }

    /** Returns {@code false} when the role has no authenticated seat to flag. */
    public boolean markReady(PeerRole role) {
        Optional<PlayerSlot> seated = registry.seatedSlot(role);
        if (seated.isEmpty()) {
            log.debug("No seated {} player to mark ready", role.wireName());
            return false;
        }
        PlayerSlot slot = seated.get();
        slot.setReadyForRematch(true);
        log.info("{} ({}) is ready for a rematch", slot.username(), role.wireName());
        return true;
    }

    public void reset() {
        for (PeerRole role : PeerRole.PLAYERS) {
            registry.slot(role).ifPresent(slot -> slot.setReadyForRematch(false));
        }
    }

    public Outcome evaluate() {
        Optional<PlayerSlot> left = registry.seatedSlot(PeerRole.LEFT);
        Optional<PlayerSlot> right = registry.seatedSlot(PeerRole.RIGHT);
        boolean leftReady = left.map(PlayerSlot::isReadyForRematch).orElse(false);
        boolean rightReady = right.map(PlayerSlot::isReadyForRematch).orElse(false);

        if (left.isPresent() && right.isPresent()) {
            return leftReady && rightReady ? Outcome.BOTH_READY : Outcome.WAITING;
        }
        return leftReady || rightReady ? Outcome.ABANDONED : Outcome.WAITING;
    }
}
