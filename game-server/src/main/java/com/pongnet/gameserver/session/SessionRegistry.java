package com.pongnet.gameserver.session;

import com.pongnet.gameserver.game.Intent;
import com.pongnet.gameserver.game.PeerRole;
import com.pongnet.gameserver.game.StateSnapshot;
import com.pongnet.gameserver.user.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The two player seats and the observer set. Seat assignment and release are serialized on this
 * object; snapshot fan-out only takes the lock long enough to copy the recipient list.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<PeerRole, PlayerSlot> players = new EnumMap<>(PeerRole.class);
    private final Set<SnapshotSink> observers = ConcurrentHashMap.newKeySet();

    /**
     * Gives the connection the first free seat (LEFT before RIGHT), or makes it an observer.
     */
    public synchronized PeerRole assignRole(SnapshotSink connection) {
        for (PeerRole role : PeerRole.PLAYERS) {
            if (!players.containsKey(role)) {
                players.put(role, new PlayerSlot(role, connection));
                return role;
            }
        }
        observers.add(connection);
        return PeerRole.OBSERVER;
    }

    /**
     * Marks the connection's seat as authenticated under {@code username}.
     *
     * @throws AuthException if the same user already sits in the other seat
     */
    public synchronized void seat(PeerRole role, SnapshotSink connection, String username) {
        PlayerSlot slot = players.get(role);
        if (slot == null || slot.connection() != connection) {
            throw new IllegalStateException("Seat " + role + " is not held by this connection");
        }
        PlayerSlot other = players.get(role.opponent());
        if (other != null && username.equals(other.username())) {
            throw new AuthException(AuthException.Reason.ALREADY_SEATED, username + " is already playing");
        }
        slot.seat(username);
    }

    /**
     * Frees the seat (or observer entry) if {@code connection} still holds it.
     */
    public synchronized boolean release(PeerRole role, SnapshotSink connection) {
        if (role == PeerRole.OBSERVER) {
            return observers.remove(connection);
        }
        PlayerSlot slot = players.get(role);
        if (slot == null || slot.connection() != connection) {
            return false;
        }
        players.remove(role);
        log.debug("Seat {} released", role.wireName());
        return true;
    }

    public synchronized boolean holds(PeerRole role, SnapshotSink connection) {
        PlayerSlot slot = players.get(role);
        return slot != null && slot.connection() == connection;
    }

    public synchronized Optional<PlayerSlot> slot(PeerRole role) {
        return Optional.ofNullable(players.get(role));
    }

    public synchronized Optional<PlayerSlot> seatedSlot(PeerRole role) {
        return slot(role).filter(PlayerSlot::isSeated);
    }

    public synchronized boolean bothSeated() {
        return seatedSlot(PeerRole.LEFT).isPresent() && seatedSlot(PeerRole.RIGHT).isPresent();
    }

    public synchronized boolean hasPlayers() {
        return !players.isEmpty();
    }

    public synchronized int playerCount() {
        return players.size();
    }

    public int observerCount() {
        return observers.size();
    }

    public Intent takeIntent(PeerRole role) {
        return slot(role).map(PlayerSlot::takeIntent).orElse(Intent.NONE);
    }

    /**
     * Offers the snapshot to every seat holder and observer. Never blocks on a peer.
     */
    public void broadcastSnapshot(StateSnapshot snapshot) {
        for (SnapshotSink sink : recipients()) {
            try {
                sink.offer(snapshot);
            } catch (RuntimeException e) {
                log.warn("Dropping snapshot for {}: {}", sink, e.getMessage());
            }
        }
    }

    public void disconnectAll() {
        for (SnapshotSink sink : recipients()) {
            sink.disconnect();
        }
    }

    private List<SnapshotSink> recipients() {
        List<SnapshotSink> targets;
        synchronized (this) {
            targets = new ArrayList<>(players.size() + observers.size());
            for (PlayerSlot slot : players.values()) {
                targets.add(slot.connection());
            }
        }
        targets.addAll(observers);
        return targets;
    }
}
