package com.pongnet.gameserver.session;

import com.pongnet.gameserver.config.GameProperties;
import com.pongnet.gameserver.game.GamePhase;
import com.pongnet.gameserver.game.Intent;
import com.pongnet.gameserver.game.PeerRole;
import com.pongnet.gameserver.game.SimulationEngine;
import com.pongnet.gameserver.game.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The one running session: owns the seats, the simulation and the rematch state, and is the
 * only entry point connection handlers use.
 */
public class GameSession {
    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    private final GameProperties properties;
    private final SessionRegistry registry;
    private final SimulationEngine engine;

    public GameSession(GameProperties properties, SessionRegistry registry, SimulationEngine engine) {
        this.properties = properties;
        this.registry = registry;
        this.engine = engine;
    }

    public PeerRole join(SnapshotSink connection) {
        PeerRole role = registry.assignRole(connection);
        log.info("Connection joined as {} (players={}, observers={})",
                role.wireName(), registry.playerCount(), registry.observerCount());
        return role;
    }

    public String handshakeLine(PeerRole role) {
        return properties.courtWidth() + " " + properties.courtHeight() + " " + role.wireName();
    }

    public void seat(PeerRole role, SnapshotSink connection, String username) {
        registry.seat(role, connection, username);
        log.info("{} seated on the {}", username, role.wireName());
    }

    public void applyInput(PeerRole role, Intent intent) {
        if (!role.isPlayer()) return;
        registry.slot(role).ifPresent(slot -> slot.offerIntent(intent));
    }

    public boolean signalReady(PeerRole role) {
        return role.isPlayer() && engine.markReady(role);
    }

    public void leave(PeerRole role, SnapshotSink connection) {
        if (role == null) return;
        if (role.isPlayer()) {
            engine.removePlayer(role, connection);
        } else {
            registry.release(PeerRole.OBSERVER, connection);
        }
    }

    public StateSnapshot latestSnapshot() {
        return engine.latestSnapshot();
    }

    public GamePhase phase() {
        return engine.phase();
    }

    public GameProperties properties() {
        return properties;
    }

    public int playerCount() {
        return registry.playerCount();
    }

    public int observerCount() {
        return registry.observerCount();
    }
}
