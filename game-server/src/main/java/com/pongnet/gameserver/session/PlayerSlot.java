package com.pongnet.gameserver.session;

import com.pongnet.gameserver.game.Intent;
import com.pongnet.gameserver.game.PeerRole;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A LEFT or RIGHT seat held by one connection for as long as it stays connected.
 */
public final class PlayerSlot {
    private final PeerRole role;
    private final SnapshotSink connection;
    private final AtomicReference<Intent> latestIntent = new AtomicReference<>(Intent.NONE);
    private volatile String username;
    private volatile boolean readyForRematch;

    PlayerSlot(PeerRole role, SnapshotSink connection) {
        this.role = role;
        this.connection = connection;
    }

    public PeerRole role() {
        return role;
    }

    public SnapshotSink connection() {
        return connection;
    }

    public String username() {
        return username;
    }

    public boolean isSeated() {
        return username != null;
    }

    void seat(String username) {
        this.username = username;
    }

    /** Overwrites any intent not yet consumed by a tick. */
    public void offerIntent(Intent intent) {
        latestIntent.set(intent);
    }

    public Intent takeIntent() {
        return latestIntent.getAndSet(Intent.NONE);
    }

    public boolean isReadyForRematch() {
        return readyForRematch;
    }

    public void setReadyForRematch(boolean readyForRematch) {
        this.readyForRematch = readyForRematch;
    }
}
