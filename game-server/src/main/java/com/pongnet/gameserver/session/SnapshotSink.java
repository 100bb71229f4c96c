package com.pongnet.gameserver.session;

import com.pongnet.gameserver.game.StateSnapshot;

/**
 * A connected peer as seen by the registry.
 */
public interface SnapshotSink {

    /** Hands over the newest snapshot. Must return immediately; an undelivered older one may be dropped. */
    void offer(StateSnapshot snapshot);

    /** Closes the peer's connection; its handler then releases the seat. */
    void disconnect();
}
