package com.pongnet.gameserver.game;

import com.pongnet.gameserver.session.SnapshotSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingSink implements SnapshotSink {
    final List<StateSnapshot> received = new CopyOnWriteArrayList<>();
    volatile boolean disconnected;

    @Override
    public void offer(StateSnapshot snapshot) {
        received.add(snapshot);
    }

    @Override
    public void disconnect() {
        disconnected = true;
    }

    StateSnapshot last() {
        return received.get(received.size() - 1);
    }
}
