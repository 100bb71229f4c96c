package com.pongnet.gameserver.net;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Both ends of a fake peer connection: the handler reads {@code inbound} and writes
 * {@code outbound}; the test does the opposite.
 */
class InMemoryLineChannel implements LineChannel {
    private static final String EOF = new String("<eof>");

    final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    final BlockingQueue<String> outbound = new LinkedBlockingQueue<>();
    private final String name;
    private volatile boolean closed;

    InMemoryLineChannel(String name) {
        this.name = name;
    }

    void send(String line) {
        inbound.add(line);
    }

    void hangUp() {
        inbound.add(EOF);
    }

    String receive() throws InterruptedException {
        String line = outbound.poll(5, TimeUnit.SECONDS);
        if (line == null) {
            throw new AssertionError(name + " received nothing within 5s");
        }
        return line;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public String readLine() throws IOException {
        try {
            return unwrap(inbound.take());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionLostException("interrupted");
        }
    }

    @Override
    public Optional<String> readLine(Duration timeout) throws IOException {
        try {
            String line = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return line == null ? Optional.empty() : Optional.of(unwrap(line));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionLostException("interrupted");
        }
    }

    private String unwrap(String line) throws ConnectionLostException {
        if (line == EOF) {
            throw new ConnectionLostException("peer hung up");
        }
        return line;
    }

    @Override
    public void writeLine(String line) throws IOException {
        if (closed) {
            throw new IOException("channel closed");
        }
        outbound.add(line);
    }

    @Override
    public String remoteAddress() {
        return name;
    }

    @Override
    public void close() {
        closed = true;
        inbound.add(EOF);
    }
}
