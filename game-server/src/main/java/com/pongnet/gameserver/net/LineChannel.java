package com.pongnet.gameserver.net;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * A newline-delimited text connection to one peer.
 */
public interface LineChannel {

    /**
     * Blocks until a full line arrives.
     *
     * @throws ConnectionLostException when the peer has closed the connection
     */
    String readLine() throws IOException;

    /**
     * Waits at most {@code timeout} for a full line; a partial line is kept for the next call.
     */
    Optional<String> readLine(Duration timeout) throws IOException;

    void writeLine(String line) throws IOException;

    String remoteAddress();

    void close();
}
