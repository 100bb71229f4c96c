package com.pongnet.gameserver.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link LineChannel} over a blocking TCP socket. Bytes are accumulated across reads until a
 * newline is seen, so a read timeout never loses part of a line.
 */
public class SocketLineChannel implements LineChannel {
    private static final Logger log = LoggerFactory.getLogger(SocketLineChannel.class);
    static final int MAX_LINE = 16 * 1024;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final String remote;
    private final byte[] lineBuffer = new byte[MAX_LINE];
    private int filled;

    public SocketLineChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.remote = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public String readLine() throws IOException {
        return nextLine(0);
    }

    @Override
    public Optional<String> readLine(Duration timeout) throws IOException {
        int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        return Optional.ofNullable(nextLine(millis));
    }

    /** A timeout of 0 waits forever; otherwise returns {@code null} when the timeout expires. */
    private String nextLine(int timeoutMillis) throws IOException {
        while (true) {
            String line = extractLine();
            if (line != null) return line;
            if (filled == lineBuffer.length) {
                throw new ProtocolException("line longer than " + MAX_LINE + " bytes");
            }
            socket.setSoTimeout(timeoutMillis);
            int n;
            try {
                n = in.read(lineBuffer, filled, lineBuffer.length - filled);
            } catch (SocketTimeoutException e) {
                return null;
            }
            if (n == -1) {
                throw new ConnectionLostException("peer closed the connection");
            }
            filled += n;
        }
    }

    private String extractLine() {
        for (int i = 0; i < filled; i++) {
            if (lineBuffer[i] != '\n') continue;
            int end = i > 0 && lineBuffer[i - 1] == '\r' ? i - 1 : i;
            String line = new String(lineBuffer, 0, end, StandardCharsets.UTF_8);
            int rest = filled - i - 1;
            System.arraycopy(lineBuffer, i + 1, lineBuffer, 0, rest);
            filled = rest;
            return line;
        }
        return null;
    }

    @Override
    public void writeLine(String line) throws IOException {
        byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);
        synchronized (out) {
            out.write(bytes);
            out.flush();
        }
    }

    @Override
    public String remoteAddress() {
        return remote;
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing {}: {}", remote, e.getMessage());
        }
    }
}
