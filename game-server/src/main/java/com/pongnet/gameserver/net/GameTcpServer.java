package com.pongnet.gameserver.net;

import com.pongnet.gameserver.game.PeerRole;
import com.pongnet.gameserver.security.SecureChannel;
import com.pongnet.gameserver.session.GameSession;
import com.pongnet.gameserver.user.UserCredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts gameplay connections and runs each one on its own {@link ConnectionHandler} thread.
 */
public class GameTcpServer implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(GameTcpServer.class);

    private final int port;
    private final GameSession session;
    private final SecureChannel secureChannel;
    private final UserCredentialService credentialService;
    private final AtomicInteger connectionIds = new AtomicInteger();
    private final ExecutorService connections = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "pong-conn-" + connectionIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final Set<ConnectionHandler> active = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;
    private ServerSocket server;
    private Thread acceptThread;

    public GameTcpServer(int port,
                         GameSession session,
                         SecureChannel secureChannel,
                         UserCredentialService credentialService) {
        this.port = port;
        this.session = session;
        this.secureChannel = secureChannel;
        this.credentialService = credentialService;
    }

    public synchronized void start() throws IOException {
        if (running) return;
        server = new ServerSocket();
        server.setReuseAddress(true);
        server.bind(new InetSocketAddress("0.0.0.0", port));
        running = true;
        acceptThread = new Thread(this, "pong-accept");
        acceptThread.start();
        log.info("Game server listening on :{}", server.getLocalPort());
    }

    public synchronized void stop() {
        running = false;
        try {
            if (server != null) server.close();
        } catch (IOException e) {
            log.warn("Error closing server socket", e);
        }
        active.forEach(ConnectionHandler::disconnect);
        connections.shutdownNow();
        try {
            if (acceptThread != null) acceptThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Game server stopped");
    }

    @Override
    public void run() {
        while (running) {
            Socket socket;
            try {
                socket = server.accept();
            } catch (SocketException e) {
                if (running) log.error("Accept failed", e);
                continue;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            ConnectionHandler handler = null;
            try {
                socket.setTcpNoDelay(true);
                handler = new ConnectionHandler(
                        new SocketLineChannel(socket), session, secureChannel, credentialService);
                // roles are handed out here, in accept order, not on the pooled threads
                PeerRole role = handler.join();
                active.add(handler);
                ConnectionHandler accepted = handler;
                connections.execute(() -> {
                    try {
                        accepted.run();
                    } finally {
                        active.remove(accepted);
                    }
                });
                log.info("Accepted {} as {}", socket.getRemoteSocketAddress(), role.wireName());
            } catch (IOException | RejectedExecutionException e) {
                log.warn("Could not start handler for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                if (handler != null) {
                    active.remove(handler);
                    session.leave(handler.role(), handler);
                }
                closeQuietly(socket);
            }
        }
    }

    public int getLocalPort() {
        ServerSocket s = server;
        return s == null ? -1 : s.getLocalPort();
    }

    public int activeConnections() {
        return active.size();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }
}
