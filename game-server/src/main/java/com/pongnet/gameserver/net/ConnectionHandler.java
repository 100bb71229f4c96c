package com.pongnet.gameserver.net;

import com.pongnet.gameserver.game.Intent;
import com.pongnet.gameserver.game.PeerRole;
import com.pongnet.gameserver.game.StateSnapshot;
import com.pongnet.gameserver.security.CryptoException;
import com.pongnet.gameserver.security.SecureChannel;
import com.pongnet.gameserver.session.GameSession;
import com.pongnet.gameserver.session.SnapshotSink;
import com.pongnet.gameserver.user.AppUser;
import com.pongnet.gameserver.user.AuthException;
import com.pongnet.gameserver.user.UserCredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one peer through handshake, authentication and gameplay.
 * <p>
 * Runs on its own thread. During gameplay it alternates between waiting up to one tick interval
 * for an input line and sending the newest snapshot offered by the registry, so a slow peer only
 * ever holds up its own thread.
 */
public class ConnectionHandler implements Runnable, SnapshotSink {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final Set<String> READY_SIGNALS = Set.of("ready", "reset");

    private final LineChannel channel;
    private final GameSession session;
    private final SecureChannel secureChannel;
    private final UserCredentialService credentials;
    private final AtomicReference<StateSnapshot> pending = new AtomicReference<>();

    private volatile ConnectionState state = ConnectionState.CONNECTED;
    private volatile PeerRole role;
    private volatile String username;
    private volatile boolean closed;

    public ConnectionHandler(LineChannel channel,
                             GameSession session,
                             SecureChannel secureChannel,
                             UserCredentialService credentials) {
        this.channel = channel;
        this.session = session;
        this.secureChannel = secureChannel;
        this.credentials = credentials;
    }

    /**
     * Claims a role for this peer. The server calls this on its accept thread so roles follow
     * accept order; {@link #run()} joins on its own if nobody did.
     */
    public PeerRole join() {
        if (role == null) {
            role = session.join(this);
        }
        return role;
    }

    @Override
    public void run() {
        try {
            join();
            channel.writeLine(session.handshakeLine(role));
            if (role.isPlayer()) {
                state = ConnectionState.AUTHENTICATING;
                username = authenticate();
            }
            state = ConnectionState.PLAYING;
            gameplayLoop();
        } catch (ProtocolException e) {
            log.warn("Protocol error from {}: {}", this, e.getMessage());
        } catch (CryptoException e) {
            log.warn("Dropping {}: {}", this, e.getMessage());
        } catch (ConnectionLostException e) {
            log.info("{} disconnected: {}", this, e.getMessage());
        } catch (IOException e) {
            if (closed) {
                log.debug("{} closed: {}", this, e.getMessage());
            } else {
                log.info("{} lost: {}", this, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure on {}", this, e);
        } finally {
            state = ConnectionState.DISCONNECTED;
            closed = true;
            session.leave(role, this);
            channel.close();
        }
    }

    private String authenticate() throws IOException {
        while (true) {
            String line = channel.readLine();
            AuthRequest request;
            try {
                request = AuthRequest.parse(line);
            } catch (ProtocolException e) {
                channel.writeLine("ERR malformed-request");
                throw e;
            }
            try {
                AppUser user = request.register()
                        ? credentials.register(request.username(), request.password())
                        : credentials.verify(request.username(), request.password());
                session.seat(role, this, user.getUsername());
                channel.writeLine(request.register() ? "OK registered" : "OK logged-in");
                log.info("{} authenticated as {} from {}", role.wireName(), user.getUsername(), channel.remoteAddress());
                return user.getUsername();
            } catch (AuthException e) {
                log.info("Rejected {} from {}: {}", request, channel.remoteAddress(), e.reason().code());
                channel.writeLine("ERR " + e.reason().code());
            }
        }
    }

    private void gameplayLoop() throws IOException {
        Duration poll = session.properties().tickInterval();
        while (!closed) {
            Optional<String> line = channel.readLine(poll);
            if (line.isPresent()) {
                handleLine(line.get());
            }
            StateSnapshot snapshot = pending.getAndSet(null);
            if (snapshot != null) {
                transmit(snapshot);
            }
        }
    }

    private void handleLine(String raw) {
        if (!role.isPlayer()) {
            if (!raw.isEmpty()) {
                throw new ProtocolException("observers may only send empty lines");
            }
            return;
        }
        String payload = secureChannel.decode(raw);
        Optional<Intent> intent = Intent.fromPayload(payload);
        if (intent.isPresent()) {
            if (state == ConnectionState.PLAYING) {
                session.applyInput(role, intent.get());
            }
            return;
        }
        if (READY_SIGNALS.contains(payload)) {
            onReady();
            return;
        }
        throw new ProtocolException("unexpected payload '" + abbreviate(payload) + "'");
    }

    private void onReady() {
        if (state != ConnectionState.GAME_OVER_WAIT) {
            log.debug("Ignoring ready from {} in state {}", this, state);
            return;
        }
        if (session.signalReady(role)) {
            state = ConnectionState.READY;
        }
    }

    private void transmit(StateSnapshot snapshot) throws IOException {
        String line = snapshot.toWireLine();
        if (!role.isPlayer()) {
            channel.writeLine(line);
            return;
        }
        channel.writeLine(secureChannel.encode(line));
        if (snapshot.gameOver()) {
            if (state == ConnectionState.PLAYING) {
                state = ConnectionState.GAME_OVER_WAIT;
            }
        } else if (state == ConnectionState.GAME_OVER_WAIT || state == ConnectionState.READY) {
            state = ConnectionState.PLAYING;
        }
    }

    @Override
    public void offer(StateSnapshot snapshot) {
        if (!closed) {
            pending.set(snapshot);
        }
    }

    @Override
    public void disconnect() {
        closed = true;
        channel.close();
    }

    public ConnectionState state() {
        return state;
    }

    public PeerRole role() {
        return role;
    }

    @Override
    public String toString() {
        String who = username != null ? username : channel.remoteAddress();
        return (role != null ? role.wireName() : "peer") + "[" + who + "]";
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 32 ? payload : payload.substring(0, 32) + "...";
    }
}
