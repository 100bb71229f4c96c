package com.pongnet.gameserver.net;

import com.pongnet.gameserver.config.GameProperties;
import com.pongnet.gameserver.game.RematchCoordinator;
import com.pongnet.gameserver.game.SimulationEngine;
import com.pongnet.gameserver.security.SecureChannel;
import com.pongnet.gameserver.session.GameSession;
import com.pongnet.gameserver.session.SessionRegistry;
import com.pongnet.gameserver.user.UserCredentialService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.encrypt.AesBytesEncryptor;
import org.springframework.security.crypto.keygen.KeyGenerators;

import javax.crypto.spec.SecretKeySpec;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GameTcpServerTest {

    private SessionRegistry registry;
    private GameTcpServer server;

    @BeforeEach
    void start() throws IOException {
        GameProperties props = GameProperties.defaults();
        registry = new SessionRegistry();
        SimulationEngine engine = new SimulationEngine(props, registry, new RematchCoordinator(registry), null);
        SecureChannel secureChannel = new SecureChannel(new AesBytesEncryptor(
                new SecretKeySpec(KeyGenerators.secureRandom(32).generateKey(), "AES"),
                KeyGenerators.secureRandom(16), AesBytesEncryptor.CipherAlgorithm.GCM));
        server = new GameTcpServer(0, new GameSession(props, registry, engine), secureChannel,
                mock(UserCredentialService.class));
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
        socket.setSoTimeout(5_000);
        return socket;
    }

    private static String handshake(Socket socket) throws IOException {
        return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8)).readLine();
    }

    @RepeatedTest(25)
    void rolesFollowConnectionOrder() throws IOException {
        try (Socket first = connect(); Socket second = connect(); Socket third = connect()) {
            assertThat(handshake(first)).isEqualTo("640 480 left");
            assertThat(handshake(second)).isEqualTo("640 480 right");
            assertThat(handshake(third)).isEqualTo("640 480 spectator");
        }
    }

    @Test
    void closedConnectionFreesItsSeat() throws Exception {
        try (Socket first = connect()) {
            assertThat(handshake(first)).isEqualTo("640 480 left");
        }
        long deadline = System.currentTimeMillis() + 5_000;
        while (registry.playerCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        try (Socket next = connect()) {
            assertThat(handshake(next)).isEqualTo("640 480 left");
        }
    }

    @Test
    void stopDisconnectsEveryPeer() throws IOException {
        Socket peer = connect();
        assertThat(handshake(peer)).isEqualTo("640 480 left");

        server.stop();

        assertThat(peer.getInputStream().read()).isEqualTo(-1);
        peer.close();
    }
}
