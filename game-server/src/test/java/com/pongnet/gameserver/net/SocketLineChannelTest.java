package com.pongnet.gameserver.net;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocketLineChannelTest {

    private ServerSocket server;
    private Socket client;
    private SocketLineChannel channel;

    @BeforeEach
    void connect() throws IOException {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
        channel = new SocketLineChannel(server.accept());
    }

    @AfterEach
    void close() throws IOException {
        channel.close();
        client.close();
        server.close();
    }

    private void clientWrites(String text) throws IOException {
        OutputStream out = client.getOutputStream();
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    void partialLineSurvivesATimeout() throws IOException {
        clientWrites("regis");

        assertThat(channel.readLine(Duration.ofMillis(50))).isEmpty();

        clientWrites("ter alice pw\r\nlogin");
        assertThat(channel.readLine(Duration.ofSeconds(2))).contains("register alice pw");
        assertThat(channel.readLine(Duration.ofMillis(50))).isEmpty();
    }

    @Test
    void severalLinesInOneSegmentAreSplit() throws IOException {
        clientWrites("up\ndown\n\n");

        assertThat(channel.readLine()).isEqualTo("up");
        assertThat(channel.readLine()).isEqualTo("down");
        assertThat(channel.readLine()).isEmpty();
    }

    @Test
    void peerCloseIsReportedAsConnectionLoss() throws IOException {
        client.close();

        assertThatThrownBy(() -> channel.readLine(Duration.ofSeconds(2)))
                .isInstanceOf(ConnectionLostException.class);
    }

    @Test
    void overlongLineIsAProtocolError() throws IOException {
        clientWrites("x".repeat(SocketLineChannel.MAX_LINE + 10));

        assertThatThrownBy(() -> channel.readLine(Duration.ofSeconds(2)))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void writtenLinesAreNewlineTerminated() throws IOException {
        channel.writeLine("640 480 left");

        byte[] expected = "640 480 left\n".getBytes(StandardCharsets.UTF_8);
        byte[] received = client.getInputStream().readNBytes(expected.length);
        assertThat(received).isEqualTo(expected);
    }
}
