package com.pongnet.gameserver.net;

import com.pongnet.gameserver.security.SecureChannel;
import com.pongnet.gameserver.session.GameSession;
import com.pongnet.gameserver.user.UserCredentialService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class GameServerStarter {
    private final int tcpPort;
    private final GameSession gameSession;
    private final SecureChannel secureChannel;
    private final UserCredentialService credentialService;

    public GameServerStarter(@Value("${pong.tcp.port:6000}") int tcpPort,
                             GameSession gameSession,
                             SecureChannel secureChannel,
                             UserCredentialService credentialService) {
        this.tcpPort = tcpPort;
        this.gameSession = gameSession;
        this.secureChannel = secureChannel;
        this.credentialService = credentialService;
    }

    @Bean(destroyMethod = "stop")
    public GameTcpServer gameTcpServer() throws IOException {
        GameTcpServer server = new GameTcpServer(tcpPort, gameSession, secureChannel, credentialService);
        server.start();
        return server;
    }
}
