package com.pongnet.gameserver.web;

import com.pongnet.gameserver.net.GameTcpServer;
import com.pongnet.gameserver.session.GameSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness plus a glance at the running session.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final GameSession session;
    private final GameTcpServer tcpServer;

    public HealthController(GameSession session, GameTcpServer tcpServer) {
        this.session = session;
        this.tcpServer = tcpServer;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "tcpPort", tcpServer.getLocalPort(),
                "connections", tcpServer.activeConnections(),
                "phase", session.phase().name(),
                "players", session.playerCount(),
                "observers", session.observerCount()));
    }
}
