package com.pongnet.gameserver.config;

import com.pongnet.gameserver.game.MatchResultListener;
import com.pongnet.gameserver.game.RematchCoordinator;
import com.pongnet.gameserver.game.SimulationEngine;
import com.pongnet.gameserver.session.GameSession;
import com.pongnet.gameserver.session.SessionRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class GameConfig {

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean
    public RematchCoordinator rematchCoordinator(SessionRegistry registry) {
        return new RematchCoordinator(registry);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SimulationEngine simulationEngine(GameProperties properties,
                                             SessionRegistry registry,
                                             RematchCoordinator rematchCoordinator,
                                             MatchResultListener resultListener) {
        return new SimulationEngine(properties, registry, rematchCoordinator, resultListener);
    }

    @Bean
    public GameSession gameSession(GameProperties properties, SessionRegistry registry, SimulationEngine engine) {
        return new GameSession(properties, registry, engine);
    }
}
