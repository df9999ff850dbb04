package uy.gub.bps.towerdefense.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uy.gub.bps.towerdefense.domain.event.ChangeObserver;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.service.GameEngine;
import uy.gub.bps.towerdefense.domain.service.GameEngineImpl;
import uy.gub.bps.towerdefense.domain.service.GameSession;
import uy.gub.bps.towerdefense.domain.service.ScoreStore;
import uy.gub.bps.towerdefense.infrastructure.persistence.InMemoryScoreStore;

@Slf4j
@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class SimulationConfiguration {

    @Bean
    public SimulationSettings simulationSettings(GameProperties properties) {
        SimulationSettings settings = properties.toSettings();
        log.info("Map {}x{}, {} waves, difficulty {}", settings.getGridWidth(), settings.getGridHeight(),
                settings.waveCount(), settings.getDifficulty());
        return settings;
    }

    @Bean
    public GameEngine gameEngine(SimulationSettings settings) {
        return new GameEngineImpl(settings);
    }

    @Bean
    public ScoreStore scoreStore(GameProperties properties) {
        return new InMemoryScoreStore(properties.getScoreHistorySize());
    }

    @Bean
    public GameSession gameSession(GameEngine engine, ScoreStore scoreStore) {
        return new GameSession(engine, new ChangeObserver(), scoreStore);
    }
}
