package uy.gub.bps.towerdefense.infrastructure.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uy.gub.bps.towerdefense.domain.SimulationInvariantException;
import uy.gub.bps.towerdefense.domain.model.CommandResult;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.service.GameEngine;
import uy.gub.bps.towerdefense.domain.service.GameSession;

/**
 * The only thread that touches the simulation: drain commands, tick, publish.
 */
@Slf4j
@Component
@EnableScheduling
public class GameLoop {

    private final GameSession gameSession;
    private final GameWebSocketHandler gameWebSocketHandler;
    private final double deltaSeconds;

    public GameLoop(GameSession gameSession, GameWebSocketHandler gameWebSocketHandler, SimulationSettings settings) {
        this.gameSession = gameSession;
        this.gameWebSocketHandler = gameWebSocketHandler;
        this.deltaSeconds = 1.0 / settings.getTicksPerSecond();
    }

    @Scheduled(fixedRateString = "#{1000 / ${tower-defense.ticks-per-second:30}}")
    public void run() {
        QueuedCommand command;
        while ((command = gameWebSocketHandler.pollCommand()) != null) {
            apply(command);
        }
        try {
            gameSession.tick(deltaSeconds);
        } catch (RuntimeException e) {
            log.error("Tick aborted, pausing game: {}", e.getMessage(), e);
            gameSession.execute(GameEngine::pause);
        }
        gameWebSocketHandler.broadcastState();
    }

    void apply(QueuedCommand command) {
        try {
            Object result = gameSession.execute(command.action());
            if (result instanceof CommandResult<?> outcome && !outcome.isSuccess()) {
                log.debug("{} from {} rejected: {}", command.name(), command.sessionId(), outcome.failure());
                gameWebSocketHandler.reject(command.sessionId(), command.name(), outcome.failure());
            }
        } catch (SimulationInvariantException e) {
            log.error("Command {} aborted, pausing game: {}", command.name(), e.getMessage(), e);
            gameSession.execute(GameEngine::pause);
        } catch (RuntimeException e) {
            log.error("Error applying {} from session {}: {}", command.name(), command.sessionId(), e.getMessage(), e);
        }
    }
}
