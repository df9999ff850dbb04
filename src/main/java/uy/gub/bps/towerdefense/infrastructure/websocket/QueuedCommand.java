package uy.gub.bps.towerdefense.infrastructure.websocket;

import uy.gub.bps.towerdefense.domain.service.GameEngine;

import java.util.function.Function;

/**
 * A client command waiting for the game loop. {@code sessionId} is where a rejection is reported.
 */
public record QueuedCommand(String sessionId, String name, Function<GameEngine, ?> action) {
}
