package uy.gub.bps.towerdefense.infrastructure.websocket;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.InputMessage;
import uy.gub.bps.towerdefense.domain.model.PlayerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerType;
import uy.gub.bps.towerdefense.domain.service.GameEngine;

import java.util.Optional;
import java.util.function.Function;

/**
 * Maps wire messages to engine commands. Payloads are comma separated, e.g. {@code PLACE_TOWER "4,3,SNIPER"}.
 */
@Slf4j
public final class CommandTranslator {

    private CommandTranslator() {
    }

    public static Optional<QueuedCommand> translate(String sessionId, InputMessage input) {
        if (input == null || input.getType() == null) {
            return Optional.empty();
        }
        String type = input.getType().toUpperCase();
        String[] args = split(input.getPayload());
        try {
            Function<GameEngine, ?> action = switch (type) {
                case "START" -> GameEngine::start;
                case "PAUSE" -> GameEngine::pause;
                case "RESUME" -> GameEngine::resume;
                case "RESET" -> GameEngine::reset;
                case "START_WAVE" -> GameEngine::startNextWave;
                case "PLACE_TOWER" -> placeTower(args);
                case "SELL_TOWER" -> {
                    long id = Long.parseLong(arg(args, 0));
                    yield engine -> engine.sellTower(id);
                }
                case "UPGRADE_TOWER" -> {
                    long id = Long.parseLong(arg(args, 0));
                    TowerAttribute attribute = TowerAttribute.valueOf(arg(args, 1).toUpperCase());
                    yield engine -> engine.upgradeTower(id, attribute);
                }
                case "UPGRADE_SELECTED" -> {
                    TowerAttribute attribute = TowerAttribute.valueOf(arg(args, 0).toUpperCase());
                    yield engine -> engine.upgradeSelectedTower(attribute);
                }
                case "UPGRADE_PLAYER" -> {
                    PlayerAttribute attribute = PlayerAttribute.valueOf(arg(args, 0).toUpperCase());
                    yield engine -> engine.upgradePlayer(attribute);
                }
                case "SELECT_TOWER_TYPE" -> {
                    TowerType towerType = args.length == 0 ? null : TowerType.valueOf(args[0].toUpperCase());
                    yield engine -> {
                        engine.setSelectedTowerType(towerType);
                        return towerType;
                    };
                }
                case "SELECT_TOWER" -> {
                    Long id = args.length == 0 ? null : Long.parseLong(args[0]);
                    yield engine -> engine.selectTower(id);
                }
                case "MOVE" -> {
                    double dx = Double.parseDouble(arg(args, 0));
                    double dy = Double.parseDouble(arg(args, 1));
                    yield engine -> engine.movePlayer(dx, dy);
                }
                default -> null;
            };
            if (action == null) {
                log.warn("Unknown command {} from session {}", type, sessionId);
                return Optional.empty();
            }
            return Optional.of(new QueuedCommand(sessionId, type, action));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} from session {}: {}", type, sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private static Function<GameEngine, ?> placeTower(String[] args) {
        Cell cell = new Cell(Integer.parseInt(arg(args, 0)), Integer.parseInt(arg(args, 1)));
        if (args.length > 2) {
            TowerType type = TowerType.valueOf(args[2].toUpperCase());
            return engine -> engine.placeTower(cell, type);
        }
        return engine -> engine.placeTower(cell);
    }

    private static String[] split(String payload) {
        if (payload == null || payload.isBlank()) {
            return new String[0];
        }
        String[] parts = payload.split(",");
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    private static String arg(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing argument " + (index + 1));
        }
        return args[index];
    }
}
