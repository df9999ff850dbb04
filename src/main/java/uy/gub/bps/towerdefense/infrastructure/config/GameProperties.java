package uy.gub.bps.towerdefense.infrastructure.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Difficulty;
import uy.gub.bps.towerdefense.domain.model.OrphanPolicy;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.TargetingPolicy;
import uy.gub.bps.towerdefense.domain.model.TowerType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@code tower-defense.*} in application.yml. Anything left out keeps the {@link SimulationSettings} default.
 */
@Data
@ConfigurationProperties(prefix = "tower-defense")
public class GameProperties {
    private static final SimulationSettings DEFAULTS = SimulationSettings.defaults();

    private int gridWidth = DEFAULTS.getGridWidth();
    private int gridHeight = DEFAULTS.getGridHeight();
    private List<CellProperties> spawns = new ArrayList<>(List.of(CellProperties.of(DEFAULTS.getSpawns().get(0))));
    private CellProperties goal = CellProperties.of(DEFAULTS.getGoal());
    private List<CellProperties> blocked = new ArrayList<>();
    private boolean diagonalMovement = DEFAULTS.isDiagonalMovement();

    private int startingCurrency = DEFAULTS.getStartingCurrency();
    private int startingLives = DEFAULTS.getStartingLives();
    private double sellRefundRate = DEFAULTS.getSellRefundRate();
    private double interestRate = DEFAULTS.getInterestRate();
    private int maxInterest = DEFAULTS.getMaxInterest();
    private int perfectWaveBonus = DEFAULTS.getPerfectWaveBonus();
    private int maxTowerLevel = DEFAULTS.getMaxTowerLevel();
    private int maxPlayerLevel = DEFAULTS.getMaxPlayerLevel();
    private Map<TowerType, Integer> towerCosts = new EnumMap<>(TowerType.class);

    private Difficulty difficulty = DEFAULTS.getDifficulty();
    private TargetingPolicy targetingPolicy = DEFAULTS.getTargetingPolicy();
    private OrphanPolicy orphanPolicy = DEFAULTS.getOrphanPolicy();
    private double collectibleDropChance = DEFAULTS.getCollectibleDropChance();
    private long randomSeed = DEFAULTS.getRandomSeed();
    private int totalWaves = DEFAULTS.getTotalWaves();
    private boolean playerEnabled = DEFAULTS.isPlayerEnabled();
    private int ticksPerSecond = DEFAULTS.getTicksPerSecond();
    private int scoreHistorySize = 20;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CellProperties {
        private int x;
        private int y;

        static CellProperties of(Cell cell) {
            return new CellProperties(cell.x(), cell.y());
        }

        Cell toCell() {
            return new Cell(x, y);
        }
    }

    public SimulationSettings toSettings() {
        if (ticksPerSecond <= 0) {
            throw new IllegalArgumentException("tower-defense.ticks-per-second must be positive: " + ticksPerSecond);
        }
        return SimulationSettings.builder()
                .gridWidth(gridWidth)
                .gridHeight(gridHeight)
                .spawns(spawns.stream().map(CellProperties::toCell).toList())
                .goal(goal.toCell())
                .blocked(blocked.stream().map(CellProperties::toCell).toList())
                .diagonalMovement(diagonalMovement)
                .startingCurrency(startingCurrency)
                .startingLives(startingLives)
                .sellRefundRate(sellRefundRate)
                .interestRate(interestRate)
                .maxInterest(maxInterest)
                .perfectWaveBonus(perfectWaveBonus)
                .maxTowerLevel(maxTowerLevel)
                .maxPlayerLevel(maxPlayerLevel)
                .towerCosts(towerCosts.isEmpty() ? new EnumMap<>(TowerType.class) : new EnumMap<>(towerCosts))
                .difficulty(difficulty)
                .targetingPolicy(targetingPolicy)
                .orphanPolicy(orphanPolicy)
                .collectibleDropChance(collectibleDropChance)
                .randomSeed(randomSeed)
                .totalWaves(totalWaves)
                .playerEnabled(playerEnabled)
                .ticksPerSecond(ticksPerSecond)
                .build();
    }
}
