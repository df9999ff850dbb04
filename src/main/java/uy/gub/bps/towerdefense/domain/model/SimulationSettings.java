package uy.gub.bps.towerdefense.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a simulation needs to know about the map and the rules. Handed explicitly to every subsystem.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SimulationSettings {

    // map
    @Builder.Default
    private int gridWidth = 20;
    @Builder.Default
    private int gridHeight = 12;
    @Builder.Default
    private List<Cell> spawns = new ArrayList<>(List.of(new Cell(0, 5)));
    @Builder.Default
    private Cell goal = new Cell(19, 5);
    @Builder.Default
    private List<Cell> blocked = new ArrayList<>();
    @Builder.Default
    private boolean diagonalMovement = false;

    // economy
    @Builder.Default
    private int startingCurrency = 100;
    @Builder.Default
    private int startingLives = 10;
    @Builder.Default
    private double sellRefundRate = 0.7;
    @Builder.Default
    private double interestRate = 0.02;
    @Builder.Default
    private int maxInterest = 50;
    @Builder.Default
    private int perfectWaveBonus = 500;
    @Builder.Default
    private int maxTowerLevel = 10;
    @Builder.Default
    private int maxPlayerLevel = 10;
    @Builder.Default
    private Map<TowerType, Integer> towerCosts = new EnumMap<>(TowerType.class);

    // rules
    @Builder.Default
    private Difficulty difficulty = Difficulty.NORMAL;
    @Builder.Default
    private TargetingPolicy targetingPolicy = TargetingPolicy.NEAREST;
    @Builder.Default
    private OrphanPolicy orphanPolicy = OrphanPolicy.DISCARD;
    @Builder.Default
    private double projectileHitRadius = 0.3;
    @Builder.Default
    private double collectibleDropChance = 0.1;
    @Builder.Default
    private double collectibleLifetime = 20;
    @Builder.Default
    private double pickupRadius = 0.75;
    @Builder.Default
    private long randomSeed = 42L;

    // waves
    @Builder.Default
    private int totalWaves = 10;
    /** Explicit waves; when empty the generated plan is used. */
    @Builder.Default
    private List<WaveDefinition> waves = new ArrayList<>();

    // player
    @Builder.Default
    private boolean playerEnabled = true;
    @Builder.Default
    private double playerHealth = 75;
    @Builder.Default
    private double playerDamage = 11;
    @Builder.Default
    private double playerSpeed = 3.5;
    @Builder.Default
    private double playerFireRate = 1.5;
    @Builder.Default
    private double playerRange = 4;
    @Builder.Default
    private double contactRadius = 0.6;

    @Builder.Default
    private int ticksPerSecond = 30;

    public static SimulationSettings defaults() {
        return SimulationSettings.builder().build();
    }

    public int towerCost(TowerType type) {
        Integer override = towerCosts == null ? null : towerCosts.get(type);
        return override != null ? override : type.cost;
    }

    public int waveCount() {
        return waves == null || waves.isEmpty() ? totalWaves : waves.size();
    }
}
