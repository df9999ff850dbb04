package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.EnemyType;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.SpawnGroup;
import uy.gub.bps.towerdefense.domain.model.WaveDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * The waves of one game: the configured list, or a generated sequence when none is configured.
 */
public class WavePlan {
    static final int BASE_COUNT = 5;
    static final int COUNT_INCREMENT = 2;
    static final int BOSS_INTERVAL = 5;

    private final List<WaveDefinition> waves;

    public WavePlan(List<WaveDefinition> waves) {
        if (waves.isEmpty()) {
            throw new IllegalArgumentException("A game needs at least one wave");
        }
        this.waves = List.copyOf(waves);
    }

    public static WavePlan from(SimulationSettings settings) {
        if (settings.getWaves() != null && !settings.getWaves().isEmpty()) {
            return new WavePlan(settings.getWaves());
        }
        return generated(settings.getTotalWaves());
    }

    public static WavePlan generated(int totalWaves) {
        List<WaveDefinition> result = new ArrayList<>();
        for (int n = 1; n <= totalWaves; n++) {
            result.add(generate(n));
        }
        return new WavePlan(result);
    }

    static WaveDefinition generate(int n) {
        int count = BASE_COUNT + COUNT_INCREMENT * (n - 1);
        double delay = Math.max(0.5, 1.0 - 0.05 * (n - 1));
        List<SpawnGroup> groups = new ArrayList<>();
        if (n >= 4) {
            int tanks = count / 5;
            int fast = count / 3;
            groups.add(SpawnGroup.of(EnemyType.BASIC, count - tanks - fast, delay));
            groups.add(SpawnGroup.of(EnemyType.FAST, fast, delay * 0.6));
            groups.add(SpawnGroup.of(EnemyType.TANK, tanks, delay * 1.5));
        } else if (n == 3) {
            groups.add(SpawnGroup.of(EnemyType.BASIC, count - 3, delay));
            groups.add(SpawnGroup.of(EnemyType.FAST, 3, 0.6));
        } else {
            groups.add(SpawnGroup.of(EnemyType.BASIC, count, delay));
        }
        if (n % BOSS_INTERVAL == 0) {
            groups.add(SpawnGroup.boss(n >= 10 ? EnemyType.TANK : EnemyType.BASIC));
        }
        return new WaveDefinition(n, 2.0, groups);
    }

    public int size() {
        return waves.size();
    }

    public WaveDefinition wave(int number) {
        if (number < 1 || number > waves.size()) {
            throw new IllegalArgumentException("No wave " + number + " in a plan of " + waves.size());
        }
        return waves.get(number - 1);
    }

    public boolean isFinal(int number) {
        return number >= waves.size();
    }
}
