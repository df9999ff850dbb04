package uy.gub.bps.towerdefense.domain.model;

import java.util.List;

public record WaveDefinition(int number, double startDelay, List<SpawnGroup> groups) {

    public WaveDefinition {
        groups = List.copyOf(groups);
    }

    public int enemyCount() {
        return groups.stream().mapToInt(SpawnGroup::count).sum();
    }

    public boolean hasBoss() {
        return groups.stream().anyMatch(SpawnGroup::boss);
    }
}
