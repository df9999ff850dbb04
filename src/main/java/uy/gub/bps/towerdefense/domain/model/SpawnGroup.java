package uy.gub.bps.towerdefense.domain.model;

/**
 * {@code count} enemies of one type spawned {@code delay} seconds apart.
 * {@code health} overrides the type's base health when not {@code null}.
 */
public record SpawnGroup(EnemyType type, int count, double delay, boolean boss, Double health) {

    public SpawnGroup {
        if (count < 0) {
            throw new IllegalArgumentException("Spawn count must not be negative: " + count);
        }
        if (delay < 0) {
            throw new IllegalArgumentException("Spawn delay must not be negative: " + delay);
        }
    }

    public static SpawnGroup of(EnemyType type, int count, double delay) {
        return new SpawnGroup(type, count, delay, false, null);
    }

    public static SpawnGroup boss(EnemyType type) {
        return new SpawnGroup(type, 1, 0, true, null);
    }

    public SpawnGroup withHealth(double value) {
        return new SpawnGroup(type, count, delay, boss, value);
    }
}
