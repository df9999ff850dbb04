package uy.gub.bps.towerdefense.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Enemy implements GameObject {
    private long id;
    private EnemyType type;
    private Route route;
    /** Distance travelled along {@link #route}. */
    private double progress;
    private double health;
    private double maxHealth;
    private double baseSpeed;
    @Builder.Default
    private double healthMultiplier = 1.0;
    @Builder.Default
    private double speedMultiplier = 1.0;
    private int reward;
    private int scoreValue;
    private int livesCost;
    private double contactDamage;
    private double contactCooldown;
    private boolean boss;
    private int wave;

    @Override
    public long getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return route.positionAt(progress);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ENEMY;
    }

    public double getSpeed() {
        return baseSpeed * speedMultiplier;
    }

    public boolean isAlive() {
        return health > 0;
    }

    public boolean hasReachedGoal() {
        return progress >= route.length();
    }

    /** The cell last passed and the cell being walked into. */
    public Cell getCurrentCell() {
        return route.cells().get(route.segmentAt(progress));
    }

    public Cell getNextCell() {
        int i = route.segmentAt(progress);
        return route.cells().get(Math.min(i + 1, route.size() - 1));
    }
}
