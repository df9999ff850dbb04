package uy.gub.bps.towerdefense.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Projectile implements GameObject {
    private long id;
    private long ownerId;
    private ProjectileKind projectileKind;
    /** Homing target; {@code null} once a projectile flies ballistically. */
    private Long targetId;
    private Position origin;
    private Position position;
    /** Where the last move started; hits are tested along the whole step. */
    private Position previousPosition;
    private double vx;
    private double vy;
    private double speed;
    private double damage;
    private double maxTravel;
    @Builder.Default
    private double distanceTravelled = 0;

    @Override
    public long getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PROJECTILE;
    }

    public boolean isHoming() {
        return projectileKind == ProjectileKind.HOMING && targetId != null;
    }

    public boolean isSpent() {
        return distanceTravelled >= maxTravel;
    }
}
