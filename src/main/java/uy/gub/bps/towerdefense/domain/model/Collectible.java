package uy.gub.bps.towerdefense.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Collectible implements GameObject {
    private long id;
    private CollectibleType type;
    private Position position;
    private double amount;
    private double duration;
    private double expiresAt;

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
        return EntityKind.COLLECTIBLE;
    }
}
