package uy.gub.bps.towerdefense.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tower implements GameObject {
    private long id;
    private TowerType type;
    private Cell cell;
    private double baseDamage;
    private double baseRange;
    private double baseFireRate;
    private int maxLevel;
    @Builder.Default
    private Map<TowerAttribute, Integer> upgradeLevels = new EnumMap<>(TowerAttribute.class);
    /** Placement cost plus every upgrade paid for; drives the sell refund. */
    private int cumulativeSpend;
    private double cooldown;

    @Override
    public long getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return cell.center();
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.TOWER;
    }

    public int getLevel(TowerAttribute attribute) {
        return upgradeLevels.getOrDefault(attribute, 0);
    }

    public void incrementLevel(TowerAttribute attribute) {
        upgradeLevels.merge(attribute, 1, Integer::sum);
    }

    public double getDamage() {
        return baseDamage * (1 + getLevel(TowerAttribute.DAMAGE) * TowerAttribute.DAMAGE.bonusPerLevel);
    }

    public double getRange() {
        return baseRange * (1 + getLevel(TowerAttribute.RANGE) * TowerAttribute.RANGE.bonusPerLevel);
    }

    public double getFireRate() {
        return baseFireRate * (1 + getLevel(TowerAttribute.FIRE_RATE) * TowerAttribute.FIRE_RATE.bonusPerLevel);
    }

    public boolean isArmed() {
        return type.armed && baseFireRate > 0;
    }
}
