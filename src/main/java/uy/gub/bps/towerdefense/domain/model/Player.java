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
public class Player implements GameObject {
    private long id;
    private Position position;
    private double health;
    private double baseMaxHealth;
    private double baseDamage;
    private double baseSpeed;
    private double baseFireRate;
    private double range;
    private int maxLevel;
    @Builder.Default
    private Map<PlayerAttribute, Integer> upgradeLevels = new EnumMap<>(PlayerAttribute.class);
    /** Active power-ups, mapped to the simulation time they expire at. */
    @Builder.Default
    private Map<PowerUpType, Double> activeEffects = new EnumMap<>(PowerUpType.class);
    @Builder.Default
    private double vx = 0;
    @Builder.Default
    private double vy = 0;
    private double cooldown;

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
        return EntityKind.PLAYER;
    }

    public int getLevel(PlayerAttribute attribute) {
        return upgradeLevels.getOrDefault(attribute, 0);
    }

    public void incrementLevel(PlayerAttribute attribute) {
        upgradeLevels.merge(attribute, 1, Integer::sum);
    }

    public boolean hasEffect(PowerUpType type) {
        return activeEffects.containsKey(type);
    }

    private double bonus(PlayerAttribute attribute) {
        return 1 + getLevel(attribute) * attribute.bonusPerLevel;
    }

    private double boost(PowerUpType type) {
        return hasEffect(type) ? type.multiplier : 1.0;
    }

    public double getMaxHealth() {
        return baseMaxHealth * bonus(PlayerAttribute.HEALTH);
    }

    public double getDamage() {
        return baseDamage * bonus(PlayerAttribute.DAMAGE) * boost(PowerUpType.DAMAGE_BOOST);
    }

    public double getSpeed() {
        return baseSpeed * bonus(PlayerAttribute.SPEED) * boost(PowerUpType.SPEED_BOOST);
    }

    public double getFireRate() {
        return baseFireRate * bonus(PlayerAttribute.FIRE_RATE) * boost(PowerUpType.FIRE_RATE_BOOST);
    }

    public double getRegeneration() {
        return getLevel(PlayerAttribute.REGENERATION) * PlayerAttribute.REGENERATION.bonusPerLevel;
    }
}
