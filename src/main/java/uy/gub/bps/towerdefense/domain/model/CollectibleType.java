package uy.gub.bps.towerdefense.domain.model;

/**
 * What a pickup does. Instant types carry an amount, timed types grant a power-up for {@code duration} seconds.
 */
public enum CollectibleType {
    HEALTH(25, 0, null),
    EXTRA_CURRENCY(25, 0, null),
    DAMAGE_BOOST(0, 10, PowerUpType.DAMAGE_BOOST),
    FIRE_RATE_BOOST(0, 8, PowerUpType.FIRE_RATE_BOOST),
    SPEED_BOOST(0, 12, PowerUpType.SPEED_BOOST),
    SHIELD(0, 15, PowerUpType.SHIELD);

    public final double amount;
    public final double duration;
    public final PowerUpType powerUp;

    CollectibleType(double amount, double duration, PowerUpType powerUp) {
        this.amount = amount;
        this.duration = duration;
        this.powerUp = powerUp;
    }

    public boolean isTimed() {
        return powerUp != null;
    }
}
