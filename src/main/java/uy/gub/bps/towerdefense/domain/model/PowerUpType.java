package uy.gub.bps.towerdefense.domain.model;

public enum PowerUpType {
    DAMAGE_BOOST(1.5),
    FIRE_RATE_BOOST(2.0),
    SPEED_BOOST(1.5),
    SHIELD(0);

    public final double multiplier;

    PowerUpType(double multiplier) {
        this.multiplier = multiplier;
    }
}
