package uy.gub.bps.towerdefense.domain.model;

public enum ProjectileKind {
    /** Re-aims at its target every tick. */
    HOMING,
    /** Keeps the heading it was launched with. */
    BALLISTIC
}
