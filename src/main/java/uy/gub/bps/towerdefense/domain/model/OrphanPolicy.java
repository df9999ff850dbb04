package uy.gub.bps.towerdefense.domain.model;

/**
 * What a homing projectile does when its target is gone before impact.
 */
public enum OrphanPolicy {
    DISCARD,
    /** Keep flying on the last heading and hit whatever it meets. */
    CONTINUE
}
