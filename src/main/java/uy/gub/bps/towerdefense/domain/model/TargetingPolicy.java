package uy.gub.bps.towerdefense.domain.model;

/**
 * How a shooter ranks the enemies in its range. Ties always go to the lowest id.
 */
public enum TargetingPolicy {
    NEAREST,
    /** Furthest along its route. */
    FIRST,
    STRONGEST
}
