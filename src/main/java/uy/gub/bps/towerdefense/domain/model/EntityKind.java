package uy.gub.bps.towerdefense.domain.model;

public enum EntityKind {
    TOWER,
    ENEMY,
    PLAYER,
    PROJECTILE,
    COLLECTIBLE
}
