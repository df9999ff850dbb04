package uy.gub.bps.towerdefense.domain.model;

public interface GameObject {
    long getId();
    Position getPosition();
    EntityKind getKind();
}
