package uy.gub.bps.towerdefense.domain.model;

public enum CellState {
    EMPTY,
    BLOCKED,
    TOWER
}
