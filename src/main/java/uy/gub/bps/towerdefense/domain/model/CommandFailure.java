package uy.gub.bps.towerdefense.domain.model;

public enum CommandFailure {
    INSUFFICIENT_FUNDS,
    OCCUPIED_CELL,
    OUT_OF_BOUNDS,
    WOULD_BLOCK_PATH,
    MAX_LEVEL_REACHED,
    NO_TARGET_SELECTED,
    UNKNOWN_ENTITY,
    INVALID_STATE
}
