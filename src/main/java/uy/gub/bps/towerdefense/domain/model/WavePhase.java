package uy.gub.bps.towerdefense.domain.model;

public enum WavePhase {
    IDLE,
    SPAWNING,
    ACTIVE,
    COMPLETE
}
