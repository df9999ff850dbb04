package uy.gub.bps.towerdefense.domain.event;

public enum GameEventType {
    CURRENCY_CHANGED,
    LIVES_CHANGED,
    SCORE_CHANGED,
    WAVE_STARTED,
    WAVE_COMPLETED,
    ENEMY_SPAWNED,
    ENEMY_KILLED,
    TOWER_PLACED,
    TOWER_UPGRADED,
    TOWER_SOLD,
    PLAYER_DAMAGED,
    PLAYER_HEALED,
    GAME_STATE_CHANGED,
    GAME_OVER
}
