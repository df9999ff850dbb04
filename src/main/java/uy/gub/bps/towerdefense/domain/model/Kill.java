package uy.gub.bps.towerdefense.domain.model;

public record Kill(long enemyId, EnemyType enemyType, boolean boss, long killerId, int reward, int score, long tick) {
}
