package uy.gub.bps.towerdefense.domain.model;

/**
 * Base stats per enemy type. Speed is in cells per second.
 */
public enum EnemyType {
    BASIC(30, 1.0, 5, 10, 1, 5),
    FAST(20, 2.0, 7, 15, 1, 3),
    TANK(100, 0.5, 15, 30, 2, 10);

    public final double health;
    public final double speed;
    public final int reward;
    public final int scoreValue;
    public final int livesCost;
    public final double contactDamage;

    EnemyType(double health, double speed, int reward, int scoreValue, int livesCost, double contactDamage) {
        this.health = health;
        this.speed = speed;
        this.reward = reward;
        this.scoreValue = scoreValue;
        this.livesCost = livesCost;
        this.contactDamage = contactDamage;
    }
}
