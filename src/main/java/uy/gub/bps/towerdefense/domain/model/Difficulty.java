package uy.gub.bps.towerdefense.domain.model;

public enum Difficulty {
    EASY(0.7, 0.8, 1.3, 1.5),
    NORMAL(1.0, 1.0, 1.0, 1.0),
    HARD(1.5, 1.2, 0.8, 0.7),
    ENDLESS(2.0, 1.5, 0.7, 0.5);

    public final double enemyHealthMultiplier;
    public final double enemySpeedMultiplier;
    public final double towerDamageMultiplier;
    public final double currencyMultiplier;

    Difficulty(double enemyHealthMultiplier, double enemySpeedMultiplier,
               double towerDamageMultiplier, double currencyMultiplier) {
        this.enemyHealthMultiplier = enemyHealthMultiplier;
        this.enemySpeedMultiplier = enemySpeedMultiplier;
        this.towerDamageMultiplier = towerDamageMultiplier;
        this.currencyMultiplier = currencyMultiplier;
    }
}
