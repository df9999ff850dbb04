package uy.gub.bps.towerdefense.domain.model;

public enum PlayerAttribute {
    DAMAGE(80, 1.08, 0.025),
    SPEED(70, 1.06, 0.02),
    FIRE_RATE(90, 1.08, 0.018),
    HEALTH(100, 1.06, 0.03),
    // absolute HP per second per level, not a fraction
    REGENERATION(120, 1.10, 0.15);

    public final int baseCost;
    public final double costGrowth;
    public final double bonusPerLevel;

    PlayerAttribute(int baseCost, double costGrowth, double bonusPerLevel) {
        this.baseCost = baseCost;
        this.costGrowth = costGrowth;
        this.bonusPerLevel = bonusPerLevel;
    }
}
