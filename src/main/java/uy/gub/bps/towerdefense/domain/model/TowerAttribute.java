package uy.gub.bps.towerdefense.domain.model;

public enum TowerAttribute {
    DAMAGE(50, 1.25, 0.15),
    RANGE(60, 1.25, 0.12),
    FIRE_RATE(70, 1.25, 0.13);

    public final int baseCost;
    public final double costGrowth;
    /** Fractional bonus per upgrade level. */
    public final double bonusPerLevel;

    TowerAttribute(int baseCost, double costGrowth, double bonusPerLevel) {
        this.baseCost = baseCost;
        this.costGrowth = costGrowth;
        this.bonusPerLevel = bonusPerLevel;
    }
}
