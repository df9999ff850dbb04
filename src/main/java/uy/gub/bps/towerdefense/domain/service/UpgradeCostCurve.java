package uy.gub.bps.towerdefense.domain.service;

/**
 * Price of each upgrade step. {@code costAt(level)} is what it takes to go from {@code level} to {@code level + 1};
 * the table is strictly increasing by construction.
 */
public final class UpgradeCostCurve {
    private final int[] costs;

    public UpgradeCostCurve(double baseCost, double growth, int maxLevel) {
        if (baseCost <= 0) {
            throw new IllegalArgumentException("Base cost must be positive: " + baseCost);
        }
        if (growth < 1.0) {
            throw new IllegalArgumentException("Cost growth must be at least 1: " + growth);
        }
        if (maxLevel < 0) {
            throw new IllegalArgumentException("Max level must not be negative: " + maxLevel);
        }
        this.costs = new int[maxLevel];
        int previous = 0;
        for (int level = 0; level < maxLevel; level++) {
            int raw = (int) Math.ceil(baseCost * Math.pow(growth, level));
            costs[level] = Math.max(previous + 1, raw);
            previous = costs[level];
        }
    }

    public int maxLevel() {
        return costs.length;
    }

    public boolean canAdvance(int level) {
        return level >= 0 && level < costs.length;
    }

    public int costAt(int level) {
        if (!canAdvance(level)) {
            throw new IllegalArgumentException("No upgrade beyond level " + level + " (max " + costs.length + ")");
        }
        return costs[level];
    }

    public int totalTo(int level) {
        int total = 0;
        for (int i = 0; i < Math.min(level, costs.length); i++) {
            total += costs[i];
        }
        return total;
    }
}
