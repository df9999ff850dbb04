package uy.gub.bps.towerdefense.domain.model;

/**
 * Base stats per tower type. Distances are in cells, fire rate in shots per second.
 */
public enum TowerType {
    BASIC(30, 10, 3.0, 1.0, ProjectileKind.HOMING, 8.0, 1.0, true),
    SNIPER(75, 50, 6.0, 0.5, ProjectileKind.BALLISTIC, 14.0, 1.2, true),
    RAPID(45, 5, 2.5, 4.0, ProjectileKind.HOMING, 10.0, 0.9, true),
    WALL(15, 0, 0, 0, null, 0, 0.5, false);

    public final int cost;
    public final double damage;
    public final double range;
    public final double fireRate;
    public final ProjectileKind projectileKind;
    public final double projectileSpeed;
    public final double upgradeCostModifier;
    public final boolean armed;

    TowerType(int cost, double damage, double range, double fireRate, ProjectileKind projectileKind,
              double projectileSpeed, double upgradeCostModifier, boolean armed) {
        this.cost = cost;
        this.damage = damage;
        this.range = range;
        this.fireRate = fireRate;
        this.projectileKind = projectileKind;
        this.projectileSpeed = projectileSpeed;
        this.upgradeCostModifier = upgradeCostModifier;
        this.armed = armed;
    }
}
