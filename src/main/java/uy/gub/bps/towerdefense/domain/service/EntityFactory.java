package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Collectible;
import uy.gub.bps.towerdefense.domain.model.CollectibleType;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.Projectile;
import uy.gub.bps.towerdefense.domain.model.ProjectileKind;
import uy.gub.bps.towerdefense.domain.model.Route;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.SpawnGroup;
import uy.gub.bps.towerdefense.domain.model.Tower;
import uy.gub.bps.towerdefense.domain.model.TowerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerType;

public class EntityFactory {
    /** Homing shots give up after chasing this many times their shooter's range. */
    static final double HOMING_TRAVEL_FACTOR = 4.0;
    static final double BALLISTIC_TRAVEL_FACTOR = 1.5;
    static final double PLAYER_PROJECTILE_SPEED = 10.0;

    private final SimulationSettings settings;
    private final EntityRegistry registry;
    private final EconomyLedger ledger;
    private final DifficultyCurve difficulty;

    public EntityFactory(SimulationSettings settings, EntityRegistry registry, EconomyLedger ledger,
                         DifficultyCurve difficulty) {
        this.settings = settings;
        this.registry = registry;
        this.ledger = ledger;
        this.difficulty = difficulty;
    }

    public Tower tower(long id, TowerType type, Cell cell, int paid) {
        double damageScale = settings.getDifficulty().towerDamageMultiplier;
        return registry.register(Tower.builder()
                .id(id)
                .type(type)
                .cell(cell)
                .baseDamage(type.damage * damageScale)
                .baseRange(type.range)
                .baseFireRate(type.fireRate)
                .maxLevel(ledger.curve(type, TowerAttribute.DAMAGE).maxLevel())
                .cumulativeSpend(paid)
                .cooldown(0)
                .build());
    }

    public Enemy enemy(SpawnGroup group, Route route, int wave) {
        double health = group.health() != null ? group.health() : group.type().health;
        if (health <= 0) {
            throw new IllegalArgumentException("Enemy health must be positive: " + health);
        }
        double healthScale = difficulty.healthMultiplier(wave) * (group.boss() ? DifficultyCurve.BOSS_HEALTH : 1.0);
        double speedScale = difficulty.speedMultiplier(wave) * (group.boss() ? DifficultyCurve.BOSS_SPEED : 1.0);
        double rewardScale = difficulty.rewardMultiplier(wave) * (group.boss() ? DifficultyCurve.BOSS_REWARD : 1.0);
        double maxHealth = health * healthScale;
        return registry.register(Enemy.builder()
                .id(registry.nextId())
                .type(group.type())
                .route(route)
                .progress(0)
                .health(maxHealth)
                .maxHealth(maxHealth)
                .baseSpeed(group.type().speed)
                .healthMultiplier(healthScale)
                .speedMultiplier(speedScale)
                .reward((int) Math.round(group.type().reward * rewardScale))
                .scoreValue((int) Math.round(group.type().scoreValue * (group.boss() ? DifficultyCurve.BOSS_REWARD : 1.0)))
                .livesCost(group.type().livesCost * (group.boss() ? 5 : 1))
                .contactDamage(group.type().contactDamage)
                .boss(group.boss())
                .wave(wave)
                .build());
    }

    public Player player(Position position) {
        return registry.register(Player.builder()
                .id(registry.nextId())
                .position(position)
                .health(settings.getPlayerHealth())
                .baseMaxHealth(settings.getPlayerHealth())
                .baseDamage(settings.getPlayerDamage())
                .baseSpeed(settings.getPlayerSpeed())
                .baseFireRate(settings.getPlayerFireRate())
                .range(settings.getPlayerRange())
                .maxLevel(settings.getMaxPlayerLevel())
                .build());
    }

    public Projectile projectile(long ownerId, Position origin, ProjectileKind kind, long targetId, Position aim,
                                 double speed, double damage, double range) {
        double dx = aim.x() - origin.x();
        double dy = aim.y() - origin.y();
        double dist = Math.sqrt(dx * dx + dy * dy);
        double vx = dist < 1e-9 ? speed : dx / dist * speed;
        double vy = dist < 1e-9 ? 0 : dy / dist * speed;
        boolean homing = kind == ProjectileKind.HOMING;
        return registry.register(Projectile.builder()
                .id(registry.nextId())
                .ownerId(ownerId)
                .projectileKind(kind)
                .targetId(homing ? targetId : null)
                .origin(origin)
                .position(origin)
                .vx(vx)
                .vy(vy)
                .speed(speed)
                .damage(damage)
                .maxTravel(range * (homing ? HOMING_TRAVEL_FACTOR : BALLISTIC_TRAVEL_FACTOR))
                .build());
    }

    public Projectile playerShot(Player player, long targetId, Position aim) {
        return projectile(player.getId(), player.getPosition(), ProjectileKind.HOMING, targetId, aim,
                PLAYER_PROJECTILE_SPEED, player.getDamage(), player.getRange());
    }

    public Collectible collectible(CollectibleType type, Position position, double now) {
        return registry.register(Collectible.builder()
                .id(registry.nextId())
                .type(type)
                .position(position)
                .amount(type.amount)
                .duration(type.duration)
                .expiresAt(now + settings.getCollectibleLifetime())
                .build());
    }
}
