package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.CollectibleType;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.Kill;
import uy.gub.bps.towerdefense.domain.model.OrphanPolicy;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.Projectile;
import uy.gub.bps.towerdefense.domain.model.ProjectileKind;
import uy.gub.bps.towerdefense.domain.model.TargetingPolicy;
import uy.gub.bps.towerdefense.domain.model.Tower;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Targeting, projectile flight and damage. Movement of projectiles happens in {@link #moveProjectiles(double)};
 * hits, shots and deaths in {@link #resolve(double)}, after everything has moved.
 */
@Slf4j
public class CombatResolver {
    private static final double SWEEP_EPSILON = 1e-9;

    private final SimulationContext ctx;
    private final EntityRegistry registry;

    public CombatResolver(SimulationContext ctx) {
        this.ctx = ctx;
        this.registry = ctx.getRegistry();
    }

    /**
     * Picks the best target for a shooter at {@code origin}. Only live enemies within {@code range} qualify;
     * ties on the policy's key go to the lowest id.
     */
    public Optional<Enemy> selectTarget(Position origin, double range) {
        TargetingPolicy policy = ctx.getSettings().getTargetingPolicy();
        Comparator<Enemy> order = switch (policy) {
            case NEAREST -> Comparator.comparingDouble(e -> e.getPosition().distanceTo(origin));
            case FIRST -> Comparator.comparingDouble((Enemy e) -> e.getRoute().length() - e.getProgress());
            case STRONGEST -> Comparator.comparingDouble((Enemy e) -> -e.getHealth());
        };
        return registry.enemies().stream()
                .filter(this::isLive)
                .filter(e -> e.getPosition().distanceTo(origin) <= range)
                .min(order.thenComparingLong(Enemy::getId));
    }

    public void moveProjectiles(double dt) {
        for (Projectile projectile : registry.projectiles()) {
            if (registry.isPendingRemoval(projectile.getId())) {
                continue;
            }
            if (projectile.isHoming()) {
                Optional<Enemy> target = liveEnemy(projectile.getTargetId());
                if (target.isPresent()) {
                    steer(projectile, target.get().getPosition(), dt);
                    continue;
                }
                if (ctx.getSettings().getOrphanPolicy() == OrphanPolicy.DISCARD) {
                    // left in place; resolve() discards it
                    continue;
                }
                orphan(projectile);
            }
            fly(projectile, dt);
        }
    }

    public void resolve(double dt) {
        resolveProjectiles();
        fireTowers(dt);
        registry.player().ifPresent(player -> firePlayer(player, dt));
    }

    private void resolveProjectiles() {
        double hitRadius = ctx.getSettings().getProjectileHitRadius();
        for (Projectile projectile : List.copyOf(registry.projectiles())) {
            if (registry.isPendingRemoval(projectile.getId())) {
                continue;
            }
            registry.require(projectile.getOwnerId());

            if (projectile.isHoming()) {
                Optional<Enemy> target = liveEnemy(projectile.getTargetId());
                if (target.isEmpty()) {
                    if (ctx.getSettings().getOrphanPolicy() == OrphanPolicy.DISCARD) {
                        registry.scheduleRemoval(projectile.getId());
                        continue;
                    }
                    orphan(projectile);
                } else if (target.get().getPosition().distanceTo(projectile.getPosition()) <= hitRadius) {
                    hit(projectile, target.get());
                    continue;
                }
            }
            if (!projectile.isHoming()) {
                Optional<Enemy> struck = sweep(projectile, hitRadius);
                if (struck.isPresent()) {
                    hit(projectile, struck.get());
                    continue;
                }
            }
            if (projectile.isSpent() || !inField(projectile.getPosition())) {
                registry.scheduleRemoval(projectile.getId());
            }
        }
    }

    /**
     * Live enemy within {@code hitRadius} of the whole step the projectile just made. Nearest to the path wins,
     * then earliest along it, then lowest id.
     */
    private Optional<Enemy> sweep(Projectile projectile, double hitRadius) {
        Position to = projectile.getPosition();
        Position from = projectile.getPreviousPosition() != null ? projectile.getPreviousPosition() : to;
        // consumed; an unmoved projectile is only tested where it stands
        projectile.setPreviousPosition(to);
        Enemy best = null;
        double bestDistance = Double.MAX_VALUE;
        double bestAlong = Double.MAX_VALUE;
        for (Enemy enemy : registry.enemies()) {
            if (!isLive(enemy)) {
                continue;
            }
            Position closest = enemy.getPosition().nearestOnSegment(from, to);
            double distance = enemy.getPosition().distanceTo(closest);
            if (distance > hitRadius) {
                continue;
            }
            double along = from.distanceTo(closest);
            int byDistance = compare(distance, bestDistance);
            int byAlong = compare(along, bestAlong);
            if (best == null || byDistance < 0
                    || (byDistance == 0 && (byAlong < 0 || (byAlong == 0 && enemy.getId() < best.getId())))) {
                best = enemy;
                bestDistance = distance;
                bestAlong = along;
            }
        }
        return Optional.ofNullable(best);
    }

    private static int compare(double a, double b) {
        return Math.abs(a - b) <= SWEEP_EPSILON ? 0 : Double.compare(a, b);
    }

    private void fireTowers(double dt) {
        for (Tower tower : List.copyOf(registry.towers())) {
            if (!tower.isArmed()) {
                continue;
            }
            tower.setCooldown(tower.getCooldown() - dt);
            if (tower.getCooldown() > 0) {
                continue;
            }
            Optional<Enemy> target = selectTarget(tower.getPosition(), tower.getRange());
            if (target.isEmpty()) {
                tower.setCooldown(0);
                continue;
            }
            Enemy enemy = target.get();
            ctx.getFactory().projectile(tower.getId(), tower.getPosition(), tower.getType().projectileKind,
                    enemy.getId(), enemy.getPosition(), tower.getType().projectileSpeed, tower.getDamage(),
                    tower.getRange());
            tower.setCooldown(Math.max(0, tower.getCooldown()) + 1.0 / tower.getFireRate());
        }
    }

    private void firePlayer(Player player, double dt) {
        if (player.getHealth() <= 0 || player.getFireRate() <= 0) {
            return;
        }
        player.setCooldown(player.getCooldown() - dt);
        if (player.getCooldown() > 0) {
            return;
        }
        Optional<Enemy> target = selectTarget(player.getPosition(), player.getRange());
        if (target.isEmpty()) {
            player.setCooldown(0);
            return;
        }
        ctx.getFactory().playerShot(player, target.get().getId(), target.get().getPosition());
        player.setCooldown(Math.max(0, player.getCooldown()) + 1.0 / player.getFireRate());
    }

    private void hit(Projectile projectile, Enemy enemy) {
        registry.scheduleRemoval(projectile.getId());
        applyDamage(enemy, projectile.getDamage(), projectile.getOwnerId());
    }

    /**
     * Damages a live enemy; the blow that takes it to zero kills it, credits {@code killerId} and may drop a pickup.
     */
    public void applyDamage(Enemy enemy, double damage, long killerId) {
        if (!isLive(enemy) || damage <= 0) {
            return;
        }
        enemy.setHealth(Math.max(0, enemy.getHealth() - damage));
        if (enemy.isAlive()) {
            return;
        }
        registry.scheduleRemoval(enemy.getId());
        ctx.getLedger().queueReward(enemy.getReward());
        Kill kill = new Kill(enemy.getId(), enemy.getType(), enemy.isBoss(), killerId, enemy.getReward(),
                enemy.getScoreValue(), ctx.getTick());
        ctx.getScoreboard().recordKill(kill);
        log.debug("Enemy {} killed by {} (+{})", enemy.getId(), killerId, enemy.getReward());
        maybeDrop(enemy.getPosition());
    }

    private void maybeDrop(Position position) {
        double chance = ctx.getSettings().getCollectibleDropChance();
        if (chance <= 0 || ctx.getRandom().nextDouble() >= chance) {
            return;
        }
        CollectibleType[] types = CollectibleType.values();
        CollectibleType type = types[ctx.getRandom().nextInt(types.length)];
        ctx.getFactory().collectible(type, position, ctx.getTime());
    }

    private void steer(Projectile projectile, Position aim, double dt) {
        Position from = projectile.getPosition();
        Position to = from.towards(aim, projectile.getSpeed() * dt);
        double moved = from.distanceTo(to);
        if (moved > 1e-9) {
            projectile.setVx((to.x() - from.x()) / moved * projectile.getSpeed());
            projectile.setVy((to.y() - from.y()) / moved * projectile.getSpeed());
        }
        projectile.setPreviousPosition(from);
        projectile.setPosition(to);
        projectile.setDistanceTravelled(projectile.getDistanceTravelled() + moved);
    }

    private void fly(Projectile projectile, double dt) {
        // never past maxTravel, whatever the tick length
        double step = Math.max(0, Math.min(projectile.getSpeed() * dt,
                projectile.getMaxTravel() - projectile.getDistanceTravelled()));
        double f = projectile.getSpeed() > 0 ? step / projectile.getSpeed() : 0;
        Position from = projectile.getPosition();
        projectile.setPreviousPosition(from);
        projectile.setPosition(from.move(projectile.getVx() * f, projectile.getVy() * f));
        projectile.setDistanceTravelled(projectile.getDistanceTravelled() + step);
    }

    private void orphan(Projectile projectile) {
        projectile.setTargetId(null);
        projectile.setProjectileKind(ProjectileKind.BALLISTIC);
    }

    private Optional<Enemy> liveEnemy(Long id) {
        return id == null ? Optional.empty() : registry.enemy(id).filter(this::isLive);
    }

    private boolean isLive(Enemy enemy) {
        return enemy.isAlive() && !registry.isPendingRemoval(enemy.getId());
    }

    private boolean inField(Position p) {
        return p.x() >= 0 && p.y() >= 0
                && p.x() <= ctx.getGrid().getWidth() && p.y() <= ctx.getGrid().getHeight();
    }
}
