package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Collectible;
import uy.gub.bps.towerdefense.domain.model.CollectibleType;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.PowerUpType;

import java.util.List;

/**
 * The player unit: movement, regeneration, power-up expiry, pickups and contact damage.
 */
@Slf4j
public class PlayerController {
    static final double CONTACT_INTERVAL = 1.0;

    private final SimulationContext ctx;

    public PlayerController(SimulationContext ctx) {
        this.ctx = ctx;
    }

    public void steer(Player player, double dx, double dy) {
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length < 1e-9) {
            player.setVx(0);
            player.setVy(0);
        } else {
            player.setVx(dx / length);
            player.setVy(dy / length);
        }
    }

    public void move(Player player, double dt) {
        double step = player.getSpeed() * dt;
        Position next = player.getPosition().move(player.getVx() * step, player.getVy() * step);
        double maxX = ctx.getGrid().getWidth() - 0.5;
        double maxY = ctx.getGrid().getHeight() - 0.5;
        player.setPosition(new Position(clamp(next.x(), 0.5, maxX), clamp(next.y(), 0.5, maxY)));

        double now = ctx.getTime();
        player.getActiveEffects().values().removeIf(expiry -> expiry <= now);

        double regen = player.getRegeneration();
        if (regen > 0 && player.getHealth() > 0) {
            player.setHealth(Math.min(player.getMaxHealth(), player.getHealth() + regen * dt));
        }
    }

    public void interact(Player player) {
        collect(player);
        for (Enemy enemy : ctx.getRegistry().enemies()) {
            if (!enemy.isAlive() || ctx.getRegistry().isPendingRemoval(enemy.getId())
                    || enemy.getContactCooldown() > 0 || enemy.getContactDamage() <= 0) {
                continue;
            }
            if (enemy.getPosition().distanceTo(player.getPosition()) <= ctx.getSettings().getContactRadius()) {
                enemy.setContactCooldown(CONTACT_INTERVAL);
                damage(player, enemy.getContactDamage());
            }
        }
        expireCollectibles();
    }

    /**
     * Applies damage unless a shield is up. A downed player costs a life and respawns at the goal.
     */
    public void damage(Player player, double amount) {
        if (amount <= 0 || player.hasEffect(PowerUpType.SHIELD)) {
            return;
        }
        player.setHealth(Math.max(0, player.getHealth() - amount));
        if (player.getHealth() <= 0) {
            ctx.getScoreboard().loseLives(1);
            respawn(player);
            log.info("Player down, respawning at {}", ctx.getGrid().getGoal());
        }
    }

    public void respawn(Player player) {
        player.setPosition(ctx.getGrid().getGoal().center());
        player.setHealth(player.getMaxHealth());
        player.getActiveEffects().clear();
        player.setVx(0);
        player.setVy(0);
        player.setCooldown(0);
    }

    private void collect(Player player) {
        double radius = ctx.getSettings().getPickupRadius();
        for (Collectible collectible : List.copyOf(ctx.getRegistry().collectibles())) {
            if (ctx.getRegistry().isPendingRemoval(collectible.getId())
                    || collectible.getPosition().distanceTo(player.getPosition()) > radius) {
                continue;
            }
            apply(player, collectible);
            ctx.getRegistry().scheduleRemoval(collectible.getId());
        }
    }

    void apply(Player player, Collectible collectible) {
        CollectibleType type = collectible.getType();
        switch (type) {
            case HEALTH -> player.setHealth(Math.min(player.getMaxHealth(), player.getHealth() + collectible.getAmount()));
            case EXTRA_CURRENCY -> ctx.getLedger().queueReward((int) collectible.getAmount());
            case DAMAGE_BOOST, FIRE_RATE_BOOST, SPEED_BOOST, SHIELD ->
                    player.getActiveEffects().merge(type.powerUp, ctx.getTime() + collectible.getDuration(), Math::max);
        }
    }

    private void expireCollectibles() {
        double now = ctx.getTime();
        for (Collectible collectible : ctx.getRegistry().collectibles()) {
            if (collectible.getExpiresAt() <= now) {
                ctx.getRegistry().scheduleRemoval(collectible.getId());
            }
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
