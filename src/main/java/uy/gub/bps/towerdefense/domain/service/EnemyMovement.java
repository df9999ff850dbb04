package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Enemy;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks enemies along their routes. Enemies that reach the goal cost lives and are scheduled for removal.
 */
@Slf4j
public class EnemyMovement {
    private final SimulationContext ctx;

    public EnemyMovement(SimulationContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @return enemies that reached the goal this tick
     */
    public List<Enemy> advance(double dt) {
        EntityRegistry registry = ctx.getRegistry();
        List<Enemy> leaked = new ArrayList<>();
        for (Enemy enemy : registry.enemies()) {
            if (registry.isPendingRemoval(enemy.getId()) || !enemy.isAlive()) {
                continue;
            }
            enemy.setProgress(Math.min(enemy.getRoute().length(), enemy.getProgress() + enemy.getSpeed() * dt));
            if (enemy.getContactCooldown() > 0) {
                enemy.setContactCooldown(Math.max(0, enemy.getContactCooldown() - dt));
            }
            if (enemy.hasReachedGoal()) {
                ctx.getScoreboard().recordLeak(enemy.getLivesCost());
                registry.scheduleRemoval(enemy.getId());
                leaked.add(enemy);
                log.debug("Enemy {} reached the goal (-{} lives)", enemy.getId(), enemy.getLivesCost());
            }
        }
        return leaked;
    }
}
