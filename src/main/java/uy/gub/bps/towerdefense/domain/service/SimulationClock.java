package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.Player;

import java.util.List;
import java.util.Optional;

/**
 * Advances every subsystem once per tick, always in the same order:
 * routes, movement, combat, removals, waves, economy, terminal checks.
 */
@Slf4j
public class SimulationClock {
    private final SimulationContext ctx;
    private final GameStateMachine stateMachine;
    private final WaveScheduler waves;
    private final EnemyMovement movement;
    private final CombatResolver combat;
    private final PlayerController playerController;
    private boolean ticking;

    public SimulationClock(SimulationContext ctx, GameStateMachine stateMachine, WaveScheduler waves,
                           EnemyMovement movement, CombatResolver combat, PlayerController playerController) {
        this.ctx = ctx;
        this.stateMachine = stateMachine;
        this.waves = waves;
        this.movement = movement;
        this.combat = combat;
        this.playerController = playerController;
    }

    public boolean isTicking() {
        return ticking;
    }

    /**
     * @return {@code true} if the simulation advanced; only a PLAYING game does
     */
    public boolean tick(double deltaSeconds) {
        if (ticking) {
            throw new IllegalStateException("tick() called while a tick is in progress");
        }
        if (Double.isNaN(deltaSeconds) || deltaSeconds < 0) {
            throw new IllegalArgumentException("Tick delta must be a non-negative number: " + deltaSeconds);
        }
        if (!stateMachine.isPlaying()) {
            return false;
        }
        ticking = true;
        try {
            ctx.advanceTime(deltaSeconds);
            refreshRoutes();

            List<Enemy> leaked = movement.advance(deltaSeconds);
            leaked.forEach(waves::onLeak);
            combat.moveProjectiles(deltaSeconds);
            Optional<Player> player = ctx.getRegistry().player();
            player.ifPresent(p -> playerController.move(p, deltaSeconds));

            combat.resolve(deltaSeconds);
            player.ifPresent(playerController::interact);

            ctx.getRegistry().flushRemovals();

            Optional<WaveScheduler.WaveCompletion> completion = waves.advance(deltaSeconds);

            ctx.getLedger().applyPending();
            completion.ifPresent(this::settleWave);

            if (ctx.getScoreboard().getLives() <= 0) {
                stateMachine.lose();
            } else if (waves.isFinalWaveComplete()) {
                stateMachine.win();
            }
            return true;
        } finally {
            ticking = false;
        }
    }

    private void refreshRoutes() {
        if (!ctx.getPlanner().refreshIfDirty()) {
            return;
        }
        EntityRegistry registry = ctx.getRegistry();
        for (Enemy enemy : registry.enemies()) {
            if (!registry.isPendingRemoval(enemy.getId())) {
                ctx.getPlanner().reroute(enemy);
            }
        }
    }

    private void settleWave(WaveScheduler.WaveCompletion completion) {
        int interest = ctx.getLedger().interest();
        if (interest > 0) {
            ctx.getLedger().credit(interest);
        }
        if (completion.perfect()) {
            ctx.getScoreboard().addScore(ctx.getSettings().getPerfectWaveBonus());
        }
        log.debug("Wave {} settled: interest {}, perfect {}", completion.wave(), interest, completion.perfect());
    }
}
