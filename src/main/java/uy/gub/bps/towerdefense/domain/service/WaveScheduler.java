package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.CommandFailure;
import uy.gub.bps.towerdefense.domain.model.CommandResult;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.SpawnGroup;
import uy.gub.bps.towerdefense.domain.model.WaveDefinition;
import uy.gub.bps.towerdefense.domain.model.WavePhase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the waves of a {@link WavePlan}: IDLE, SPAWNING, ACTIVE, COMPLETE.
 * A wave is complete once every enemy it spawned has died or leaked.
 */
@Slf4j
public class WaveScheduler {

    public record WaveCompletion(int wave, int leaks) {
        public boolean perfect() {
            return leaks == 0;
        }
    }

    private record PendingSpawn(double at, SpawnGroup group) {
    }

    private final SimulationContext ctx;
    private final WavePlan plan;
    private final Deque<PendingSpawn> queue = new ArrayDeque<>();
    private final Set<Long> alive = new LinkedHashSet<>();
    private WavePhase phase = WavePhase.IDLE;
    private int currentWave;
    private double elapsed;
    private int spawned;
    private int leaks;

    public WaveScheduler(SimulationContext ctx, WavePlan plan) {
        this.ctx = ctx;
        this.plan = plan;
    }

    public WavePhase getPhase() {
        return phase;
    }

    /** 1-based number of the wave in progress or last completed; 0 before the first wave. */
    public int getCurrentWave() {
        return currentWave;
    }

    public int getTotalWaves() {
        return plan.size();
    }

    public int getPendingSpawns() {
        return queue.size();
    }

    public int getAliveCount() {
        return alive.size();
    }

    public boolean isFinalWaveComplete() {
        return phase == WavePhase.COMPLETE && plan.isFinal(currentWave);
    }

    public CommandResult<Integer> startNextWave() {
        if (phase != WavePhase.IDLE && phase != WavePhase.COMPLETE) {
            log.debug("Wave {} still running ({})", currentWave, phase);
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        if (currentWave >= plan.size()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        currentWave++;
        WaveDefinition wave = plan.wave(currentWave);
        queue.clear();
        queue.addAll(schedule(wave));
        alive.clear();
        elapsed = 0;
        spawned = 0;
        leaks = 0;
        phase = WavePhase.SPAWNING;
        log.info("Wave {} started: {} enemies{}", currentWave, wave.enemyCount(), wave.hasBoss() ? " and a boss" : "");
        return CommandResult.ok(currentWave);
    }

    /** Spawn times are {@code startDelay + i * delay} within each group, merged in time order. */
    static List<PendingSpawn> schedule(WaveDefinition wave) {
        List<PendingSpawn> spawns = new ArrayList<>();
        for (SpawnGroup group : wave.groups()) {
            for (int i = 0; i < group.count(); i++) {
                spawns.add(new PendingSpawn(wave.startDelay() + i * group.delay(), group));
            }
        }
        spawns.sort(Comparator.comparingDouble(PendingSpawn::at));
        return spawns;
    }

    public void onLeak(Enemy enemy) {
        if (enemy.getWave() == currentWave) {
            leaks++;
        }
    }

    /**
     * Dispatches due spawns and detects completion. Runs after deferred removals were flushed.
     *
     * @return the wave that completed during this call, if any
     */
    public Optional<WaveCompletion> advance(double dt) {
        if (phase == WavePhase.IDLE || phase == WavePhase.COMPLETE) {
            return Optional.empty();
        }
        alive.removeIf(id -> !ctx.getRegistry().contains(id));

        if (phase == WavePhase.SPAWNING) {
            elapsed += dt;
            while (!queue.isEmpty() && queue.peekFirst().at() <= elapsed) {
                spawn(queue.pollFirst().group());
            }
            if (queue.isEmpty()) {
                phase = WavePhase.ACTIVE;
            }
        }
        if (phase == WavePhase.ACTIVE && alive.isEmpty()) {
            phase = WavePhase.COMPLETE;
            log.info("Wave {} complete ({} leaked)", currentWave, leaks);
            return Optional.of(new WaveCompletion(currentWave, leaks));
        }
        return Optional.empty();
    }

    private void spawn(SpawnGroup group) {
        List<Cell> spawns = ctx.getGrid().getSpawns();
        Cell spawn = spawns.get(spawned % spawns.size());
        spawned++;
        Enemy enemy = ctx.getFactory().enemy(group, ctx.getPlanner().routeFrom(spawn), currentWave);
        alive.add(enemy.getId());
        log.debug("Spawned {} {} at {}", group.boss() ? "boss" : "enemy", enemy.getId(), spawn);
    }
}
