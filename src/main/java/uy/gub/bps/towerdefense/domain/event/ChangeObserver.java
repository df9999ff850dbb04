package uy.gub.bps.towerdefense.domain.event;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.GameStatus;
import uy.gub.bps.towerdefense.domain.model.Kill;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot.EnemyView;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot.PlayerView;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot.TowerView;
import uy.gub.bps.towerdefense.domain.model.WavePhase;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns successive snapshots into typed events. The first capture only sets the baseline.
 */
@Slf4j
public class ChangeObserver {
    private final List<GameEventListener> listeners = new CopyOnWriteArrayList<>();
    private SimulationSnapshot previous;

    public void addListener(GameEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GameEventListener listener) {
        listeners.remove(listener);
    }

    public SimulationSnapshot getPrevious() {
        return previous;
    }

    public List<GameEvent<?>> capture(SimulationSnapshot next) {
        Objects.requireNonNull(next, "snapshot");
        SimulationSnapshot before = previous;
        previous = next;
        if (before == null) {
            return List.of();
        }
        List<GameEvent<?>> events = diff(before, next);
        for (GameEvent<?> event : events) {
            for (GameEventListener listener : listeners) {
                listener.onEvent(event);
            }
        }
        return events;
    }

    List<GameEvent<?>> diff(SimulationSnapshot before, SimulationSnapshot after) {
        List<GameEvent<?>> events = new ArrayList<>();
        long tick = after.tick();
        // a reset rebuilds the world; entity diffs across it mean nothing
        boolean restarted = after.tick() < before.tick()
                || (after.status() == GameStatus.MENU && before.status() != GameStatus.MENU);

        if (before.status() != after.status()) {
            events.add(GameEvent.of(GameEventType.GAME_STATE_CHANGED, tick, before.status(), after.status()));
        }
        if (!restarted) {
            diffWaveStart(before, after, events);
            diffEnemies(before, after, events);
            diffTowers(before, after, events);
            diffPlayer(before.player(), after.player(), tick, events);
        }
        if (before.currency() != after.currency()) {
            events.add(GameEvent.of(GameEventType.CURRENCY_CHANGED, tick, before.currency(), after.currency()));
        }
        if (before.lives() != after.lives()) {
            events.add(GameEvent.of(GameEventType.LIVES_CHANGED, tick, before.lives(), after.lives()));
        }
        if (before.score() != after.score()) {
            events.add(GameEvent.of(GameEventType.SCORE_CHANGED, tick, before.score(), after.score()));
        }
        if (!restarted && after.wavePhase() == WavePhase.COMPLETE
                && (before.wavePhase() != WavePhase.COMPLETE || before.wave() != after.wave())) {
            events.add(GameEvent.of(GameEventType.WAVE_COMPLETED, tick, before.wave(), after.wave()));
        }
        if (after.status().isTerminal() && before.status() != after.status()) {
            events.add(GameEvent.of(GameEventType.GAME_OVER, tick, before.status(), after.status()));
            log.info("Game over at tick {}: {} (score {})", tick, after.status(), after.score());
        }
        return events;
    }

    private void diffWaveStart(SimulationSnapshot before, SimulationSnapshot after, List<GameEvent<?>> events) {
        if (after.wave() > before.wave()) {
            events.add(GameEvent.of(GameEventType.WAVE_STARTED, after.tick(), before.wave(), after.wave()));
        }
    }

    private void diffEnemies(SimulationSnapshot before, SimulationSnapshot after, List<GameEvent<?>> events) {
        Map<Long, EnemyView> old = new LinkedHashMap<>();
        before.enemies().forEach(e -> old.put(e.id(), e));
        for (EnemyView enemy : after.enemies()) {
            if (!old.containsKey(enemy.id())) {
                events.add(GameEvent.of(GameEventType.ENEMY_SPAWNED, after.tick(), null, enemy));
            }
        }
        for (Kill kill : after.kills()) {
            events.add(GameEvent.of(GameEventType.ENEMY_KILLED, after.tick(), null, kill));
        }
    }

    private void diffTowers(SimulationSnapshot before, SimulationSnapshot after, List<GameEvent<?>> events) {
        Map<Long, TowerView> old = new LinkedHashMap<>();
        before.towers().forEach(t -> old.put(t.id(), t));
        for (TowerView tower : after.towers()) {
            TowerView was = old.remove(tower.id());
            if (was == null) {
                events.add(GameEvent.of(GameEventType.TOWER_PLACED, after.tick(), null, tower));
            } else if (!was.levels().equals(tower.levels())) {
                events.add(GameEvent.of(GameEventType.TOWER_UPGRADED, after.tick(), was, tower));
            }
        }
        for (TowerView sold : old.values()) {
            events.add(GameEvent.of(GameEventType.TOWER_SOLD, after.tick(), sold, null));
        }
    }

    private void diffPlayer(PlayerView before, PlayerView after, long tick, List<GameEvent<?>> events) {
        if (before == null || after == null || before.health() == after.health()) {
            return;
        }
        GameEventType type = after.health() < before.health()
                ? GameEventType.PLAYER_DAMAGED
                : GameEventType.PLAYER_HEALED;
        events.add(GameEvent.of(type, tick, before.health(), after.health()));
    }
}
