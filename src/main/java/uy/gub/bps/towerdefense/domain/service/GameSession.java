package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.event.ChangeObserver;
import uy.gub.bps.towerdefense.domain.event.GameEventListener;
import uy.gub.bps.towerdefense.domain.model.ScoreEntry;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot;

import java.util.function.Function;

/**
 * An engine plus the observer that reports its changes. Every command and every tick goes through here
 * and is followed by exactly one capture.
 */
@Slf4j
public class GameSession {
    private final GameEngine engine;
    private final ChangeObserver observer;
    private final ScoreStore scoreStore;
    private boolean recorded;

    public GameSession(GameEngine engine, ChangeObserver observer, ScoreStore scoreStore) {
        this.engine = engine;
        this.observer = observer;
        this.scoreStore = scoreStore;
        observer.capture(engine.snapshot());
    }

    public <T> T execute(Function<GameEngine, T> command) {
        T result = command.apply(engine);
        capture();
        return result;
    }

    public boolean tick(double deltaSeconds) {
        boolean advanced = engine.tick(deltaSeconds);
        if (advanced) {
            capture();
        }
        return advanced;
    }

    public void addListener(GameEventListener listener) {
        observer.addListener(listener);
    }

    /** Read-only access for queries; commands issued directly on it are not observed. */
    public GameEngine getEngine() {
        return engine;
    }

    public SimulationSnapshot getLastSnapshot() {
        return observer.getPrevious();
    }

    private void capture() {
        SimulationSnapshot snapshot = engine.snapshot();
        observer.capture(snapshot);
        if (snapshot.status().isTerminal() && !recorded) {
            recorded = true;
            scoreStore.save(new ScoreEntry(snapshot.score(), snapshot.wave(), snapshot.status(),
                    engine.getSettings().getDifficulty()));
            log.info("Recorded final score {} after wave {}", snapshot.score(), snapshot.wave());
        } else if (!snapshot.status().isTerminal()) {
            recorded = false;
        }
    }
}
