package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uy.gub.bps.towerdefense.domain.event.ChangeObserver;
import uy.gub.bps.towerdefense.domain.event.GameEvent;
import uy.gub.bps.towerdefense.domain.event.GameEventType;
import uy.gub.bps.towerdefense.domain.model.EnemyType;
import uy.gub.bps.towerdefense.domain.model.GameStatus;
import uy.gub.bps.towerdefense.domain.model.ScoreEntry;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class GameSessionTest {

    @Mock
    private ScoreStore scoreStore;

    private GameEngineImpl engine;
    private GameSession session;
    private final List<GameEvent<?>> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new GameEngineImpl(TestSettings.corridor(5, 3)
                .startingLives(1)
                .waves(List.of(TestSettings.wave(1, 0, EnemyType.FAST, 1, 0)))
                .build());
        session = new GameSession(engine, new ChangeObserver(), scoreStore);
        session.addListener(events::add);
    }

    @Test
    void everyCommand_shouldBeObserved() {
        session.execute(GameEngine::start);
        session.execute(GameEngine::pause);
        session.execute(GameEngine::pause);

        assertThat(events).extracting(GameEvent::type)
                .containsExactly(GameEventType.GAME_STATE_CHANGED, GameEventType.GAME_STATE_CHANGED);
        assertThat(session.getLastSnapshot().status()).isEqualTo(GameStatus.PAUSED);
    }

    @Test
    void tick_shouldNotCaptureWhenNothingAdvanced() {
        assertThat(session.tick(0.1)).isFalse();

        assertThat(events).isEmpty();
        verify(scoreStore, never()).save(any());
    }

    @Test
    void finishedGame_shouldBeRecordedOnce() {
        session.execute(GameEngine::start);
        session.execute(GameEngine::startNextWave);

        for (int i = 0; i < 100; i++) {
            session.tick(0.1);
        }

        ArgumentCaptor<ScoreEntry> entry = ArgumentCaptor.forClass(ScoreEntry.class);
        verify(scoreStore, times(1)).save(entry.capture());
        assertThat(entry.getValue().outcome()).isEqualTo(GameStatus.GAME_OVER);
        assertThat(events).extracting(GameEvent::type)
                .contains(GameEventType.WAVE_STARTED, GameEventType.ENEMY_SPAWNED, GameEventType.LIVES_CHANGED,
                        GameEventType.GAME_OVER);
        assertThat(events).filteredOn(e -> e.type() == GameEventType.GAME_OVER).hasSize(1);
    }

    @Test
    void reset_shouldAllowRecordingTheNextGame() {
        session.execute(GameEngine::start);
        session.execute(GameEngine::startNextWave);
        for (int i = 0; i < 100; i++) {
            session.tick(0.1);
        }

        session.execute(GameEngine::reset);
        session.execute(GameEngine::start);
        session.execute(GameEngine::startNextWave);
        for (int i = 0; i < 100; i++) {
            session.tick(0.1);
        }

        verify(scoreStore, times(2)).save(any());
    }
}
