package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.EnemyType;
import uy.gub.bps.towerdefense.domain.model.GameStatus;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.WaveDefinition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SimulationClockTest {

    private SimulationContext ctx;
    private GameStateMachine stateMachine;
    private WaveScheduler waves;
    private SimulationClock clock;

    private void init(SimulationSettings settings) {
        ctx = new SimulationContext(settings);
        stateMachine = new GameStateMachine();
        waves = new WaveScheduler(ctx, WavePlan.from(settings));
        clock = new SimulationClock(ctx, stateMachine, waves, new EnemyMovement(ctx), new CombatResolver(ctx),
                new PlayerController(ctx));
    }

    @Test
    void tick_shouldOnlyAdvanceWhilePlaying() {
        init(TestSettings.corridor(5, 3).build());

        assertThat(clock.tick(0.1)).isFalse();
        assertThat(ctx.getTick()).isZero();

        stateMachine.start();
        assertThat(clock.tick(0.1)).isTrue();
        stateMachine.pause();
        assertThat(clock.tick(0.1)).isFalse();

        assertThat(ctx.getTick()).isEqualTo(1);
    }

    @Test
    void tick_shouldRejectReentry() {
        init(TestSettings.corridor(5, 3).startingLives(1)
                .waves(List.of(TestSettings.wave(1, 0, EnemyType.FAST, 1, 0))).build());
        stateMachine.addListener((from, to) -> clock.tick(0.1));
        stateMachine.start();
        waves.startNextWave();

        assertThatThrownBy(() -> {
            for (int i = 0; i < 200; i++) {
                clock.tick(0.1);
            }
        }).isInstanceOf(IllegalStateException.class);
        assertThat(clock.isTicking()).isFalse();
    }

    @Test
    void tick_shouldRejectNegativeDeltas() {
        init(TestSettings.corridor(5, 3).build());

        assertThatThrownBy(() -> clock.tick(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void leaks_shouldCostLivesAndEndTheGame() {
        init(TestSettings.corridor(5, 3).startingLives(3)
                .waves(List.of(TestSettings.wave(1, 0, EnemyType.TANK, 2, 0))).build());
        stateMachine.start();
        waves.startNextWave();

        for (int i = 0; i < 200 && stateMachine.isPlaying(); i++) {
            clock.tick(0.1);
        }

        assertThat(ctx.getScoreboard().getLives()).isZero();
        assertThat(ctx.getScoreboard().getLeaks()).isEqualTo(2);
        assertThat(stateMachine.getStatus()).isEqualTo(GameStatus.GAME_OVER);
        assertThat(ctx.getRegistry().enemies()).isEmpty();
    }

    @Test
    void finalWave_shouldEndInVictoryWithPerfectBonus() {
        init(TestSettings.corridor(5, 3).perfectWaveBonus(500)
                .waves(List.of(new WaveDefinition(1, 0, List.of())))
                .build());
        stateMachine.start();
        waves.startNextWave();

        clock.tick(0.1);

        assertThat(stateMachine.getStatus()).isEqualTo(GameStatus.VICTORY);
        assertThat(ctx.getScoreboard().getScore()).isEqualTo(500);
    }

    @Test
    void waveCompletion_shouldPayInterest() {
        init(TestSettings.corridor(5, 3).startingCurrency(100).interestRate(0.5).maxInterest(30)
                .waves(List.of(new WaveDefinition(1, 0, List.of()),
                        new WaveDefinition(2, 0, List.of())))
                .build());
        stateMachine.start();
        waves.startNextWave();

        clock.tick(0.1);

        assertThat(ctx.getLedger().getBalance()).isEqualTo(130);
        assertThat(stateMachine.getStatus()).isEqualTo(GameStatus.PLAYING);
    }
}
