package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.Difficulty;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DifficultyCurveTest {

    @Test
    void firstWave_shouldMatchThePreset() {
        DifficultyCurve curve = new DifficultyCurve(Difficulty.HARD);

        assertThat(curve.healthMultiplier(1)).isEqualTo(Difficulty.HARD.enemyHealthMultiplier);
        assertThat(curve.speedMultiplier(1)).isEqualTo(Difficulty.HARD.enemySpeedMultiplier);
        assertThat(curve.rewardMultiplier(1)).isEqualTo(Difficulty.HARD.currencyMultiplier);
    }

    @Test
    void multipliers_shouldNeverDecreaseWithTheWave() {
        for (Difficulty difficulty : Difficulty.values()) {
            DifficultyCurve curve = new DifficultyCurve(difficulty);
            for (int wave = 2; wave <= 60; wave++) {
                assertThat(curve.healthMultiplier(wave)).isGreaterThan(curve.healthMultiplier(wave - 1));
                assertThat(curve.speedMultiplier(wave)).isGreaterThanOrEqualTo(curve.speedMultiplier(wave - 1));
                assertThat(curve.rewardMultiplier(wave)).isGreaterThan(curve.rewardMultiplier(wave - 1));
            }
        }
    }

    @Test
    void speed_shouldBeCappedAtTwice() {
        DifficultyCurve curve = new DifficultyCurve(Difficulty.NORMAL);

        assertThat(curve.speedMultiplier(100)).isCloseTo(2.0, within(1e-9));
        assertThat(curve.healthMultiplier(3)).isCloseTo(1.21, within(1e-9));
    }
}
