package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.PlayerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class UpgradeCostCurveTest {

    @Test
    void costAt_shouldBeStrictlyIncreasingEvenWithoutGrowth() {
        UpgradeCostCurve curve = new UpgradeCostCurve(1, 1.0, 5);

        assertThat(curve.costAt(0)).isEqualTo(1);
        assertThat(curve.costAt(4)).isEqualTo(5);
        assertThat(curve.totalTo(3)).isEqualTo(6);
    }

    @Test
    void everyConfiguredCurve_shouldBeStrictlyIncreasing() {
        for (TowerType type : TowerType.values()) {
            for (TowerAttribute attribute : TowerAttribute.values()) {
                assertIncreasing(new UpgradeCostCurve(attribute.baseCost * type.upgradeCostModifier,
                        attribute.costGrowth, 10));
            }
        }
        for (PlayerAttribute attribute : PlayerAttribute.values()) {
            assertIncreasing(new UpgradeCostCurve(attribute.baseCost, attribute.costGrowth, 10));
        }
    }

    @Test
    void costAt_shouldRefuseToGoPastMaxLevel() {
        UpgradeCostCurve curve = new UpgradeCostCurve(50, 1.25, 2);

        assertThat(curve.canAdvance(1)).isTrue();
        assertThat(curve.canAdvance(2)).isFalse();
        assertThatThrownBy(() -> curve.costAt(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_shouldRejectShrinkingCurves() {
        assertThatThrownBy(() -> new UpgradeCostCurve(10, 0.9, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UpgradeCostCurve(0, 1.2, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertIncreasing(UpgradeCostCurve curve) {
        for (int level = 1; level < curve.maxLevel(); level++) {
            assertThat(curve.costAt(level)).isGreaterThan(curve.costAt(level - 1));
        }
    }
}
