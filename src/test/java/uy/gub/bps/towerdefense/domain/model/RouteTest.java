package uy.gub.bps.towerdefense.domain.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class RouteTest {

    private final Route route = new Route(List.of(new Cell(0, 0), new Cell(1, 1), new Cell(2, 1)));

    @Test
    void length_shouldMeasureDiagonalsAsRootTwo() {
        assertThat(route.length()).isCloseTo(Math.sqrt(2) + 1, within(1e-9));
    }

    @Test
    void positionAt_shouldInterpolateBetweenCellCenters() {
        Position p = route.positionAt(Math.sqrt(2) + 0.5);

        assertThat(p.x()).isCloseTo(2.0, within(1e-9));
        assertThat(p.y()).isCloseTo(1.5, within(1e-9));
        assertThat(route.positionAt(-1)).isEqualTo(new Position(0.5, 0.5));
        assertThat(route.positionAt(99)).isEqualTo(new Position(2.5, 1.5));
    }

    @Test
    void segmentAt_shouldReturnTheLastCellPassed() {
        assertThat(route.segmentAt(0)).isZero();
        assertThat(route.segmentAt(1.0)).isZero();
        assertThat(route.segmentAt(1.5)).isEqualTo(1);
        assertThat(route.segmentAt(10)).isEqualTo(1);
    }

    @Test
    void constructor_shouldRejectGapsAndRepeats() {
        assertThatThrownBy(() -> new Route(List.of(new Cell(0, 0), new Cell(2, 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Route(List.of(new Cell(0, 0), new Cell(0, 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Route(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
