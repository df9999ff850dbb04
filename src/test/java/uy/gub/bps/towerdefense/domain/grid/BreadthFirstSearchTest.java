package uy.gub.bps.towerdefense.domain.grid;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.Cell;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BreadthFirstSearchTest {

    private static Predicate<Cell> except(Cell... walls) {
        Set<Cell> blocked = Set.of(walls);
        return c -> !blocked.contains(c);
    }

    @Test
    void findRoute_shouldFollowTheOnlyShortestPath() {
        Optional<List<Cell>> route = BreadthFirstSearch.findRoute(5, 1, Connectivity.FOUR, c -> true,
                new Cell(0, 0), new Cell(4, 0));

        assertThat(route).contains(List.of(new Cell(0, 0), new Cell(1, 0), new Cell(2, 0), new Cell(3, 0),
                new Cell(4, 0)));
    }

    @Test
    void findRoute_shouldReturnEmptyWhenWalledOff() {
        Predicate<Cell> walkable = except(new Cell(1, 0), new Cell(1, 1), new Cell(1, 2));

        assertThat(BreadthFirstSearch.findRoute(3, 3, Connectivity.EIGHT, walkable, new Cell(0, 1), new Cell(2, 1)))
                .isEmpty();
    }

    @Test
    void findRoute_shouldNotCutCornersBetweenObstacles() {
        Predicate<Cell> walkable = except(new Cell(1, 0), new Cell(0, 1));

        assertThat(BreadthFirstSearch.findRoute(2, 2, Connectivity.EIGHT, walkable, new Cell(0, 0), new Cell(1, 1)))
                .isEmpty();
    }

    @Test
    void findRoute_shouldUseDiagonalsWithEightConnectivity() {
        List<Cell> four = BreadthFirstSearch.findRoute(5, 5, Connectivity.FOUR, c -> true,
                new Cell(0, 0), new Cell(4, 4)).orElseThrow();
        List<Cell> eight = BreadthFirstSearch.findRoute(5, 5, Connectivity.EIGHT, c -> true,
                new Cell(0, 0), new Cell(4, 4)).orElseThrow();

        assertThat(four).hasSize(9);
        assertThat(eight).hasSize(5).endsWith(new Cell(4, 4));
    }

    @Test
    void findRoute_shouldRejectUnwalkableEndpoints() {
        assertThat(BreadthFirstSearch.findRoute(3, 1, Connectivity.FOUR, except(new Cell(2, 0)),
                new Cell(0, 0), new Cell(2, 0))).isEmpty();
        assertThat(BreadthFirstSearch.findRoute(3, 1, Connectivity.FOUR, c -> true,
                new Cell(0, 0), new Cell(5, 0))).isEmpty();
    }

    @Test
    void reachable_shouldMarkOnlyConnectedCells() {
        Predicate<Cell> walkable = except(new Cell(1, 0), new Cell(1, 1), new Cell(1, 2));

        boolean[] reach = BreadthFirstSearch.reachable(3, 3, Connectivity.FOUR, walkable, new Cell(2, 1));

        assertThat(reach[BreadthFirstSearch.index(3, new Cell(2, 0))]).isTrue();
        assertThat(reach[BreadthFirstSearch.index(3, new Cell(0, 1))]).isFalse();
        assertThat(reach[BreadthFirstSearch.index(3, new Cell(1, 1))]).isFalse();
    }
}
