package uy.gub.bps.towerdefense.domain.grid;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.SimulationInvariantException;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.Route;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Caches the shortest route from every spawn to the goal and recomputes them only when the grid is dirty.
 */
@Slf4j
public class PathPlanner {
    private final SpatialGrid grid;
    private final Map<Cell, Route> routes = new LinkedHashMap<>();

    public PathPlanner(SpatialGrid grid) {
        this.grid = grid;
        refreshIfDirty();
    }

    public boolean refreshIfDirty() {
        if (!grid.isDirty()) {
            return false;
        }
        routes.clear();
        for (Cell spawn : grid.getSpawns()) {
            Route route = findRoute(spawn).orElseThrow(() ->
                    new SimulationInvariantException("Spawn " + spawn + " has no route to " + grid.getGoal()));
            routes.put(spawn, route);
        }
        grid.markClean();
        log.debug("Recomputed {} spawn routes", routes.size());
        return true;
    }

    public Route routeFrom(Cell spawn) {
        Route route = routes.get(spawn);
        if (route == null) {
            throw new IllegalArgumentException("Unknown spawn " + spawn);
        }
        return route;
    }

    public Collection<Route> routes() {
        return routes.values();
    }

    public Optional<Route> findRoute(Cell from) {
        return BreadthFirstSearch.findRoute(grid.getWidth(), grid.getHeight(), grid.getConnectivity(),
                        grid.walkability(), from, grid.getGoal())
                .map(Route::new)
                .map(this::verify);
    }

    /**
     * Points {@code enemy} at a fresh route that starts with the segment it is walking, keeping its offset on it.
     */
    public void reroute(Enemy enemy) {
        Route current = enemy.getRoute();
        if (enemy.hasReachedGoal()) {
            return;
        }
        int segment = current.segmentAt(enemy.getProgress());
        Cell from = current.cells().get(segment);
        Cell next = current.cells().get(segment + 1);
        double offset = enemy.getProgress() - current.distanceTo(segment);

        Route tail = findRoute(next).orElseThrow(() -> new SimulationInvariantException(
                "Enemy " + enemy.getId() + " at " + from + " is cut off from the goal"));
        List<Cell> cells = new ArrayList<>(tail.size() + 1);
        cells.add(from);
        cells.addAll(tail.cells());
        Route rerouted = verify(new Route(cells));
        enemy.setRoute(rerouted);
        enemy.setProgress(offset);
    }

    /**
     * Cells a walking enemy needs free: the one it stands on, the one it is entering and, on a diagonal step,
     * the two cells beside it.
     */
    public static Set<Cell> footprint(Enemy enemy) {
        Cell from = enemy.getCurrentCell();
        Cell next = enemy.getNextCell();
        Set<Cell> cells = new LinkedHashSet<>();
        cells.add(from);
        cells.add(next);
        if (isDiagonal(from, next)) {
            cells.add(new Cell(next.x(), from.y()));
            cells.add(new Cell(from.x(), next.y()));
        }
        return cells;
    }

    private Route verify(Route route) {
        List<Cell> cells = route.cells();
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            if (!grid.isWalkable(cell)) {
                throw new SimulationInvariantException("Route " + route + " passes through occupied cell " + cell);
            }
            if (i > 0 && isDiagonal(cells.get(i - 1), cell)) {
                Cell prev = cells.get(i - 1);
                if (!grid.isWalkable(new Cell(cell.x(), prev.y())) || !grid.isWalkable(new Cell(prev.x(), cell.y()))) {
                    throw new SimulationInvariantException("Route " + route + " cuts the corner between "
                            + prev + " and " + cell);
                }
            }
        }
        return route;
    }

    private static boolean isDiagonal(Cell a, Cell b) {
        return a.x() != b.x() && a.y() != b.y();
    }
}
