package uy.gub.bps.towerdefense.domain.grid;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.CellState;
import uy.gub.bps.towerdefense.domain.model.CommandFailure;
import uy.gub.bps.towerdefense.domain.model.CommandResult;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Occupancy map of placement cells. Any change in occupancy marks the grid dirty so routes get recomputed.
 */
@Slf4j
public class SpatialGrid {
    private final int width;
    private final int height;
    private final CellState[] states;
    private final long[] towerIds;
    private final List<Cell> spawns;
    private final Cell goal;
    private final Connectivity connectivity;
    private boolean dirty = true;

    public SpatialGrid(SimulationSettings settings) {
        this.width = settings.getGridWidth();
        this.height = settings.getGridHeight();
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid must have positive dimensions, got " + width + "x" + height);
        }
        this.states = new CellState[width * height];
        this.towerIds = new long[width * height];
        Arrays.fill(states, CellState.EMPTY);
        this.spawns = List.copyOf(settings.getSpawns());
        this.goal = settings.getGoal();
        this.connectivity = Connectivity.of(settings.isDiagonalMovement());

        if (spawns.isEmpty()) {
            throw new IllegalArgumentException("At least one spawn is required");
        }
        for (Cell blocked : settings.getBlocked()) {
            if (!inBounds(blocked)) {
                throw new IllegalArgumentException("Blocked cell " + blocked + " is outside the grid");
            }
            states[index(blocked)] = CellState.BLOCKED;
        }
        for (Cell spawn : spawns) {
            if (!isWalkable(spawn)) {
                throw new IllegalArgumentException("Spawn " + spawn + " is not a walkable cell");
            }
            if (spawn.equals(goal)) {
                throw new IllegalArgumentException("Spawn " + spawn + " coincides with the goal");
            }
        }
        if (!isWalkable(goal)) {
            throw new IllegalArgumentException("Goal " + goal + " is not a walkable cell");
        }
        if (findBlockedAnchor(null, spawns) != null) {
            throw new IllegalArgumentException("Map has a spawn with no route to the goal");
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<Cell> getSpawns() {
        return spawns;
    }

    public Cell getGoal() {
        return goal;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }

    public boolean inBounds(Cell cell) {
        return BreadthFirstSearch.inBounds(width, height, cell);
    }

    public CellState stateOf(Cell cell) {
        if (!inBounds(cell)) {
            return CellState.BLOCKED;
        }
        return states[index(cell)];
    }

    public boolean isWalkable(Cell cell) {
        return inBounds(cell) && states[index(cell)] == CellState.EMPTY;
    }

    public Long towerAt(Cell cell) {
        return stateOf(cell) == CellState.TOWER ? towerIds[index(cell)] : null;
    }

    public boolean isBuildable(Cell cell) {
        return checkPlacement(cell, Set.of()) == null;
    }

    public CommandResult<Cell> placeTower(Cell cell, long towerId) {
        return placeTower(cell, towerId, Set.of());
    }

    /**
     * Places a tower unless it lands on an occupied cell or cuts a spawn, or any of the {@code anchors}
     * (cells held by live enemies), off from the goal. Validation happens before anything is committed.
     */
    public CommandResult<Cell> placeTower(Cell cell, long towerId, Collection<Cell> anchors) {
        CommandFailure failure = checkPlacement(cell, anchors);
        if (failure != null) {
            log.debug("Placement at {} rejected: {}", cell, failure);
            return CommandResult.failed(failure);
        }
        states[index(cell)] = CellState.TOWER;
        towerIds[index(cell)] = towerId;
        dirty = true;
        return CommandResult.ok(cell);
    }

    public CommandFailure checkPlacement(Cell cell, Collection<Cell> anchors) {
        if (!inBounds(cell)) {
            return CommandFailure.OUT_OF_BOUNDS;
        }
        if (states[index(cell)] != CellState.EMPTY || anchors.contains(cell)) {
            return CommandFailure.OCCUPIED_CELL;
        }
        if (cell.equals(goal) || spawns.contains(cell)) {
            return CommandFailure.WOULD_BLOCK_PATH;
        }
        List<Cell> mustReach = new ArrayList<>(spawns);
        mustReach.addAll(anchors);
        if (findBlockedAnchor(cell, mustReach) != null) {
            return CommandFailure.WOULD_BLOCK_PATH;
        }
        return null;
    }

    public Long removeTower(Cell cell) {
        Long id = towerAt(cell);
        if (id == null) {
            return null;
        }
        states[index(cell)] = CellState.EMPTY;
        towerIds[index(cell)] = 0;
        dirty = true;
        return id;
    }

    /** In-bounds neighbours of {@code cell} in connectivity order, walkable or not. */
    public List<Cell> neighbors(Cell cell) {
        List<Cell> result = new ArrayList<>();
        for (int[] o : connectivity.offsets()) {
            Cell next = cell.offset(o[0], o[1]);
            if (inBounds(next)) {
                result.add(next);
            }
        }
        return result;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        dirty = true;
    }

    void markClean() {
        dirty = false;
    }

    Predicate<Cell> walkability() {
        return this::isWalkable;
    }

    private Cell findBlockedAnchor(Cell hypotheticalTower, Collection<Cell> mustReach) {
        Predicate<Cell> walkable = hypotheticalTower == null
                ? this::isWalkable
                : c -> !c.equals(hypotheticalTower) && isWalkable(c);
        boolean[] reach = BreadthFirstSearch.reachable(width, height, connectivity, walkable, goal);
        for (Cell anchor : mustReach) {
            if (!inBounds(anchor) || !reach[index(anchor)]) {
                return anchor;
            }
        }
        return null;
    }

    private int index(Cell cell) {
        return BreadthFirstSearch.index(width, cell);
    }
}
