package uy.gub.bps.towerdefense.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable walkable route through cell centers. Progress is the distance travelled from the first cell.
 */
public final class Route {
    private final List<Cell> cells;
    private final double[] cumulative;

    public Route(List<Cell> cells) {
        if (cells == null || cells.isEmpty()) {
            throw new IllegalArgumentException("Route needs at least one cell");
        }
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
        this.cumulative = new double[cells.size()];
        for (int i = 1; i < cells.size(); i++) {
            Cell a = cells.get(i - 1);
            Cell b = cells.get(i);
            int dx = Math.abs(a.x() - b.x());
            int dy = Math.abs(a.y() - b.y());
            if (dx > 1 || dy > 1 || dx + dy == 0) {
                throw new IllegalArgumentException("Route cells " + a + " and " + b + " are not adjacent");
            }
            cumulative[i] = cumulative[i - 1] + (dx + dy == 2 ? Math.sqrt(2) : 1.0);
        }
    }

    public List<Cell> cells() {
        return cells;
    }

    public Cell start() {
        return cells.get(0);
    }

    public Cell end() {
        return cells.get(cells.size() - 1);
    }

    public int size() {
        return cells.size();
    }

    public double length() {
        return cumulative[cumulative.length - 1];
    }

    /**
     * Index of the segment being walked at {@code progress}, i.e. the last cell passed.
     */
    public int segmentAt(double progress) {
        if (progress <= 0) {
            return 0;
        }
        for (int i = 1; i < cumulative.length; i++) {
            if (progress < cumulative[i]) {
                return i - 1;
            }
        }
        return Math.max(0, cells.size() - 2);
    }

    public double distanceTo(int index) {
        return cumulative[index];
    }

    public Position positionAt(double progress) {
        if (cells.size() == 1 || progress <= 0) {
            return start().center();
        }
        if (progress >= length()) {
            return end().center();
        }
        int i = segmentAt(progress);
        double segment = cumulative[i + 1] - cumulative[i];
        double t = (progress - cumulative[i]) / segment;
        return cells.get(i).center().lerp(cells.get(i + 1).center(), t);
    }

    public boolean contains(Cell cell) {
        return cells.contains(cell);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Route other && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "Route" + cells;
    }
}
