package uy.gub.bps.towerdefense.domain.grid;

import uy.gub.bps.towerdefense.domain.model.Cell;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Shortest walkable route on a bounded grid. Deterministic: neighbours are expanded in {@link Connectivity} order.
 */
public final class BreadthFirstSearch {

    private BreadthFirstSearch() {
    }

    public static Optional<List<Cell>> findRoute(int width, int height, Connectivity connectivity,
                                                 Predicate<Cell> walkable, Cell start, Cell goal) {
        if (!inBounds(width, height, start) || !inBounds(width, height, goal)) {
            return Optional.empty();
        }
        if (!walkable.test(start) || !walkable.test(goal)) {
            return Optional.empty();
        }
        if (start.equals(goal)) {
            return Optional.of(List.of(start));
        }

        int[] parent = new int[width * height];
        Arrays.fill(parent, -1);
        int startIndex = index(width, start);
        parent[startIndex] = startIndex;
        Deque<Cell> frontier = new ArrayDeque<>();
        frontier.add(start);

        while (!frontier.isEmpty()) {
            Cell current = frontier.poll();
            for (int[] o : connectivity.offsets()) {
                Cell next = current.offset(o[0], o[1]);
                if (!inBounds(width, height, next) || parent[index(width, next)] != -1 || !walkable.test(next)) {
                    continue;
                }
                // diagonal moves may not squeeze between two obstacles
                if (o[0] != 0 && o[1] != 0
                        && (!walkable.test(current.offset(o[0], 0)) || !walkable.test(current.offset(0, o[1])))) {
                    continue;
                }
                parent[index(width, next)] = index(width, current);
                if (next.equals(goal)) {
                    return Optional.of(unwind(width, parent, startIndex, next));
                }
                frontier.add(next);
            }
        }
        return Optional.empty();
    }

    /**
     * Flood fill from {@code origin}; the result is indexed by {@code y * width + x}.
     * Moves are symmetric, so the cells marked are exactly those that can reach {@code origin}.
     */
    public static boolean[] reachable(int width, int height, Connectivity connectivity,
                                      Predicate<Cell> walkable, Cell origin) {
        boolean[] seen = new boolean[width * height];
        if (!inBounds(width, height, origin) || !walkable.test(origin)) {
            return seen;
        }
        Deque<Cell> frontier = new ArrayDeque<>();
        seen[index(width, origin)] = true;
        frontier.add(origin);
        while (!frontier.isEmpty()) {
            Cell current = frontier.poll();
            for (int[] o : connectivity.offsets()) {
                Cell next = current.offset(o[0], o[1]);
                if (!inBounds(width, height, next) || seen[index(width, next)] || !walkable.test(next)) {
                    continue;
                }
                if (o[0] != 0 && o[1] != 0
                        && (!walkable.test(current.offset(o[0], 0)) || !walkable.test(current.offset(0, o[1])))) {
                    continue;
                }
                seen[index(width, next)] = true;
                frontier.add(next);
            }
        }
        return seen;
    }

    private static List<Cell> unwind(int width, int[] parent, int startIndex, Cell end) {
        List<Cell> path = new ArrayList<>();
        int i = index(width, end);
        while (i != startIndex) {
            path.add(new Cell(i % width, i / width));
            i = parent[i];
        }
        path.add(new Cell(startIndex % width, startIndex / width));
        Collections.reverse(path);
        return path;
    }

    static boolean inBounds(int width, int height, Cell cell) {
        return cell.x() >= 0 && cell.y() >= 0 && cell.x() < width && cell.y() < height;
    }

    static int index(int width, Cell cell) {
        return cell.y() * width + cell.x();
    }
}
