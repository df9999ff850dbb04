package uy.gub.bps.towerdefense.domain.grid;

import java.util.List;

/**
 * Neighbour offsets in the fixed order N, E, S, W, then NE, SE, SW, NW.
 */
public enum Connectivity {
    FOUR(List.of(new int[]{0, -1}, new int[]{1, 0}, new int[]{0, 1}, new int[]{-1, 0})),
    EIGHT(List.of(new int[]{0, -1}, new int[]{1, 0}, new int[]{0, 1}, new int[]{-1, 0},
            new int[]{1, -1}, new int[]{1, 1}, new int[]{-1, 1}, new int[]{-1, -1}));

    private final List<int[]> offsets;

    Connectivity(List<int[]> offsets) {
        this.offsets = offsets;
    }

    public List<int[]> offsets() {
        return offsets;
    }

    public static Connectivity of(boolean diagonal) {
        return diagonal ? EIGHT : FOUR;
    }
}
