package com.stampfit.core.patch;

import java.util.ArrayList;
import java.util.List;

public class RegionGrid {

    /**
     * Corners of a regular tiling with the given step that covers a
     * {@code rows x cols} image, row-major.
     */
    public static List<int[]> corners(int rows, int cols, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("Region step must be positive (found " + step + ").");
        }
        List<int[]> corners = new ArrayList<>();
        for (int x = 0; x < rows; x += step) {
            for (int y = 0; y < cols; y += step) {
                corners.add(new int[] { x, y });
            }
        }
        return corners;
    }
}
