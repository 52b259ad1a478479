package com.stampfit.core.patch;

import com.stampfit.core.exceptions.InvalidSizeException;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one template per spatial region out of the patches whose centres fall
 * inside it. Each patch is divided by its own peak and zero-padded to the
 * output size before it is stacked, so a template describes shape rather than
 * flux. The peak ignores NaN samples, so a patch with a few NaNs still
 * contributes its finite samples instead of being zeroed out.
 */
public class RegionAverager {

    private static final Logger logger = LoggerFactory.getLogger(RegionAverager.class);

    private final List<int[]> corners;
    private final int step;
    private final int size;
    private final AverageMode mode;

    public RegionAverager(List<int[]> corners, int step, int size, AverageMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Found a mode of null but it must be in the list "
                    + AverageMode.labels() + ".");
        }
        if (corners == null) {
            throw new IllegalArgumentException("Region corners must not be null");
        }
        for (int[] corner : corners) {
            if (corner == null || corner.length != 2) {
                throw new IllegalArgumentException("Each region corner must be an {x, y} pair");
            }
        }
        if (step <= 0) {
            throw new IllegalArgumentException("Region step must be positive (found " + step + ").");
        }
        if (size <= 0) {
            throw new InvalidSizeException("The average window size must be positive (found " + size + ").");
        }
        this.corners = corners;
        this.step = step;
        this.size = size;
        this.mode = mode;
    }

    /**
     * Symmetric padding needed to grow a patch of {@code patchSize} to {@code size}.
     */
    static int padAmount(int size, int patchSize) {
        int pad = size - patchSize;
        if (pad < 0) {
            throw new InvalidSizeException("The average window size (found " + size
                    + ") must be larger than the existing patch size (found " + patchSize + ").");
        }
        if (pad % 2 != 0) {
            throw new InvalidSizeException("The average window size (found " + size
                    + ") must be the same parity as the existing patch size (found " + patchSize + ").");
        }
        return pad / 2;
    }

    public CoordinatePatchCollection apply(PatchCollection source) {
        Integer patchSize = source.getPatchSize();
        int offset = patchSize == null ? 0 : padAmount(size, patchSize);

        // duplicate corners collapse into one region
        Map<PatchIdentifier, Region> regions = new LinkedHashMap<>();
        for (int[] corner : corners) {
            regions.computeIfAbsent(PatchIdentifier.derived(corner[0], corner[1]), k -> new Region(k.getX(), k.getY()));
        }

        int skipped = 0;
        for (Map.Entry<PatchIdentifier, double[][]> entry : source.items()) {
            PatchIdentifier identifier = entry.getKey();
            double[][] padded = normalizeAndPad(entry.getValue(), offset);
            if (padded == null) {
                logger.warn("Skipping {}: its peak is not positive, so it cannot be normalized.", identifier);
                skipped++;
                continue;
            }

            int centerX = identifier.getX() + patchSize / 2;
            int centerY = identifier.getY() + patchSize / 2;
            for (Region region : regions.values()) {
                if (region.contains(centerX, centerY)) {
                    region.accumulate(padded);
                }
            }
        }

        Map<PatchIdentifier, double[][]> averages = new LinkedHashMap<>();
        for (Map.Entry<PatchIdentifier, Region> e : regions.entrySet()) {
            Region region = e.getValue();
            averages.put(e.getKey(), mode == AverageMode.MEAN ? region.mean() : region.median());
            logger.debug("Region ({}, {}) averaged {} patches", region.x, region.y, region.count);
        }
        logger.info("Averaged {} patches into {} regions of step {} using {} ({} skipped)",
                source.size(), regions.size(), step, mode.getLabel(), skipped);
        return new CoordinatePatchCollection(averages);
    }

    /**
     * Divides by the NaN-ignoring maximum and centres the result in a zeroed
     * {@code size x size} array. Returns null when the maximum is not positive.
     */
    private double[][] normalizeAndPad(double[][] patch, int offset) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : patch) {
            for (double v : row) {
                if (v > max) {
                    max = v;
                }
            }
        }
        if (!(max > 0) || Double.isInfinite(max)) {
            return null;
        }

        double[][] out = new double[size][size];
        for (int r = 0; r < patch.length; r++) {
            for (int c = 0; c < patch[r].length; c++) {
                out[r + offset][c + offset] = patch[r][c] / max;
            }
        }
        return out;
    }

    private final class Region {
        final int x;
        final int y;
        final double[][] sum = mode == AverageMode.MEAN ? new double[size][size] : null;
        final List<double[][]> stack = mode == AverageMode.MEDIAN ? new ArrayList<>() : null;
        int count;

        Region(int x, int y) {
            this.x = x;
            this.y = y;
        }

        /** Half-open box [corner, corner + step) on both axes. */
        boolean contains(int px, int py) {
            return x <= px && px < x + step && y <= py && py < y + step;
        }

        void accumulate(double[][] patch) {
            count++;
            if (mode == AverageMode.MEDIAN) {
                stack.add(patch);
                return;
            }
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    double v = patch[r][c];
                    if (!Double.isNaN(v)) {
                        sum[r][c] += v;
                    }
                }
            }
        }

        double[][] mean() {
            double[][] out = new double[size][size];
            if (count == 0) {
                return out;
            }
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    out[r][c] = sum[r][c] / count;
                }
            }
            return out;
        }

        double[][] median() {
            double[][] out = new double[size][size];
            if (stack.isEmpty()) {
                return out;
            }
            Median median = new Median();
            double[] column = new double[stack.size()];
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    int n = 0;
                    for (double[][] patch : stack) {
                        double v = patch[r][c];
                        if (!Double.isNaN(v)) {
                            column[n++] = v;
                        }
                    }
                    out[r][c] = n == 0 ? Double.NaN : median.evaluate(column, 0, n);
                }
            }
            return out;
        }
    }
}
