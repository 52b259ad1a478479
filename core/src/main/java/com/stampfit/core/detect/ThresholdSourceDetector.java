package com.stampfit.core.detect;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Global-threshold detector. The background is the image median and the noise
 * is the scaled median absolute deviation; pixels more than
 * {@code threshold * noise} above the background are grouped into 8-connected
 * components and each component is reported at its flux-weighted centroid.
 */
public class ThresholdSourceDetector implements SourceDetector {

    private static final Logger logger = LoggerFactory.getLogger(ThresholdSourceDetector.class);

    // MAD to standard deviation for Gaussian noise
    private static final double MAD_SCALE = 1.4826;

    private final double threshold;
    private final int minArea;

    public ThresholdSourceDetector(double threshold, int minArea) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Detection threshold must be positive");
        }
        if (minArea < 1) {
            throw new IllegalArgumentException("Minimum area must be at least one pixel");
        }
        this.threshold = threshold;
        this.minArea = minArea;
    }

    @Override
    public SourceDetection detect(double[][] image) {
        int rows = image.length;
        int cols = rows == 0 ? 0 : image[0].length;
        for (double[] row : image) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Image rows must all have " + cols + " columns but found a row of "
                        + row.length + ".");
            }
        }
        if (rows == 0 || cols == 0) {
            return new SourceDetection(List.of(), 0.0, 0.0);
        }

        double[] flat = new double[rows * cols];
        int n = 0;
        for (double[] row : image) {
            for (double v : row) {
                if (!Double.isNaN(v)) {
                    flat[n++] = v;
                }
            }
        }
        Median median = new Median();
        double background = median.evaluate(flat, 0, n);
        double[] deviations = new double[n];
        for (int i = 0; i < n; i++) {
            deviations[i] = Math.abs(flat[i] - background);
        }
        double noise = MAD_SCALE * median.evaluate(deviations, 0, n);
        double level = background + threshold * noise;

        boolean[][] visited = new boolean[rows][cols];
        List<SourceDetection.Centroid> centroids = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (visited[r][c] || !(image[r][c] > level)) {
                    continue;
                }
                // flood fill one component
                int area = 0;
                double flux = 0.0;
                double sumX = 0.0;
                double sumY = 0.0;
                double peak = Double.NEGATIVE_INFINITY;
                visited[r][c] = true;
                queue.add(new int[] { r, c });
                while (!queue.isEmpty()) {
                    int[] p = queue.poll();
                    double w = image[p[0]][p[1]] - background;
                    area++;
                    flux += w;
                    sumX += w * p[1];
                    sumY += w * p[0];
                    peak = Math.max(peak, w);
                    for (int dr = -1; dr <= 1; dr++) {
                        for (int dc = -1; dc <= 1; dc++) {
                            int nr = p[0] + dr;
                            int nc = p[1] + dc;
                            if (nr >= 0 && nr < rows && nc >= 0 && nc < cols && !visited[nr][nc]
                                    && image[nr][nc] > level) {
                                visited[nr][nc] = true;
                                queue.add(new int[] { nr, nc });
                            }
                        }
                    }
                }
                if (area >= minArea && flux > 0) {
                    double significance = noise > 0 ? peak / noise : Double.POSITIVE_INFINITY;
                    centroids.add(new SourceDetection.Centroid(sumX / flux, sumY / flux, significance));
                }
            }
        }
        logger.debug("Detected {} sources (background={}, noise={}, level={})", centroids.size(), background,
                noise, level);
        return new SourceDetection(centroids, background, noise);
    }
}
