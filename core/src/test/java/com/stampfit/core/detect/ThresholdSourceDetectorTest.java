package com.stampfit.core.detect;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdSourceDetectorTest {

    /** Adds a Gaussian blob truncated to a 7x7 box around (row, col). */
    private static void addStar(double[][] image, int row, int col, double amplitude, double sigma) {
        for (int r = row - 3; r <= row + 3; r++) {
            for (int c = col - 3; c <= col + 3; c++) {
                double d2 = (r - row) * (r - row) + (c - col) * (c - col);
                image[r][c] += amplitude * Math.exp(-d2 / (2 * sigma * sigma));
            }
        }
    }

    @Test
    void testFindsStarsAtTheirCentroids() {
        double[][] image = new double[40][40];
        addStar(image, 10, 25, 100, 1.2);
        addStar(image, 30, 8, 60, 1.5);

        SourceDetection detection = new ThresholdSourceDetector(3.0, 5).detect(image);

        List<SourceDetection.Centroid> centroids = detection.getCentroids().stream()
                .sorted(Comparator.comparingDouble(SourceDetection.Centroid::getY))
                .collect(Collectors.toList());
        assertEquals(2, centroids.size());
        assertEquals(25.0, centroids.get(0).getX(), 1e-9);
        assertEquals(10.0, centroids.get(0).getY(), 1e-9);
        assertEquals(8.0, centroids.get(1).getX(), 1e-9);
        assertEquals(30.0, centroids.get(1).getY(), 1e-9);
        assertEquals(0.0, detection.getBackground(), 0.0);
    }

    @Test
    void testSmallComponentsAreIgnored() {
        double[][] image = new double[20][20];
        image[5][5] = 50;
        image[5][6] = 40;
        addStar(image, 12, 12, 80, 1.0);

        SourceDetection detection = new ThresholdSourceDetector(3.0, 5).detect(image);

        assertEquals(1, detection.getCentroids().size());
        assertEquals(12.0, detection.getCentroids().get(0).getX(), 1e-9);
    }

    @Test
    void testNoiseEstimateFromBackground() {
        double[][] image = new double[10][10];
        for (int r = 0; r < 10; r++) {
            for (int c = 0; c < 10; c++) {
                // checkerboard of 9 and 11 around a level of 10
                image[r][c] = (r + c) % 2 == 0 ? 9 : 11;
            }
        }

        SourceDetection detection = new ThresholdSourceDetector(3.0, 1).detect(image);

        assertEquals(10.0, detection.getBackground(), 1e-12);
        assertEquals(1.4826, detection.getNoise(), 1e-12);
        assertTrue(detection.getCentroids().isEmpty());
    }

    @Test
    void testRaggedImageRejected() {
        double[][] ragged = { { 1, 2, 3 }, { 4, 5 }, { 6, 7, 8 } };
        assertThrows(IllegalArgumentException.class, () -> new ThresholdSourceDetector(3, 1).detect(ragged));
    }

    @Test
    void testInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdSourceDetector(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdSourceDetector(3, 0));
    }
}
