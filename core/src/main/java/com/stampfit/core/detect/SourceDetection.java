package com.stampfit.core.detect;

import java.util.List;

public class SourceDetection {

    private final List<Centroid> centroids;
    private final double background;
    private final double noise;

    public SourceDetection(List<Centroid> centroids, double background, double noise) {
        this.centroids = List.copyOf(centroids);
        this.background = background;
        this.noise = noise;
    }

    public List<Centroid> getCentroids() {
        return centroids;
    }

    public double getBackground() {
        return background;
    }

    public double getNoise() {
        return noise;
    }

    /**
     * Source position in pixel space: {@code x} is the column, {@code y} the row.
     */
    public static class Centroid {
        private final double x;
        private final double y;
        private final double significance;

        public Centroid(double x, double y, double significance) {
            this.x = x;
            this.y = y;
            this.significance = significance;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public double getSignificance() {
            return significance;
        }

        @Override
        public String toString() {
            return String.format("Centroid{x=%.2f, y=%.2f, sig=%.1f}", x, y, significance);
        }
    }
}
