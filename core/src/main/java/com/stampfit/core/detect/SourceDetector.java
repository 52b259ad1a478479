package com.stampfit.core.detect;

public interface SourceDetector {
    /**
     * Finds point sources in an image.
     *
     * @param image samples indexed [row][column]
     * @return detected centroids and the noise estimate used to find them
     */
    SourceDetection detect(double[][] image);
}
