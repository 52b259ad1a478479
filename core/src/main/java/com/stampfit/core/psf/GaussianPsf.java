package com.stampfit.core.psf;

import java.util.List;
import java.util.Map;

/**
 * Circular Gaussian on a flat background:
 * {@code amplitude * exp(-((x - x0)^2 + (y - y0)^2) / (2 sigma^2)) + background}.
 */
public class GaussianPsf extends SimplePsf {

    public static final String AMPLITUDE = "amplitude";
    public static final String X0 = "x0";
    public static final String Y0 = "y0";
    public static final String SIGMA = "sigma";
    public static final String BACKGROUND = "background";

    public GaussianPsf() {
        super(List.of(AMPLITUDE, X0, Y0, SIGMA, BACKGROUND), GaussianPsf::gaussian);
        withBounds(SIGMA, 1e-3, Double.POSITIVE_INFINITY);
    }

    private static double gaussian(double x, double y, Map<String, Double> p) {
        double dx = x - p.get(X0);
        double dy = y - p.get(Y0);
        double sigma = p.get(SIGMA);
        return p.get(AMPLITUDE) * Math.exp(-(dx * dx + dy * dy) / (2 * sigma * sigma)) + p.get(BACKGROUND);
    }

    /**
     * Starting point for a peak-normalized template of the given side length:
     * unit amplitude at the centre, a sigma of a tenth of the side.
     */
    public static Map<String, Double> initialGuess(int size) {
        double center = (size - 1) / 2.0;
        return Map.of(AMPLITUDE, 1.0, X0, center, Y0, center, SIGMA, Math.max(1.0, size / 10.0), BACKGROUND, 0.0);
    }
}
