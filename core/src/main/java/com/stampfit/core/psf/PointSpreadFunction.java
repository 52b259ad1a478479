package com.stampfit.core.psf;

import java.util.List;
import java.util.Map;

/**
 * Parametric intensity model of a point source over local pixel coordinates.
 */
public interface PointSpreadFunction {

    /** Parameter names, in the order the fitter packs them. */
    List<String> getParameters();

    double value(double x, double y, Map<String, Double> parameters);

    /**
     * Evaluates the model over coordinate grids of identical shape.
     */
    default double[][] evaluate(double[][] x, double[][] y, Map<String, Double> parameters) {
        double[][] out = new double[x.length][];
        for (int r = 0; r < x.length; r++) {
            out[r] = new double[x[r].length];
            for (int c = 0; c < x[r].length; c++) {
                out[r][c] = value(x[r][c], y[r][c], parameters);
            }
        }
        return out;
    }

    /**
     * Optional {lower, upper} bounds by parameter name. Unlisted parameters are
     * unbounded.
     */
    default Map<String, double[]> getBounds() {
        return Map.of();
    }
}
