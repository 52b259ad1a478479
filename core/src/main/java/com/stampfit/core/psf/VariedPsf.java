package com.stampfit.core.psf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A PSF whose parameters change across the detector. Each parameter follows a
 * law of the detector position of the stamp; the base model is then evaluated
 * in stamp-local coordinates.
 */
public class VariedPsf implements PointSpreadFunction {

    /** Value of one PSF parameter at a detector position. */
    @FunctionalInterface
    public interface ParameterLaw {
        double at(double detectorX, double detectorY);
    }

    private final PointSpreadFunction base;
    private final Map<String, ParameterLaw> laws;

    public VariedPsf(PointSpreadFunction base, Map<String, ParameterLaw> laws) {
        if (!laws.keySet().containsAll(base.getParameters())) {
            throw new IllegalArgumentException("Every parameter of " + base.getParameters() + " needs a law");
        }
        this.base = base;
        this.laws = Map.copyOf(laws);
    }

    @Override
    public List<String> getParameters() {
        return base.getParameters();
    }

    @Override
    public double value(double x, double y, Map<String, Double> parameters) {
        return base.value(x, y, parameters);
    }

    @Override
    public Map<String, double[]> getBounds() {
        return base.getBounds();
    }

    /**
     * Resolves the parameter laws at a detector position.
     */
    public Map<String, Double> parametersAt(double detectorX, double detectorY) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String name : base.getParameters()) {
            out.put(name, laws.get(name).at(detectorX, detectorY));
        }
        return out;
    }
}
