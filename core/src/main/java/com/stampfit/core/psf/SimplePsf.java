package com.stampfit.core.psf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A PSF with the same parameters everywhere on the detector.
 */
public class SimplePsf implements PointSpreadFunction {

    private final List<String> parameters;
    private final PsfFunction function;
    private final Map<String, double[]> bounds = new LinkedHashMap<>();

    public SimplePsf(List<String> parameters, PsfFunction function) {
        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("A PSF needs at least one parameter");
        }
        if (parameters.stream().distinct().count() != parameters.size()) {
            throw new IllegalArgumentException("Duplicate PSF parameter names: " + parameters);
        }
        this.parameters = List.copyOf(parameters);
        this.function = function;
    }

    public SimplePsf withBounds(String parameter, double lower, double upper) {
        if (!parameters.contains(parameter)) {
            throw new IllegalArgumentException("Unknown parameter " + parameter + ", expected one of " + parameters);
        }
        if (!(lower <= upper)) {
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
        bounds.put(parameter, new double[] { lower, upper });
        return this;
    }

    @Override
    public List<String> getParameters() {
        return parameters;
    }

    @Override
    public double value(double x, double y, Map<String, Double> parameters) {
        return function.apply(x, y, parameters);
    }

    @Override
    public Map<String, double[]> getBounds() {
        return bounds;
    }
}
