package com.stampfit.core.psf;

import java.util.Map;

@FunctionalInterface
public interface PsfFunction {
    double apply(double x, double y, Map<String, Double> parameters);
}
