package com.stampfit.core.fit;

import com.stampfit.core.patch.PatchIdentifier;

import java.util.Collections;
import java.util.Map;

public class FitResult {
    private final PatchIdentifier identifier;
    private final Map<String, Double> parameters;
    private final int iterations;
    private final int evaluations;
    private final double residualNorm;
    private final double rms;
    private final boolean converged;
    private final String failureReason;

    private FitResult(PatchIdentifier identifier, Map<String, Double> parameters, int iterations, int evaluations,
            double residualNorm, double rms, boolean converged, String failureReason) {
        this.identifier = identifier;
        this.parameters = parameters;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.residualNorm = residualNorm;
        this.rms = rms;
        this.converged = converged;
        this.failureReason = failureReason;
    }

    public static FitResult converged(PatchIdentifier identifier, Map<String, Double> parameters, int iterations,
            int evaluations, double residualNorm, double rms) {
        return new FitResult(identifier, Collections.unmodifiableMap(parameters), iterations, evaluations,
                residualNorm, rms, true, null);
    }

    public static FitResult failed(PatchIdentifier identifier, String reason) {
        return new FitResult(identifier, Map.of(), 0, 0, Double.NaN, Double.NaN, false, reason);
    }

    public PatchIdentifier getIdentifier() {
        return identifier;
    }

    /** Fitted values by parameter name; empty for a failed fit. */
    public Map<String, Double> getParameters() {
        return parameters;
    }

    public double getParameter(String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No fitted value for " + name
                    + (converged ? "" : " (fit failed: " + failureReason + ")"));
        }
        return value;
    }

    public int getIterations() {
        return iterations;
    }

    public int getEvaluations() {
        return evaluations;
    }

    /** Square root of the sum of squared residuals at the optimum. */
    public double getResidualNorm() {
        return residualNorm;
    }

    public double getRms() {
        return rms;
    }

    public boolean isConverged() {
        return converged;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        if (!converged) {
            return "FitResult{" + identifier + ", failed='" + failureReason + "'}";
        }
        return "FitResult{" + identifier +
                ", parameters=" + parameters +
                ", iterations=" + iterations +
                ", residualNorm=" + String.format("%.4g", residualNorm) +
                '}';
    }
}
