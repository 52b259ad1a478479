package com.stampfit.core.fit;

import com.stampfit.core.exceptions.MissingInitialGuessException;
import com.stampfit.core.exceptions.PatchFitException;
import com.stampfit.core.patch.PatchCollection;
import com.stampfit.core.patch.PatchIdentifier;
import com.stampfit.core.psf.PointSpreadFunction;
import com.stampfit.core.util.StampfitConfig;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fits a PSF model to every patch of a collection by Levenberg-Marquardt least
 * squares. Patches are fitted independently on a worker pool; a patch whose fit
 * fails gets a failed {@link FitResult} and the batch carries on.
 * <p>
 * The model is evaluated with {@code x} the column index and {@code y} the row
 * index of the patch; residuals are {@code data - model}.
 */
public class PatchFitter {

    private static final Logger logger = LoggerFactory.getLogger(PatchFitter.class);

    // relative forward-difference step, about sqrt(machine epsilon)
    private static final double DIFF_STEP = 1.4901161193847656e-8;

    private final StampfitConfig.FittingConfig config;

    public PatchFitter(StampfitConfig.FittingConfig config) {
        this.config = config;
    }

    public static PatchFitter withDefaults() {
        return new PatchFitter(new StampfitConfig.FittingConfig());
    }

    public Map<PatchIdentifier, FitResult> fit(PatchCollection patches, PointSpreadFunction psf,
            Map<String, Double> initialGuesses) {
        List<String> names = psf.getParameters();
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (initialGuesses.get(name) == null) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingInitialGuessException(missing);
        }

        Map<PatchIdentifier, FitResult> results = new LinkedHashMap<>();
        if (patches.size() == 0) {
            return results;
        }

        double[] start = new double[names.size()];
        for (int i = 0; i < start.length; i++) {
            start[i] = initialGuesses.get(names.get(i));
        }
        int size = patches.getPatchSize();
        int threads = Math.min(config.resolveThreads(), patches.size());

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "patch-fit-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<PatchIdentifier, Future<FitResult>> futures = new LinkedHashMap<>();
            for (Map.Entry<PatchIdentifier, double[][]> entry : patches.items()) {
                PatchIdentifier id = entry.getKey();
                double[][] patch = entry.getValue();
                futures.put(id, pool.submit(() -> fitOne(id, patch, size, psf, names, start)));
            }
            for (Map.Entry<PatchIdentifier, Future<FitResult>> e : futures.entrySet()) {
                try {
                    results.put(e.getKey(), e.getValue().get());
                } catch (ExecutionException ex) {
                    logger.warn("Fit of {} failed", e.getKey(), ex.getCause());
                    results.put(e.getKey(), FitResult.failed(e.getKey(), String.valueOf(ex.getCause())));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while fitting patches", e);
        } finally {
            pool.shutdownNow();
        }

        long failed = results.values().stream().filter(r -> !r.isConverged()).count();
        logger.info("Fitted {} patches on {} threads ({} failed)", results.size(), threads, failed);
        return results;
    }

    FitResult fitOne(PatchIdentifier id, double[][] patch, int size, PointSpreadFunction psf, List<String> names,
            double[] start) {
        try {
            double[] target = new double[size * size];
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    double v = patch[r][c];
                    if (!Double.isFinite(v)) {
                        throw new PatchFitException("Patch contains a non-finite sample at (" + r + ", " + c + ")");
                    }
                    target[r * size + c] = v;
                }
            }

            LeastSquaresProblem problem = new LeastSquaresBuilder()
                    .start(start)
                    .model(jacobianFunction(psf, names, size))
                    .target(target)
                    .parameterValidator(boundsValidator(psf, names))
                    .maxIterations(config.maxIterations)
                    .maxEvaluations(config.maxEvaluations)
                    .build();
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer()
                    .withCostRelativeTolerance(config.costRelativeTolerance)
                    .withParameterRelativeTolerance(config.parameterRelativeTolerance)
                    .withOrthoTolerance(config.orthoTolerance)
                    .optimize(problem);

            Map<String, Double> fitted = toParameters(names, optimum.getPoint().toArray());
            return FitResult.converged(id, fitted, optimum.getIterations(), optimum.getEvaluations(),
                    optimum.getCost(), optimum.getRMS());
        } catch (PatchFitException | MathIllegalStateException e) {
            logger.warn("Fit of {} did not converge: {}", id, e.getMessage());
            return FitResult.failed(id, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Fit of {} raised a numerical error", id, e);
            return FitResult.failed(id, e.toString());
        }
    }

    private static Map<String, Double> toParameters(List<String> names, double[] values) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            out.put(names.get(i), values[i]);
        }
        return out;
    }

    private static double[] evaluate(PointSpreadFunction psf, List<String> names, double[] point, int size) {
        Map<String, Double> params = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            params.put(names.get(i), point[i]);
        }
        double[] out = new double[size * size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double v = psf.value(c, r, params);
                if (!Double.isFinite(v)) {
                    throw new PatchFitException("Model is not finite at (" + c + ", " + r + ") for " + params);
                }
                out[r * size + c] = v;
            }
        }
        return out;
    }

    private static MultivariateJacobianFunction jacobianFunction(PointSpreadFunction psf, List<String> names,
            int size) {
        Map<String, double[]> bounds = psf.getBounds();
        return point -> {
            double[] p = point.toArray();
            double[] value = evaluate(psf, names, p, size);
            double[][] jacobian = new double[value.length][p.length];
            for (int j = 0; j < p.length; j++) {
                double h = DIFF_STEP * Math.max(Math.abs(p[j]), 1.0);
                double[] bound = bounds.get(names.get(j));
                if (bound != null && p[j] + h > bound[1]) {
                    h = -h;
                }
                double[] shifted = p.clone();
                shifted[j] += h;
                double[] moved = evaluate(psf, names, shifted, size);
                for (int i = 0; i < value.length; i++) {
                    jacobian[i][j] = (moved[i] - value[i]) / h;
                }
            }
            return new Pair<>(new ArrayRealVector(value, false), new Array2DRowRealMatrix(jacobian, false));
        };
    }

    private static ParameterValidator boundsValidator(PointSpreadFunction psf, List<String> names) {
        Map<String, double[]> bounds = psf.getBounds();
        if (bounds.isEmpty()) {
            return null;
        }
        return params -> {
            RealVector clamped = params.copy();
            for (int j = 0; j < names.size(); j++) {
                double[] bound = bounds.get(names.get(j));
                if (bound != null) {
                    clamped.setEntry(j, Math.min(bound[1], Math.max(bound[0], clamped.getEntry(j))));
                }
            }
            return clamped;
        };
    }
}
