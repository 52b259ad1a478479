package com.stampfit.core.patch;

import com.stampfit.core.fit.FitResult;
import com.stampfit.core.psf.PointSpreadFunction;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifier-keyed set of square patches that all share one side length.
 */
public interface PatchCollection {

    /**
     * Inserts a patch. Re-adding an existing identifier replaces the stored patch
     * and logs a warning.
     *
     * @throws com.stampfit.core.exceptions.InvalidSizeException if the patch is not
     *         square or its side length differs from the collection's
     */
    void add(PatchIdentifier identifier, double[][] patch);

    /**
     * Returns a copy of the stored patch.
     *
     * @throws com.stampfit.core.exceptions.PatchNotFoundException if absent
     */
    double[][] get(PatchIdentifier identifier);

    boolean contains(PatchIdentifier identifier);

    /** Number of distinct identifiers. */
    int size();

    /** Side length shared by every patch, or {@code null} while the collection is empty. */
    Integer getPatchSize();

    Set<PatchIdentifier> keys();

    Collection<double[][]> values();

    Set<Map.Entry<PatchIdentifier, double[][]>> items();

    /**
     * Averages the patches into spatial regions of width {@code step} whose
     * top-left corners are given by {@code corners} ({x, y} pairs).
     */
    PatchCollection average(List<int[]> corners, int step, int size, AverageMode mode);

    default PatchCollection average(List<int[]> corners, int step, int size, String mode) {
        return average(corners, step, size, AverageMode.fromLabel(mode));
    }

    Map<PatchIdentifier, FitResult> fit(PointSpreadFunction psf, Map<String, Double> initialGuesses);

    /**
     * Fits every patch. With {@code varied} set, parameters would be fitted as
     * smooth functions of position across the collection; that mode is not
     * available yet.
     */
    Map<PatchIdentifier, FitResult> fit(PointSpreadFunction psf, Map<String, Double> initialGuesses, boolean varied);

    /** Writes the whole collection to a single database file, replacing its contents. */
    void save(Path path);
}
