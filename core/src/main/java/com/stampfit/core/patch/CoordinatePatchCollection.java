package com.stampfit.core.patch;

import com.stampfit.core.detect.SourceDetection;
import com.stampfit.core.detect.SourceDetector;
import com.stampfit.core.exceptions.InvalidSizeException;
import com.stampfit.core.exceptions.PatchNotFoundException;
import com.stampfit.core.exceptions.PatchStorageException;
import com.stampfit.core.fit.FitResult;
import com.stampfit.core.fit.PatchFitter;
import com.stampfit.core.psf.PointSpreadFunction;
import com.stampfit.db.PatchDao;
import com.stampfit.db.SqliteInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Patches keyed by (image index, x, y) corner coordinates. Iteration follows
 * insertion order. Patches are copied on the way in and on the way out, so the
 * size checked by {@link #add} holds for as long as the patch is stored.
 */
public class CoordinatePatchCollection implements PatchCollection {

    private static final Logger logger = LoggerFactory.getLogger(CoordinatePatchCollection.class);

    private final Map<PatchIdentifier, double[][]> patches = new LinkedHashMap<>();
    private Integer patchSize;

    public CoordinatePatchCollection() {
    }

    public CoordinatePatchCollection(Map<PatchIdentifier, double[][]> patches) {
        // all entries are validated before any is stored
        Integer expected = null;
        for (Map.Entry<PatchIdentifier, double[][]> e : patches.entrySet()) {
            int side = checkSquare(e.getKey(), e.getValue());
            if (expected == null) {
                expected = side;
            } else if (side != expected) {
                throw new InvalidSizeException("Patch " + e.getKey() + " has size " + side
                        + " but the collection uses size " + expected + ".");
            }
        }
        for (Map.Entry<PatchIdentifier, double[][]> e : patches.entrySet()) {
            this.patches.put(e.getKey(), copyOf(e.getValue()));
        }
        this.patchSize = expected;
    }

    /**
     * Cuts a {@code size x size} window out of the referenced image for every
     * coordinate. Samples outside the image read as zero, so windows overlapping
     * the edge, or lying wholly outside it, still produce a full patch.
     */
    public static CoordinatePatchCollection extract(List<double[][]> images, List<PatchIdentifier> coordinates,
            int size) {
        if (size <= 0) {
            throw new InvalidSizeException("Patch size must be positive (found " + size + ").");
        }
        for (PatchIdentifier coordinate : coordinates) {
            Integer index = coordinate.getImageIndex();
            if (index == null || index < 0 || index >= images.size()) {
                throw new IllegalArgumentException("Coordinate " + coordinate + " does not reference one of the "
                        + images.size() + " images.");
            }
        }

        CoordinatePatchCollection out = new CoordinatePatchCollection();
        for (PatchIdentifier coordinate : coordinates) {
            double[][] image = images.get(coordinate.getImageIndex());
            out.add(coordinate, window(image, coordinate.getX(), coordinate.getY(), size));
        }
        return out;
    }

    /**
     * Runs source detection on each image and extracts a patch centred on every
     * detected centroid.
     */
    public static CoordinatePatchCollection findStarsAndCreate(List<double[][]> images, int patchSize,
            SourceDetector detector) {
        List<PatchIdentifier> coordinates = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            SourceDetection detection = detector.detect(images.get(i));
            for (SourceDetection.Centroid c : detection.getCentroids()) {
                // centroid x is a column and y a row; identifiers put rows first
                coordinates.add(new PatchIdentifier(i,
                        (int) (c.getY() - patchSize / 2.0),
                        (int) (c.getX() - patchSize / 2.0)));
            }
            logger.info("Image {}: {} sources above threshold (noise={})", i, detection.getCentroids().size(),
                    detection.getNoise());
        }
        return extract(images, coordinates, patchSize);
    }

    public static CoordinatePatchCollection load(Path path) {
        try {
            return new CoordinatePatchCollection(new PatchDao(path.toString()).loadAll());
        } catch (SQLException e) {
            throw new PatchStorageException("Failed to load patches from " + path, e);
        }
    }

    private static double[][] window(double[][] image, int x, int y, int size) {
        double[][] patch = new double[size][size];
        for (int r = 0; r < size; r++) {
            int row = x + r;
            if (row < 0 || row >= image.length) {
                continue;
            }
            double[] src = image[row];
            for (int c = 0; c < size; c++) {
                int col = y + c;
                if (col >= 0 && col < src.length) {
                    patch[r][c] = src[col];
                }
            }
        }
        return patch;
    }

    private static int checkSquare(PatchIdentifier identifier, double[][] patch) {
        if (patch == null || patch.length == 0) {
            throw new InvalidSizeException("Patch " + identifier + " is empty.");
        }
        for (double[] row : patch) {
            if (row.length != patch.length) {
                throw new InvalidSizeException("Patch " + identifier + " is not square: " + patch.length
                        + " rows but a row of " + row.length + ".");
            }
        }
        return patch.length;
    }

    private static double[][] copyOf(double[][] patch) {
        double[][] copy = new double[patch.length][];
        for (int r = 0; r < patch.length; r++) {
            copy[r] = patch[r].clone();
        }
        return copy;
    }

    @Override
    public void add(PatchIdentifier identifier, double[][] patch) {
        int side = checkSquare(identifier, patch);
        if (patchSize != null && side != patchSize) {
            throw new InvalidSizeException("Patch " + identifier + " has size " + side
                    + " but the collection uses size " + patchSize + ".");
        }
        if (patches.containsKey(identifier)) {
            logger.warn("{} is being overwritten in this collection.", identifier);
        }
        patches.put(identifier, copyOf(patch));
        if (patchSize == null) {
            patchSize = side;
        }
    }

    @Override
    public double[][] get(PatchIdentifier identifier) {
        double[][] patch = patches.get(identifier);
        if (patch == null) {
            throw new PatchNotFoundException(identifier);
        }
        return copyOf(patch);
    }

    @Override
    public boolean contains(PatchIdentifier identifier) {
        return patches.containsKey(identifier);
    }

    @Override
    public int size() {
        return patches.size();
    }

    @Override
    public Integer getPatchSize() {
        return patchSize;
    }

    @Override
    public Set<PatchIdentifier> keys() {
        return Collections.unmodifiableSet(patches.keySet());
    }

    @Override
    public Collection<double[][]> values() {
        List<double[][]> copies = new ArrayList<>(patches.size());
        for (double[][] patch : patches.values()) {
            copies.add(copyOf(patch));
        }
        return Collections.unmodifiableList(copies);
    }

    @Override
    public Set<Map.Entry<PatchIdentifier, double[][]>> items() {
        Map<PatchIdentifier, double[][]> copies = new LinkedHashMap<>();
        for (Map.Entry<PatchIdentifier, double[][]> e : patches.entrySet()) {
            copies.put(e.getKey(), copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(copies).entrySet();
    }

    @Override
    public CoordinatePatchCollection average(List<int[]> corners, int step, int size, AverageMode mode) {
        return new RegionAverager(corners, step, size, mode).apply(this);
    }

    @Override
    public CoordinatePatchCollection average(List<int[]> corners, int step, int size, String mode) {
        return average(corners, step, size, AverageMode.fromLabel(mode));
    }

    @Override
    public Map<PatchIdentifier, FitResult> fit(PointSpreadFunction psf, Map<String, Double> initialGuesses) {
        return fit(psf, initialGuesses, false);
    }

    @Override
    public Map<PatchIdentifier, FitResult> fit(PointSpreadFunction psf, Map<String, Double> initialGuesses,
            boolean varied) {
        if (varied) {
            throw new UnsupportedOperationException("Fitting a spatially varying PSF is not implemented.");
        }
        return PatchFitter.withDefaults().fit(this, psf, initialGuesses);
    }

    @Override
    public void save(Path path) {
        try {
            SqliteInitializer.initialize(path.toString());
            PatchDao dao = new PatchDao(path.toString());
            dao.replaceAll(patches);
            logger.info("Saved {} patches to {}", dao.count(), path);
        } catch (SQLException e) {
            throw new PatchStorageException("Failed to save patches to " + path, e);
        }
    }

    @Override
    public String toString() {
        return "CoordinatePatchCollection{patches=" + patches.size() + ", size=" + patchSize + '}';
    }
}
