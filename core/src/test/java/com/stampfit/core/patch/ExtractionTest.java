package com.stampfit.core.patch;

import com.stampfit.core.detect.SourceDetection;
import com.stampfit.core.exceptions.InvalidSizeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionTest {

    /** 6x8 image whose sample at (r, c) is 10 * r + c + 1. */
    private static double[][] rampImage() {
        double[][] image = new double[6][8];
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 8; c++) {
                image[r][c] = 10 * r + c + 1;
            }
        }
        return image;
    }

    @Test
    void testInteriorWindow() {
        PatchIdentifier id = new PatchIdentifier(0, 2, 3);
        CoordinatePatchCollection patches = CoordinatePatchCollection.extract(List.<double[][]>of(rampImage()), List.of(id), 3);

        assertEquals(3, patches.getPatchSize());
        double[][] patch = patches.get(id);
        assertArrayEquals(new double[] { 24, 25, 26 }, patch[0]);
        assertArrayEquals(new double[] { 34, 35, 36 }, patch[1]);
        assertArrayEquals(new double[] { 44, 45, 46 }, patch[2]);
    }

    @Test
    void testEveryPatchIsSizeBySize() {
        List<PatchIdentifier> ids = List.of(new PatchIdentifier(0, 0, 0), new PatchIdentifier(0, 5, 7),
                new PatchIdentifier(1, -2, -2), new PatchIdentifier(1, 3, 1));
        List<double[][]> images = List.of(rampImage(), new double[4][4]);

        CoordinatePatchCollection patches = CoordinatePatchCollection.extract(images, ids, 4);

        assertEquals(ids.size(), patches.size());
        for (double[][] patch : patches.values()) {
            assertEquals(4, patch.length);
            for (double[] row : patch) {
                assertEquals(4, row.length);
            }
        }
    }

    @Test
    void testWindowOverEdgeIsZeroFilled() {
        PatchIdentifier id = new PatchIdentifier(0, -1, 6);
        double[][] patch = CoordinatePatchCollection.extract(List.<double[][]>of(rampImage()), List.of(id), 3).get(id);

        // row -1 and columns 8 lie outside the 6x8 image
        assertArrayEquals(new double[] { 0, 0, 0 }, patch[0]);
        assertArrayEquals(new double[] { 7, 8, 0 }, patch[1]);
        assertArrayEquals(new double[] { 17, 18, 0 }, patch[2]);
    }

    @Test
    void testWindowEntirelyOutsideIsAllZero() {
        PatchIdentifier id = new PatchIdentifier(0, 100, -50);
        double[][] patch = CoordinatePatchCollection.extract(List.<double[][]>of(rampImage()), List.of(id), 2).get(id);
        assertArrayEquals(new double[][] { { 0, 0 }, { 0, 0 } }, patch);
    }

    @Test
    void testImagesOfDifferentShapes() {
        double[][] small = { { 1, 2 }, { 3, 4 } };
        List<PatchIdentifier> ids = List.of(new PatchIdentifier(0, 1, 1), new PatchIdentifier(1, 1, 1));
        CoordinatePatchCollection patches = CoordinatePatchCollection.extract(List.of(rampImage(), small), ids, 2);

        assertArrayEquals(new double[][] { { 12, 13 }, { 22, 23 } }, patches.get(ids.get(0)));
        assertArrayEquals(new double[][] { { 4, 0 }, { 0, 0 } }, patches.get(ids.get(1)));
    }

    @Test
    void testBadCoordinatesRejectedBeforeExtraction() {
        List<double[][]> images = List.<double[][]>of(rampImage());
        assertThrows(IllegalArgumentException.class, () -> CoordinatePatchCollection.extract(images,
                List.of(new PatchIdentifier(0, 0, 0), new PatchIdentifier(3, 0, 0)), 2));
        assertThrows(IllegalArgumentException.class,
                () -> CoordinatePatchCollection.extract(images, List.of(PatchIdentifier.derived(0, 0)), 2));
        assertThrows(InvalidSizeException.class,
                () -> CoordinatePatchCollection.extract(images, List.of(new PatchIdentifier(0, 0, 0)), 0));
    }

    @Test
    void testDetectedCentroidsBecomeCornerIdentifiers() {
        List<double[][]> images = List.of(new double[40][40], new double[40][40]);
        // x is a column, y a row
        SourceDetection first = new SourceDetection(List.of(new SourceDetection.Centroid(12.7, 20.2, 9.0)), 0, 1);
        SourceDetection second = new SourceDetection(List.of(new SourceDetection.Centroid(30.0, 5.0, 4.0),
                new SourceDetection.Centroid(3.9, 3.1, 4.0)), 0, 1);

        CoordinatePatchCollection patches = CoordinatePatchCollection.findStarsAndCreate(images, 8,
                image -> image == images.get(0) ? first : second);

        assertEquals(3, patches.size());
        assertTrue(patches.contains(new PatchIdentifier(0, 16, 8)));
        assertTrue(patches.contains(new PatchIdentifier(1, 1, 26)));
        // -0.9 and -0.1 truncate towards zero
        assertTrue(patches.contains(new PatchIdentifier(1, 0, 0)));
        assertEquals(8, patches.getPatchSize());
    }
}
