package com.stampfit.core.patch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegionGridTest {

    @Test
    void testGridCoversImage() {
        List<int[]> corners = RegionGrid.corners(25, 10, 10);

        assertEquals(3, corners.size());
        assertArrayEquals(new int[] { 0, 0 }, corners.get(0));
        assertArrayEquals(new int[] { 10, 0 }, corners.get(1));
        assertArrayEquals(new int[] { 20, 0 }, corners.get(2));
    }

    @Test
    void testRowMajorOrder() {
        List<int[]> corners = RegionGrid.corners(4, 4, 2);

        assertEquals(4, corners.size());
        assertArrayEquals(new int[] { 0, 2 }, corners.get(1));
        assertArrayEquals(new int[] { 2, 0 }, corners.get(2));
    }

    @Test
    void testStepMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> RegionGrid.corners(4, 4, 0));
    }
}
