package com.stampfit.core.patch;

import java.util.Objects;

/**
 * Key of a patch: the index of the image it was cut from and the corner of the
 * patch in that image's unpadded frame. {@code x} indexes rows (first array
 * dimension) and {@code y} indexes columns. Derived patches, such as region
 * averages, carry a {@code null} image index.
 */
public final class PatchIdentifier {

    private final Integer imageIndex;
    private final int x;
    private final int y;

    public PatchIdentifier(Integer imageIndex, int x, int y) {
        this.imageIndex = imageIndex;
        this.x = x;
        this.y = y;
    }

    public static PatchIdentifier derived(int x, int y) {
        return new PatchIdentifier(null, x, y);
    }

    public Integer getImageIndex() {
        return imageIndex;
    }

    public boolean isDerived() {
        return imageIndex == null;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatchIdentifier)) {
            return false;
        }
        PatchIdentifier other = (PatchIdentifier) o;
        return x == other.x && y == other.y && Objects.equals(imageIndex, other.imageIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageIndex, x, y);
    }

    @Override
    public String toString() {
        return "PatchIdentifier{image=" + (imageIndex == null ? "none" : imageIndex) + ", x=" + x + ", y=" + y + '}';
    }
}
