package com.stampfit.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Big-endian IEEE-754 encoding of sample arrays. Raw bits are written, so NaN
 * payloads and signed zeros survive a round trip.
 */
public class DoubleArrayCodec {

    /**
     * Encodes a rectangular 2D array in row-major order.
     */
    public static byte[] toBytes(double[][] rows) {
        if (rows == null) {
            return null;
        }
        int cols = rows.length == 0 ? 0 : rows[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(rows.length * cols * Double.BYTES);
        DoubleBuffer view = buffer.asDoubleBuffer();
        for (double[] row : rows) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Ragged array: expected rows of " + cols + " but found " + row.length);
            }
            view.put(row);
        }
        return buffer.array();
    }

    public static double[][] fromBytes(byte[] bytes, int rows, int cols) {
        if (bytes == null) {
            return null;
        }
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).asDoubleBuffer();
        if (buffer.remaining() != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " values for a " + rows + "x" + cols
                    + " array but found " + buffer.remaining());
        }
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            buffer.get(out[r]);
        }
        return out;
    }
}
