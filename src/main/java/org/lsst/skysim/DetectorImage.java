package org.lsst.skysim;

import java.util.Arrays;

/**
 * A grid of detector counts (ADU), stored flat in row-major order. All values
 * are in [0, maxADU].
 *
 * @author tonyj
 */
public final class DetectorImage {

    private final int width;
    private final int height;
    private final int maxADU;
    private final int[] data;

    /**
     * @param width The image width
     * @param height The image height
     * @param maxADU The largest value any pixel may take
     * @param data The pixels, row-major, copied
     */
    public DetectorImage(int width, int height, int maxADU, int[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(String.format("Image dimensions must be positive: %dx%d", width, height));
        }
        if (data.length != (long) width * height) {
            throw new IllegalArgumentException("Expected " + (long) width * height + " pixels, got " + data.length);
        }
        for (int v : data) {
            if (v < 0 || v > maxADU) {
                throw new IllegalArgumentException("Pixel value " + v + " outside [0," + maxADU + "]");
            }
        }
        this.width = width;
        this.height = height;
        this.maxADU = maxADU;
        this.data = data.clone();
    }

    /**
     * Build from rows, as produced by {@link #toArray()}.
     */
    public static DetectorImage of(int[][] rows, int maxADU) {
        int h = rows.length;
        int w = h == 0 ? 0 : rows[0].length;
        int[] flat = new int[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("Ragged image, row " + y + " has length " + rows[y].length);
            }
            System.arraycopy(rows[y], 0, flat, y * w, w);
        }
        return new DetectorImage(w, h, maxADU, flat);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getMaxADU() {
        return maxADU;
    }

    public int get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(String.format("(%d,%d) outside %dx%d image", x, y, width, height));
        }
        return data[y * width + x];
    }

    public int[] getRow(int y) {
        return Arrays.copyOfRange(data, y * width, (y + 1) * width);
    }

    /**
     * @return A copy of the flat row-major pixel data
     */
    public int[] getData() {
        return data.clone();
    }

    public int[][] toArray() {
        int[][] result = new int[height][];
        for (int y = 0; y < height; y++) {
            result[y] = getRow(y);
        }
        return result;
    }

    @Override
    public String toString() {
        return "DetectorImage{" + "width=" + width + ", height=" + height + ", maxADU=" + maxADU + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 17 * hash + this.width;
        hash = 17 * hash + this.maxADU;
        hash = 17 * hash + Arrays.hashCode(this.data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final DetectorImage other = (DetectorImage) obj;
        return this.width == other.width && this.height == other.height
                && this.maxADU == other.maxADU && Arrays.equals(this.data, other.data);
    }
}
