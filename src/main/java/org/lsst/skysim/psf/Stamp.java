package org.lsst.skysim.psf;

import java.util.Arrays;

/**
 * A small rectangular window of PSF weights positioned on the image. The
 * window may extend beyond the image, pixels outside are dropped when the
 * stamp is added.
 *
 * @author tonyj
 */
public final class Stamp {

    private final int xMin;
    private final int yMin;
    private final int width;
    private final int height;
    private final double[] weights;

    Stamp(int xMin, int yMin, int width, int height, double[] weights) {
        if (weights.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " weights, got " + weights.length);
        }
        this.xMin = xMin;
        this.yMin = yMin;
        this.width = width;
        this.height = height;
        this.weights = weights;
    }

    /**
     * Normalize the weights to sum to 1. If they sum to nothing all the weight
     * goes to the pixel containing the source.
     */
    static Stamp normalized(int xMin, int yMin, int width, int height, double[] weights, double x0, double y0) {
        double sum = 0;
        for (double w : weights) {
            sum += w;
        }
        if (sum > 0 && Double.isFinite(sum)) {
            for (int i = 0; i < weights.length; i++) {
                weights[i] /= sum;
            }
        } else {
            Arrays.fill(weights, 0);
            int cx = Math.max(0, Math.min(width - 1, (int) Math.floor(x0) - xMin));
            int cy = Math.max(0, Math.min(height - 1, (int) Math.floor(y0) - yMin));
            weights[cy * width + cx] = 1;
        }
        return new Stamp(xMin, yMin, width, height, weights);
    }

    public int getXMin() {
        return xMin;
    }

    public int getYMin() {
        return yMin;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getWeight(int x, int y) {
        if (x < xMin || x >= xMin + width || y < yMin || y >= yMin + height) {
            return 0;
        }
        return weights[(y - yMin) * width + (x - xMin)];
    }

    public boolean coversRow(int y) {
        return y >= yMin && y < yMin + height;
    }

    /**
     * Add {@code flux} times this stamp's weights to image row {@code y} of a
     * flat row-major image buffer.
     */
    public void addRow(double[] image, int imageWidth, int y, double flux) {
        if (!coversRow(y)) {
            return;
        }
        int from = Math.max(0, xMin);
        int to = Math.min(imageWidth, xMin + width);
        int w = (y - yMin) * width - xMin;
        int p = y * imageWidth;
        for (int x = from; x < to; x++) {
            image[p + x] += flux * weights[w + x];
        }
    }

    @Override
    public String toString() {
        return "Stamp{" + "xMin=" + xMin + ", yMin=" + yMin + ", width=" + width + ", height=" + height + '}';
    }
}
