package org.lsst.skysim.scale;

import org.lsst.skysim.DetectorImage;

/**
 * Maps detector values onto a bounded display range [0, maxDisplay] by
 * clipping to [vmin, vmax] and rescaling linearly. Stateless apart from the
 * display range, and deterministic.
 *
 * @author tonyj
 */
public class DisplayNormalizer {

    public static final int MAX_16_BIT = 65535;

    private final int maxDisplay;

    public DisplayNormalizer() {
        this(MAX_16_BIT);
    }

    public DisplayNormalizer(int maxDisplay) {
        if (maxDisplay <= 0) {
            throw new IllegalArgumentException("Display range must be positive: " + maxDisplay);
        }
        this.maxDisplay = maxDisplay;
    }

    public int getMaxDisplay() {
        return maxDisplay;
    }

    /**
     * Zscale style normalization about the median:
     * vmin = max(0, median - stdDev*scaleFactor), vmax = min(maxDisplay,
     * median + stdDev*scaleFactor).
     */
    public int[][] normalize(int[][] image, double median, double stdDev, double scaleFactor) {
        double[] range = MedianStdDevScale.range(median, stdDev, scaleFactor, maxDisplay);
        return normalize(image, range[0], range[1]);
    }

    public int[][] normalize(DetectorImage image, double median, double stdDev, double scaleFactor) {
        return normalize(image.toArray(), median, stdDev, scaleFactor);
    }

    public int[][] normalize(DetectorImage image, ScaleCalculator scale) {
        return normalize(image, scale.computeScale(image));
    }

    /**
     * @param range {vmin, vmax}, as computed by a {@link ScaleCalculator}
     */
    public int[][] normalize(DetectorImage image, double[] range) {
        if (range.length != 2) {
            throw new IllegalArgumentException("Expected {vmin, vmax}, got " + range.length + " values");
        }
        return normalize(image.toArray(), range[0], range[1]);
    }

    public int[][] normalize(int[][] image, double vmin, double vmax) {
        if (!(vmax > vmin)) {
            vmax = vmin + 1;
        }
        int[][] result = new int[image.length][];
        for (int y = 0; y < image.length; y++) {
            int[] row = image[y];
            int[] out = new int[row.length];
            for (int x = 0; x < row.length; x++) {
                out[x] = normalize(row[x], vmin, vmax);
            }
            result[y] = out;
        }
        return result;
    }

    /**
     * Normalize a single value. Requires vmax &gt; vmin.
     */
    public int normalize(double value, double vmin, double vmax) {
        double clamped = Math.max(vmin, Math.min(vmax, value));
        return (int) Math.round(maxDisplay * (clamped - vmin) / (vmax - vmin));
    }
}
