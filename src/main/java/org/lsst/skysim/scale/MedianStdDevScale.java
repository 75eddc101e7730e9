package org.lsst.skysim.scale;

import org.lsst.skysim.DetectorImage;
import org.lsst.skysim.stats.Stats;

/**
 * Display range centred on the image median, extending scaleFactor standard
 * deviations either side, clipped to [0, maxDisplay].
 *
 * @author tonyj
 */
public class MedianStdDevScale implements ScaleCalculator {

    public static final double DEFAULT_SCALE_FACTOR = 1.2;

    private final double scaleFactor;
    private final int maxDisplay;

    public MedianStdDevScale() {
        this(DEFAULT_SCALE_FACTOR, DisplayNormalizer.MAX_16_BIT);
    }

    public MedianStdDevScale(double scaleFactor) {
        this(scaleFactor, DisplayNormalizer.MAX_16_BIT);
    }

    public MedianStdDevScale(double scaleFactor, int maxDisplay) {
        if (!(scaleFactor >= 0) || Double.isInfinite(scaleFactor)) {
            throw new IllegalArgumentException("Scale factor must be finite and non-negative: " + scaleFactor);
        }
        this.scaleFactor = scaleFactor;
        this.maxDisplay = maxDisplay;
    }

    @Override
    public double[] computeScale(DetectorImage image) {
        Stats stats = Stats.of(image);
        return range(stats.fastMedian(), stats.getStdDev(), scaleFactor, maxDisplay);
    }

    /**
     * @return {vmin, vmax} with vmax strictly greater than vmin
     */
    public static double[] range(double median, double stdDev, double scaleFactor, int maxDisplay) {
        double vmin = Math.max(0, median - stdDev * scaleFactor);
        double vmax = Math.min(maxDisplay, median + stdDev * scaleFactor);
        if (!(vmax > vmin)) {
            vmax = vmin + 1;
        }
        return new double[]{vmin, vmax};
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    @Override
    public String toString() {
        return "MedianStdDevScale{" + "scaleFactor=" + scaleFactor + ", maxDisplay=" + maxDisplay + '}';
    }
}
