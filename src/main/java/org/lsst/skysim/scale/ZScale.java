package org.lsst.skysim.scale;

import java.util.Arrays;
import java.util.BitSet;
import org.lsst.skysim.DetectorImage;

/**
 * Implementation of the IRAF zscale algorithm.
 *
 * The zscale algorithm is designed to display the image values near the median
 * image value without the time consuming process of computing a full image
 * histogram. This is particularly useful for astronomical images which
 * generally have a very peaked histogram corresponding to the background sky.
 *
 * A grid of pixels with even spacing along lines and columns, up to the
 * maximum sample size, is ranked in brightness to form the function I(i) where
 * i is the rank of the pixel and I is its value. A linear function is fit to
 * I(i) with iterative k-sigma rejection;
 *
 * I(i) = intercept + slope * (i - midpoint)
 *
 * If more than half of the points are rejected then there is no well defined
 * slope and the full range of the sample defines z1 and z2. Otherwise the
 * endpoints of the linear function are used (provided they are within the
 * original range of the sample):
 *
 * z1 = I(midpoint) + (slope / contrast) * (1 - midpoint) z2 = I(midpoint) +
 * (slope / contrast) * (npoints - midpoint)
 *
 * @author tonyj
 */
public class ZScale implements ScaleCalculator {

    public static final int DEFAULT_SAMPLES = 1000;
    public static final double DEFAULT_CONTRAST = 0.25;

    private static final double MAX_REJECT = 0.5;
    private static final int MIN_NPIXELS = 5;
    private static final double KREJ = 2.5;
    private static final int MAX_ITERATIONS = 5;

    private final double contrast;
    private final int nSamples;

    public ZScale() {
        this(DEFAULT_SAMPLES, DEFAULT_CONTRAST);
    }

    public ZScale(int nSamples, double contrast) {
        if (nSamples < 1) {
            throw new IllegalArgumentException("Sample size must be positive: " + nSamples);
        }
        this.nSamples = nSamples;
        this.contrast = contrast;
    }

    @Override
    public double[] computeScale(DetectorImage image) {
        int[] samples = sample(image, nSamples);
        return zscale(samples, contrast);
    }

    static int[] sample(DetectorImage image, int nSamples) {
        int nc = image.getWidth();
        int nl = image.getHeight();
        int stride = (int) Math.max(1.0, Math.sqrt((nc - 1) * (double) (nl - 1) / nSamples));
        int[] result = new int[nSamples];
        int n = 0;
        sampling:
        for (int y = 0; y < nl; y += stride) {
            for (int x = 0; x < nc; x += stride) {
                result[n++] = image.get(x, y);
                if (n == nSamples) {
                    break sampling;
                }
            }
        }
        return Arrays.copyOf(result, n);
    }

    /**
     * Compute {z1, z2} from a set of samples. The array is sorted in place.
     */
    static double[] zscale(int[] samples, double contrast) {
        if (samples.length == 0) {
            throw new IllegalStateException("No samples");
        }
        Arrays.sort(samples);
        int npix = samples.length;
        double zmin = samples[0];
        double zmax = samples[npix - 1];
        int center = (npix - 1) / 2;
        double median = npix % 2 == 1 ? samples[center] : 0.5 * (samples[center] + samples[center + 1]);

        int minpix = Math.max(MIN_NPIXELS, (int) (npix * MAX_REJECT));
        int ngrow = Math.max(1, (int) (npix * 0.01));
        Line line = fitLine(samples, minpix, ngrow);

        if (line == null || contrast <= 0) {
            return new double[]{zmin, zmax};
        }
        double slope = line.slope / contrast;
        double z1 = Math.max(zmin, median - (center - 1) * slope);
        double z2 = Math.min(zmax, median + (npix - center) * slope);
        return new double[]{z1, z2};
    }

    /**
     * Fit a line to the sorted samples with iterative rejection of outliers.
     *
     * @return The fitted line, or <code>null</code> if too many points were
     * rejected
     */
    private static Line fitLine(int[] samples, int minpix, int ngrow) {
        int npix = samples.length;
        BitSet badpix = new BitSet(npix);
        int ngoodpix = npix;
        int last = npix + 1;
        Line line = null;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            if (ngoodpix >= last || ngoodpix < minpix) {
                break;
            }
            line = Line.fit(samples, badpix);
            double sigma = line.residualSigma(samples, badpix);
            double threshold = KREJ * sigma;
            BitSet rejected = new BitSet(npix);
            for (int i = 0; i < npix; i++) {
                double residual = samples[i] - line.valueAt(i);
                if (residual < -threshold || residual > threshold) {
                    rejected.set(Math.max(0, i - ngrow / 2), Math.min(npix, i + ngrow / 2 + 1));
                }
            }
            badpix.or(rejected);
            last = ngoodpix;
            ngoodpix = npix - badpix.cardinality();
        }
        return ngoodpix >= minpix ? line : null;
    }

    static class Line {

        private final double intercept;
        private final double slope;

        Line(double intercept, double slope) {
            this.intercept = intercept;
            this.slope = slope;
        }

        static Line fit(int[] samples, BitSet badpix) {
            double sumX = 0, sumY = 0, sumXX = 0, sumXY = 0;
            int n = 0;
            for (int i = badpix.nextClearBit(0); i < samples.length; i = badpix.nextClearBit(i + 1)) {
                sumX += i;
                sumY += samples[i];
                sumXX += (double) i * i;
                sumXY += (double) i * samples[i];
                n++;
            }
            double denominator = n * sumXX - sumX * sumX;
            if (n == 0) {
                return new Line(0, 0);
            } else if (denominator == 0) {
                return new Line(sumY / n, 0);
            }
            double slope = (n * sumXY - sumX * sumY) / denominator;
            double intercept = (sumY - slope * sumX) / n;
            return new Line(intercept, slope);
        }

        double valueAt(double x) {
            return intercept + slope * x;
        }

        double residualSigma(int[] samples, BitSet badpix) {
            double sum = 0, sumSquares = 0;
            int n = 0;
            for (int i = badpix.nextClearBit(0); i < samples.length; i = badpix.nextClearBit(i + 1)) {
                double residual = samples[i] - valueAt(i);
                sum += residual;
                sumSquares += residual * residual;
                n++;
            }
            if (n == 0) {
                return 0;
            }
            double mean = sum / n;
            return Math.sqrt(Math.max(0, sumSquares / n - mean * mean));
        }

        double getSlope() {
            return slope;
        }

        double getIntercept() {
            return intercept;
        }
    }
}
