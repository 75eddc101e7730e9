package org.lsst.skysim.stats;

import java.util.logging.Logger;
import org.lsst.skysim.DetectorImage;

/**
 * Summary statistics over a flat array of counts.
 * <p>
 * The median is the lower median, the order statistic at index (n-1)/2 of the
 * sorted data. For odd n this is the exact middle value; for even n it is the
 * smaller of the two middle values, never their average, so the median is
 * always a value present in the data. The standard deviation is the
 * population standard deviation.
 *
 * @author tonyj
 */
public class Stats {

    private static final Logger LOG = Logger.getLogger(Stats.class.getName());
    // Histograms wider than this, and wider than the data, are not built
    static final int MAX_HISTOGRAM_BINS = 1 << 20;

    private final int[] data;
    private final int maxValue;
    private final int min;
    private final int max;
    private final double mean;
    private final double stdDev;

    /**
     * @param data The counts, not copied and not modified
     * @param maxValue The largest value any count may take
     */
    public Stats(int[] data, int maxValue) {
        this.data = data;
        this.maxValue = maxValue;
        int lo = Integer.MAX_VALUE;
        int hi = Integer.MIN_VALUE;
        double sum = 0;
        for (int v : data) {
            if (v < 0 || v > maxValue) {
                throw new IllegalArgumentException("Value " + v + " outside [0," + maxValue + "]");
            }
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
            sum += v;
        }
        this.min = lo;
        this.max = hi;
        this.mean = data.length == 0 ? Double.NaN : sum / data.length;
        this.stdDev = data.length == 0 ? Double.NaN : populationStdDev(data, mean);
        LOG.fine(() -> String.format("n=%d min=%d max=%d mean=%g stdDev=%g", data.length, min, max, mean, stdDev));
    }

    public static Stats of(DetectorImage image) {
        return new Stats(image.getData(), image.getMaxADU());
    }

    /**
     * Median by quickselect on a copy of the data, expected linear time.
     */
    public int fastMedian() {
        return fastMedian(data);
    }

    /**
     * Median from a histogram of the counts, linear in the number of counts
     * plus the range of values. Always equal to {@link #fastMedian()}. When the
     * range of values is much wider than the data the quickselect result is
     * returned instead.
     */
    public int histogramMedian() {
        requireData(data);
        long span = (long) max - min + 1;
        if (span > Math.max(data.length, MAX_HISTOGRAM_BINS)) {
            LOG.fine(() -> "Value range " + span + " too wide for a histogram, using quickselect");
            return fastMedian();
        }
        int[] counts = new int[(int) span];
        for (int v : data) {
            counts[v - min]++;
        }
        long rank = (data.length - 1) / 2;
        long cumulative = 0;
        for (int i = min; i <= max; i++) {
            cumulative += counts[i - min];
            if (cumulative > rank) {
                return i;
            }
        }
        throw new IllegalStateException("Histogram does not contain rank " + rank);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public int getCount() {
        return data.length;
    }

    /**
     * The lower median of the data, computed by quickselect. The input is not
     * modified.
     */
    public static int fastMedian(int[] values) {
        requireData(values);
        int[] work = values.clone();
        return select(work, (work.length - 1) / 2);
    }

    public static double stdDev(int[] values) {
        requireData(values);
        double sum = 0;
        for (int v : values) {
            sum += v;
        }
        return populationStdDev(values, sum / values.length);
    }

    private static double populationStdDev(int[] values, double mean) {
        double sumSquares = 0;
        for (int v : values) {
            double d = v - mean;
            sumSquares += d * d;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    private static void requireData(int[] values) {
        if (values.length == 0) {
            throw new IllegalStateException("No data");
        }
    }

    /**
     * Hoare-partition quickselect with median of three pivots. Returns the
     * k-th smallest value, partially reordering the array.
     */
    static int select(int[] a, int k) {
        int lo = 0;
        int hi = a.length - 1;
        while (hi > lo) {
            int mid = (lo + hi) >>> 1;
            if (a[mid] < a[lo]) {
                swap(a, lo, mid);
            }
            if (a[hi] < a[lo]) {
                swap(a, lo, hi);
            }
            if (a[hi] < a[mid]) {
                swap(a, mid, hi);
            }
            int pivot = a[mid];
            int i = lo;
            int j = hi;
            while (i <= j) {
                while (a[i] < pivot) {
                    i++;
                }
                while (a[j] > pivot) {
                    j--;
                }
                if (i <= j) {
                    swap(a, i, j);
                    i++;
                    j--;
                }
            }
            // Now a[lo..j] <= pivot, a[i..hi] >= pivot, and anything between equals pivot
            if (k <= j) {
                hi = j;
            } else if (k >= i) {
                lo = i;
            } else {
                return a[k];
            }
        }
        return a[k];
    }

    private static void swap(int[] a, int i, int j) {
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
    }
}
