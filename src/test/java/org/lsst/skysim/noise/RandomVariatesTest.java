package org.lsst.skysim.noise;

import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author tonyj
 */
public class RandomVariatesTest {

    private static final int N = 200_000;

    @Test
    public void testNormal() {
        RandomVariates random = RandomVariates.seeded(12345);
        double sum = 0;
        double sumSquares = 0;
        int withinOneSigma = 0;
        for (int i = 0; i < N; i++) {
            double v = random.normal(5, 2);
            sum += v;
            sumSquares += v * v;
            if (Math.abs(v - 5) < 2) {
                withinOneSigma++;
            }
        }
        double mean = sum / N;
        double stdDev = Math.sqrt(sumSquares / N - mean * mean);
        assertEquals(5, mean, 0.02);
        assertEquals(2, stdDev, 0.02);
        // A rescaled uniform would put 50% here, not 68%
        assertEquals(0.6827, withinOneSigma / (double) N, 0.005);
    }

    @Test
    public void testNormalZeroWidth() {
        RandomVariates random = RandomVariates.seeded(1);
        assertEquals(3.5, random.normal(3.5, 0), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNormalNegativeWidth() {
        RandomVariates.seeded(1).normal(0, -1);
    }

    @Test
    public void testPoisson() {
        RandomVariates random = RandomVariates.seeded(54321);
        for (double lambda : new double[]{0.5, 7, 1500}) {
            double sum = 0;
            double sumSquares = 0;
            int n = 50_000;
            for (int i = 0; i < n; i++) {
                long v = random.poisson(lambda);
                assertTrue(v >= 0);
                sum += v;
                sumSquares += (double) v * v;
            }
            double mean = sum / n;
            double variance = sumSquares / n - mean * mean;
            assertEquals(lambda, mean, 0.03 * lambda + 0.01);
            assertEquals(lambda, variance, 0.05 * lambda + 0.02);
        }
    }

    @Test
    public void testPoissonZero() {
        RandomVariates random = RandomVariates.seeded(1);
        for (int i = 0; i < 100; i++) {
            assertEquals(0, random.poisson(0));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPoissonNegative() {
        RandomVariates.seeded(1).poisson(-1);
    }

    @Test
    public void testUniform() {
        RandomVariates random = RandomVariates.seeded(7);
        for (int i = 0; i < 10_000; i++) {
            double u = random.uniform();
            assertTrue(u >= 0 && u < 1);
        }
    }

    @Test
    public void testSplit() {
        RandomVariates a = RandomVariates.seeded(99);
        RandomVariates b = RandomVariates.seeded(99);
        for (int i = 0; i < 5; i++) {
            RandomVariates childA = a.split();
            RandomVariates childB = b.split();
            for (int j = 0; j < 10; j++) {
                assertEquals(childA.normal(0, 1), childB.normal(0, 1), 0);
                assertEquals(childA.poisson(20), childB.poisson(20));
            }
        }
    }
}
