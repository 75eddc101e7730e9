package org.lsst.skysim.noise;

import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.lsst.skysim.noise.BackgroundModel.RowFiller;

/**
 *
 * @author tonyj
 */
public class BackgroundModelTest {

    private static double[] fill(BackgroundModel model, int n, long seed) {
        RandomVariates random = RandomVariates.seeded(seed);
        RowFiller filler = model.prepare(60, 400, 5, random);
        double[] image = new double[n];
        filler.fill(image, 0, n, random.split());
        return image;
    }

    @Test
    public void testNone() {
        for (double v : fill(BackgroundModel.NONE, 1000, 1)) {
            assertEquals(0, v, 0);
        }
    }

    @Test
    public void testPerPixel() {
        double[] image = fill(BackgroundModel.PER_PIXEL, 100_000, 2);
        double sum = 0;
        double sumSquares = 0;
        for (double v : image) {
            sum += v;
            sumSquares += v * v;
        }
        double mean = sum / image.length;
        double variance = sumSquares / image.length - mean * mean;
        assertEquals(460, mean, 1);
        // Shot noise on dark and sky plus read noise
        assertEquals(460 + 25, variance, 15);
    }

    @Test
    public void testSharedScalar() {
        double[] image = fill(BackgroundModel.SHARED_SCALAR, 10_000, 3);
        double min = Double.MAX_VALUE;
        double max = 0;
        for (double v : image) {
            assertTrue(v >= 0);
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        // One scalar near 460 scaled by a jitter in [0,1)
        assertTrue(max > 300 && max < 600);
        assertTrue(min < 0.01 * max);
    }

    @Test
    public void testOffset() {
        RandomVariates random = RandomVariates.seeded(4);
        RowFiller filler = BackgroundModel.PER_PIXEL.prepare(10, 10, 1, random);
        double[] image = new double[30];
        filler.fill(image, 10, 10, random.split());
        for (int i = 0; i < 30; i++) {
            if (i < 10 || i >= 20) {
                assertEquals(0, image[i], 0);
            }
        }
    }
}
