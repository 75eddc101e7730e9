package org.lsst.skysim.psf;

import org.apache.commons.math3.special.Erf;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author tonyj
 */
public class PointSpreadFunctionTest {

    private static double sum(Stamp stamp) {
        double sum = 0;
        for (int y = stamp.getYMin(); y < stamp.getYMin() + stamp.getHeight(); y++) {
            for (int x = stamp.getXMin(); x < stamp.getXMin() + stamp.getWidth(); x++) {
                sum += stamp.getWeight(x, y);
            }
        }
        return sum;
    }

    private static void assertSymmetric(Stamp stamp, int cx, int cy) {
        for (int d = 1; d <= 2; d++) {
            assertEquals(stamp.getWeight(cx - d, cy), stamp.getWeight(cx + d, cy), 1e-12);
            assertEquals(stamp.getWeight(cx, cy - d), stamp.getWeight(cx, cy + d), 1e-12);
            assertTrue(stamp.getWeight(cx, cy) > stamp.getWeight(cx + d, cy));
        }
    }

    @Test
    public void testGaussian() {
        Stamp stamp = new GaussianPSF().render(10.5, 20.5, 3, 3, 3);
        assertEquals(1, sum(stamp), 1e-12);
        assertSymmetric(stamp, 10, 20);
        // Pixel integrated centre of a 3 pixel FWHM Gaussian
        double sigma = 3 / PointSpreadFunction.FWHM_PER_SIGMA;
        double axis = Erf.erf(0.5 / (Math.sqrt(2) * sigma));
        assertEquals(axis * axis, stamp.getWeight(10, 20), 1e-3);
    }

    @Test
    public void testGaussianElliptical() {
        Stamp stamp = new GaussianPSF().render(10.5, 10.5, 2, 6, 3);
        assertEquals(1, sum(stamp), 1e-12);
        assertTrue(stamp.getHeight() > stamp.getWidth());
        assertTrue(stamp.getWeight(10, 12) > stamp.getWeight(12, 10));
    }

    @Test
    public void testMoffat() {
        MoffatPSF moffat = new MoffatPSF();
        assertEquals(3, moffat.getBeta(), 0);
        Stamp stamp = moffat.render(7.5, 7.5, 3, 3, 3);
        assertEquals(1, sum(stamp), 1e-12);
        assertSymmetric(stamp, 7, 7);
    }

    @Test
    public void testMoffatHalfMaximum() {
        // Profile is at half maximum a distance FWHM/2 from the centre
        Stamp stamp = new MoffatPSF(2.5).render(0.5, 0.5, 4, 4, 5);
        assertEquals(0.5, stamp.getWeight(2, 0) / stamp.getWeight(0, 0), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoffatBeta() {
        new MoffatPSF(1);
    }

    @Test
    public void testHalfWidth() {
        assertEquals(1, PointSpreadFunction.halfWidth(0.01, 3));
        assertEquals(4, PointSpreadFunction.halfWidth(3, 3));
    }

    @Test
    public void testAddRowClipped() {
        Stamp stamp = new GaussianPSF().render(0.5, 0.5, 2, 2, 3);
        assertTrue(stamp.getXMin() < 0);
        double[] image = new double[4 * 4];
        for (int y = 0; y < 4; y++) {
            stamp.addRow(image, 4, y, 100);
        }
        double total = 0;
        for (double v : image) {
            total += v;
        }
        assertTrue(total < 100);
        assertTrue(total > 25);
        assertEquals(100 * stamp.getWeight(0, 0), image[0], 1e-9);
        assertEquals(100 * stamp.getWeight(1, 2), image[2 * 4 + 1], 1e-9);
    }

    @Test
    public void testDegenerateWeights() {
        Stamp stamp = Stamp.normalized(0, 0, 3, 3, new double[9], 1.2, 2.7);
        assertEquals(1, stamp.getWeight(1, 2), 0);
        assertEquals(1, sum(stamp), 0);
    }
}
