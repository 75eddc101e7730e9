package org.lsst.skysim.scale;

import java.util.Arrays;
import java.util.Random;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.lsst.skysim.DetectorImage;

/**
 *
 * @author tonyj
 */
public class ZScaleTest {

    @Test
    public void testFlat() {
        int[] data = new int[100 * 100];
        Arrays.fill(data, 1234);
        double[] range = new ZScale().computeScale(new DetectorImage(100, 100, 65535, data));
        assertEquals(1234, range[0], 0);
        assertEquals(1234, range[1], 0);
    }

    @Test
    public void testRejectsStars() {
        Random random = new Random(17);
        int width = 200;
        int height = 200;
        int[] data = new int[width * height];
        for (int i = 0; i < data.length; i++) {
            data[i] = (int) Math.round(1000 + 10 * random.nextGaussian());
        }
        // A sprinkling of saturated stars
        for (int i = 0; i < 400; i++) {
            data[random.nextInt(data.length)] = 65535;
        }
        double[] range = new ZScale().computeScale(new DetectorImage(width, height, 65535, data));
        assertTrue(range[0] > 900 && range[0] < 1000);
        assertTrue(range[1] > 1000 && range[1] < 1200);
    }

    @Test
    public void testLinearRamp() {
        int[] samples = new int[101];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = 10 * i + (i % 2 == 0 ? 3 : -3);
        }
        double[] range = ZScale.zscale(samples.clone(), 1);
        assertTrue(range[0] < 20);
        assertTrue(range[1] >= 1000);
        // Higher contrast narrows the range about the median
        double[] narrow = ZScale.zscale(samples.clone(), 2);
        assertEquals(255, narrow[0], 10);
        assertEquals(755, narrow[1], 10);
    }

    @Test
    public void testNormalizeWithZScale() {
        int[] data = new int[64 * 64];
        for (int i = 0; i < data.length; i++) {
            data[i] = 500 + (i * 7919) % 101;
        }
        data[0] = 65535;
        DetectorImage image = new DetectorImage(64, 64, 65535, data);
        ZScale zscale = new ZScale();
        double[] range = zscale.computeScale(image);
        int[][] normalized = new DisplayNormalizer().normalize(image, range);
        assertEquals(65535, normalized[0][0]);
        assertTrue(range[1] < 2000);
    }

    @Test
    public void testSample() {
        int[] data = new int[50 * 40];
        for (int i = 0; i < data.length; i++) {
            data[i] = i % 100;
        }
        DetectorImage image = new DetectorImage(50, 40, 100, data);
        assertEquals(2000, ZScale.sample(image, 5000).length);
        assertTrue(ZScale.sample(image, 100).length <= 100);
    }
}
