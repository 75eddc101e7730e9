package org.lsst.skysim.psf;

import org.apache.commons.math3.special.Erf;

/**
 * A circular or elliptical Gaussian PSF. Each pixel receives the integral of
 * the Gaussian over its area rather than the value at its centre, so narrow
 * profiles still carry the correct flux.
 *
 * @author tonyj
 */
public class GaussianPSF implements PointSpreadFunction {

    private static final double SQRT2 = Math.sqrt(2);

    @Override
    public Stamp render(double x0, double y0, double fwhmX, double fwhmY, double extent) {
        int hx = PointSpreadFunction.halfWidth(fwhmX, extent);
        int hy = PointSpreadFunction.halfWidth(fwhmY, extent);
        int xMin = (int) Math.floor(x0) - hx;
        int yMin = (int) Math.floor(y0) - hy;
        double[] wx = integrate(xMin, 2 * hx + 1, x0, fwhmX / FWHM_PER_SIGMA);
        double[] wy = integrate(yMin, 2 * hy + 1, y0, fwhmY / FWHM_PER_SIGMA);

        int width = wx.length;
        int height = wy.length;
        double[] weights = new double[width * height];
        for (int j = 0; j < height; j++) {
            for (int i = 0; i < width; i++) {
                weights[j * width + i] = wx[i] * wy[j];
            }
        }
        return Stamp.normalized(xMin, yMin, width, height, weights, x0, y0);
    }

    private static double[] integrate(int min, int n, double centre, double sigma) {
        double[] result = new double[n];
        double scale = 1 / (SQRT2 * sigma);
        for (int i = 0; i < n; i++) {
            double lo = (min + i - centre) * scale;
            double hi = (min + i + 1 - centre) * scale;
            result[i] = 0.5 * Erf.erf(lo, hi);
        }
        return result;
    }

    @Override
    public String toString() {
        return "GaussianPSF";
    }
}
