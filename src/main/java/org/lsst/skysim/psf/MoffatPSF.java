package org.lsst.skysim.psf;

/**
 * A Moffat profile, I(r) = (1 + (r/alpha)^2)^-beta, sampled at pixel centres.
 * Alpha is chosen so the profile has the requested FWHM. Compared to a
 * Gaussian of the same FWHM it has much broader wings; the stamp is truncated
 * at {@code extent} equivalent sigmas.
 *
 * @author tonyj
 */
public class MoffatPSF implements PointSpreadFunction {

    public static final double DEFAULT_BETA = 3.0;

    private final double beta;

    public MoffatPSF() {
        this(DEFAULT_BETA);
    }

    public MoffatPSF(double beta) {
        if (!(beta > 1) || Double.isInfinite(beta)) {
            throw new IllegalArgumentException("Moffat beta must be greater than 1: " + beta);
        }
        this.beta = beta;
    }

    @Override
    public Stamp render(double x0, double y0, double fwhmX, double fwhmY, double extent) {
        int hx = PointSpreadFunction.halfWidth(fwhmX, extent);
        int hy = PointSpreadFunction.halfWidth(fwhmY, extent);
        int xMin = (int) Math.floor(x0) - hx;
        int yMin = (int) Math.floor(y0) - hy;
        int width = 2 * hx + 1;
        int height = 2 * hy + 1;
        double k = 2 * Math.sqrt(Math.pow(2, 1 / beta) - 1);
        double precisionX = Math.pow(k / fwhmX, 2);
        double precisionY = Math.pow(k / fwhmY, 2);

        double[] weights = new double[width * height];
        for (int j = 0; j < height; j++) {
            double dy = yMin + j + 0.5 - y0;
            for (int i = 0; i < width; i++) {
                double dx = xMin + i + 0.5 - x0;
                double r = dx * dx * precisionX + dy * dy * precisionY;
                weights[j * width + i] = Math.exp(-beta * Math.log1p(r));
            }
        }
        return Stamp.normalized(xMin, yMin, width, height, weights, x0, y0);
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public String toString() {
        return "MoffatPSF{" + "beta=" + beta + '}';
    }
}
