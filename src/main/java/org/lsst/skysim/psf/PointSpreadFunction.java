package org.lsst.skysim.psf;

/**
 * Renders the image of a point source as a normalized stamp.
 *
 * @author tonyj
 */
public interface PointSpreadFunction {

    double FWHM_PER_SIGMA = 2 * Math.sqrt(2 * Math.log(2));

    /**
     * Render a stamp for a source centred at (x0,y0).
     *
     * @param x0 The source position in pixel coordinates (pixel i spans
     * [i,i+1))
     * @param y0 The source position in pixel coordinates
     * @param fwhmX The full width at half maximum along x, in pixels
     * @param fwhmY The full width at half maximum along y, in pixels
     * @param extent The half size of the stamp, in units of the equivalent
     * Gaussian sigma
     * @return A stamp whose weights sum to 1
     */
    Stamp render(double x0, double y0, double fwhmX, double fwhmY, double extent);

    static int halfWidth(double fwhm, double extent) {
        return (int) Math.max(1, Math.ceil(extent * fwhm / FWHM_PER_SIGMA));
    }
}
