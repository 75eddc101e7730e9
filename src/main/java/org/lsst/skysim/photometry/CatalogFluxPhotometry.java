package org.lsst.skysim.photometry;

import org.lsst.skysim.catalog.CatalogSource;

/**
 * Uses the mean flux reported by the catalog, scaled by the source magnitude,
 * <pre>
 * electrons = flux * QE * t * area * 10^(-0.4 m)
 * </pre>
 * Sources without a catalog flux are handed to a fallback model.
 *
 * @author tonyj
 */
public class CatalogFluxPhotometry implements PhotometricModel {

    private final PhotometricModel fallback;

    public CatalogFluxPhotometry() {
        this(new ZeroPointPhotometry());
    }

    public CatalogFluxPhotometry(PhotometricModel fallback) {
        this.fallback = fallback;
    }

    @Override
    public double electrons(CatalogSource source, double apertureArea, double quantumEfficiency, double exposure) {
        double flux = source.getFlux();
        if (Double.isNaN(flux)) {
            return fallback.electrons(source, apertureArea, quantumEfficiency, exposure);
        }
        return flux * quantumEfficiency * exposure * apertureArea * Math.pow(10, -0.4 * source.getMagnitude());
    }

    @Override
    public String toString() {
        return "CatalogFluxPhotometry{" + "fallback=" + fallback + '}';
    }
}
