package org.lsst.skysim.photometry;

import org.lsst.skysim.catalog.CatalogSource;

/**
 * Converts a catalog source into the number of photo-electrons it deposits on
 * the detector during an exposure.
 *
 * @author tonyj
 */
@FunctionalInterface
public interface PhotometricModel {

    /**
     * @param source The source
     * @param apertureArea The collecting area of the telescope in m^2
     * @param quantumEfficiency The fraction of photons converted to electrons
     * @param exposure The exposure time in seconds
     * @return The expected number of electrons, may be NaN if the source has
     * no usable photometry
     */
    double electrons(CatalogSource source, double apertureArea, double quantumEfficiency, double exposure);
}
