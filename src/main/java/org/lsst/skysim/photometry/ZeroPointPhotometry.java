package org.lsst.skysim.photometry;

import org.lsst.skysim.catalog.CatalogSource;

/**
 * Standard magnitude to photon flux relation,
 * <pre>
 * electrons = F0 * 10^(-0.4 m) * area * QE * t
 * </pre>
 * where F0 is the photon flux of a magnitude zero star above the atmosphere.
 * The default, 8.8e9 photons/s/m^2, corresponds to a Vega-like star through
 * a broad visual band (about 1000 photons/s/cm^2/A over 880 A), which is also
 * a reasonable approximation for Gaia G.
 *
 * @author tonyj
 */
public class ZeroPointPhotometry implements PhotometricModel {

    public static final double DEFAULT_ZERO_POINT_FLUX = 8.8e9;

    private final double zeroPointFlux;

    public ZeroPointPhotometry() {
        this(DEFAULT_ZERO_POINT_FLUX);
    }

    public ZeroPointPhotometry(double zeroPointFlux) {
        if (!(zeroPointFlux > 0) || Double.isInfinite(zeroPointFlux)) {
            throw new IllegalArgumentException("Zero point flux must be positive: " + zeroPointFlux);
        }
        this.zeroPointFlux = zeroPointFlux;
    }

    @Override
    public double electrons(CatalogSource source, double apertureArea, double quantumEfficiency, double exposure) {
        return zeroPointFlux * Math.pow(10, -0.4 * source.getMagnitude()) * apertureArea * quantumEfficiency * exposure;
    }

    public double getZeroPointFlux() {
        return zeroPointFlux;
    }

    @Override
    public String toString() {
        return "ZeroPointPhotometry{" + "zeroPointFlux=" + zeroPointFlux + '}';
    }
}
