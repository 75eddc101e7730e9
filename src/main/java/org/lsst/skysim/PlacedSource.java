package org.lsst.skysim;

import org.lsst.skysim.catalog.CatalogSource;
import org.lsst.skysim.psf.Stamp;

/**
 * A catalog source positioned on the image, with its expected signal and the
 * PSF stamp it will be rendered with.
 *
 * @author tonyj
 */
public final class PlacedSource {

    private final CatalogSource source;
    private final double x;
    private final double y;
    private final double electrons;
    private final Stamp stamp;

    PlacedSource(CatalogSource source, double x, double y, double electrons, Stamp stamp) {
        this.source = source;
        this.x = x;
        this.y = y;
        this.electrons = electrons;
        this.stamp = stamp;
    }

    public CatalogSource getSource() {
        return source;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getElectrons() {
        return electrons;
    }

    public Stamp getStamp() {
        return stamp;
    }

    @Override
    public String toString() {
        return "PlacedSource{" + "source=" + source + ", x=" + x + ", y=" + y + ", electrons=" + electrons + '}';
    }
}
