package org.lsst.skysim.wcs;

import java.awt.geom.Point2D;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * Supported spherical projections, named by their FITS CTYPE suffix.
 *
 * @author tonyj
 */
public enum Projection {

    TAN("RA---TAN", "DEC--TAN") {
        @Override
        Point2D project(double ra, double dec, double ra0, double dec0) throws ProjectionException {
            return GnomonicProjection.project(ra, dec, ra0, dec0);
        }

        @Override
        EquatorialCoordinate deproject(double xi, double eta, double ra0, double dec0) {
            return GnomonicProjection.deproject(xi, eta, ra0, dec0);
        }
    };

    private final String ctype1;
    private final String ctype2;

    Projection(String ctype1, String ctype2) {
        this.ctype1 = ctype1;
        this.ctype2 = ctype2;
    }

    abstract Point2D project(double ra, double dec, double ra0, double dec0) throws ProjectionException;

    abstract EquatorialCoordinate deproject(double xi, double eta, double ra0, double dec0);

    public String getCType1() {
        return ctype1;
    }

    public String getCType2() {
        return ctype2;
    }

    public static Projection forCType(String ctype1) {
        for (Projection p : values()) {
            if (p.ctype1.equals(ctype1.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported projection: " + ctype1);
    }
}
