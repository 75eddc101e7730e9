package org.lsst.skysim.wcs;

import java.awt.geom.Point2D;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * Gnomonic (TAN) projection between equatorial coordinates and standard
 * coordinates (xi, eta) on the plane tangent to the sky at (ra0, dec0). All
 * angles in and out are in degrees.
 *
 * @author tonyj
 */
final class GnomonicProjection {

    // Below this the point is on the tangent plane horizon
    private static final double HORIZON_EPSILON = 1e-10;
    // Below this the offset is treated as the tangent point itself
    private static final double RHO_EPSILON = 1e-12;

    private GnomonicProjection() {
    }

    static Point2D project(double ra, double dec, double ra0, double dec0) throws ProjectionException {
        double dra = Math.toRadians(ra - ra0);
        double decR = Math.toRadians(dec);
        double dec0R = Math.toRadians(dec0);
        double sinDec = Math.sin(decR);
        double cosDec = Math.cos(decR);
        double sinDec0 = Math.sin(dec0R);
        double cosDec0 = Math.cos(dec0R);
        double cosDra = Math.cos(dra);

        double cosc = sinDec0 * sinDec + cosDec0 * cosDec * cosDra;
        if (cosc < HORIZON_EPSILON) {
            throw new ProjectionException(String.format("(%.6f, %.6f) is not projectable about (%.6f, %.6f)", ra, dec, ra0, dec0));
        }
        double xi = cosDec * Math.sin(dra) / cosc;
        double eta = (cosDec0 * sinDec - sinDec0 * cosDec * cosDra) / cosc;
        return new Point2D.Double(Math.toDegrees(xi), Math.toDegrees(eta));
    }

    static EquatorialCoordinate deproject(double xi, double eta, double ra0, double dec0) {
        double x = Math.toRadians(xi);
        double y = Math.toRadians(eta);
        double rho = Math.hypot(x, y);
        if (rho < RHO_EPSILON) {
            return new EquatorialCoordinate(ra0, dec0);
        }
        double c = Math.atan(rho);
        double sinC = Math.sin(c);
        double cosC = Math.cos(c);
        double dec0R = Math.toRadians(dec0);
        double sinDec0 = Math.sin(dec0R);
        double cosDec0 = Math.cos(dec0R);

        double sinDec = cosC * sinDec0 + (y * sinC / rho) * cosDec0;
        double dec = Math.toDegrees(Math.asin(Math.max(-1, Math.min(1, sinDec))));
        double ra = ra0 + Math.toDegrees(Math.atan2(x * sinC, rho * cosDec0 * cosC - y * sinDec0 * sinC));
        return new EquatorialCoordinate(ra, Math.max(-90, Math.min(90, dec)));
    }
}
