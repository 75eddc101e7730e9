package org.lsst.skysim.wcs;

import java.awt.geom.Point2D;
import java.util.Objects;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * A World Coordinate System mapping pixel positions to equatorial
 * coordinates. Pixel offsets from the reference pixel are taken through the
 * linear part of the affine parameters to tangent plane coordinates (degrees),
 * which are then deprojected about the reference coordinate (E,F).
 * <p>
 * Pixel (i,j) covers [i,i+1) x [j,j+1), so its centre is at (i+0.5, j+0.5).
 * Instances are immutable and safe to share between threads.
 *
 * @author tonyj
 */
public final class WCS {

    private final double x0;
    private final double y0;
    private final Projection projection;
    private final AffineParameters params;

    public WCS(double x0, double y0, Projection projection, AffineParameters params) {
        if (!Double.isFinite(x0) || !Double.isFinite(y0)) {
            throw new IllegalArgumentException("Reference pixel must be finite");
        }
        this.x0 = x0;
        this.y0 = y0;
        this.projection = Objects.requireNonNull(projection, "projection");
        this.params = Objects.requireNonNull(params, "params");
        // The reference coordinate must itself be valid
        getReferenceCoordinate();
    }

    /**
     * Create a TAN WCS with the given reference pixel and coordinate, and a CD
     * matrix in degrees per pixel.
     */
    public static WCS tan(double x0, double y0, EquatorialCoordinate reference, double cd11, double cd12, double cd21, double cd22) {
        return new WCS(x0, y0, Projection.TAN, new AffineParameters(cd11, cd12, cd21, cd22, reference.getRA(), reference.getDec()));
    }

    public EquatorialCoordinate pixelToEquatorial(double px, double py) {
        Point2D standard = params.deltaTransform(px - x0, py - y0);
        return projection.deproject(standard.getX(), standard.getY(), params.getE(), params.getF());
    }

    public Point2D equatorialToPixel(double ra, double dec) throws ProjectionException {
        Point2D standard = projection.project(ra, dec, params.getE(), params.getF());
        Point2D offset = params.inverseDeltaTransform(standard.getX(), standard.getY());
        return new Point2D.Double(offset.getX() + x0, offset.getY() + y0);
    }

    public Point2D equatorialToPixel(EquatorialCoordinate coordinate) throws ProjectionException {
        return equatorialToPixel(coordinate.getRA(), coordinate.getDec());
    }

    public double getReferencePixelX() {
        return x0;
    }

    public double getReferencePixelY() {
        return y0;
    }

    public EquatorialCoordinate getReferenceCoordinate() {
        return new EquatorialCoordinate(params.getE(), params.getF());
    }

    public Projection getProjection() {
        return projection;
    }

    public AffineParameters getAffineParameters() {
        return params;
    }

    @Override
    public String toString() {
        return "WCS{" + "x0=" + x0 + ", y0=" + y0 + ", projection=" + projection + ", params=" + params + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + Double.hashCode(this.x0);
        hash = 37 * hash + Double.hashCode(this.y0);
        hash = 37 * hash + Objects.hashCode(this.projection);
        hash = 37 * hash + Objects.hashCode(this.params);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final WCS other = (WCS) obj;
        return Double.compare(this.x0, other.x0) == 0
                && Double.compare(this.y0, other.y0) == 0
                && this.projection == other.projection
                && Objects.equals(this.params, other.params);
    }
}
