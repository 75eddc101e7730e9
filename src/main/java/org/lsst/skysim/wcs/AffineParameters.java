package org.lsst.skysim.wcs;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import org.lsst.skysim.InvalidConfigurationException;

/**
 * The six parameters of a 2D affine map
 * <pre>
 * x' = A*x + B*y + E
 * y' = C*x + D*y + F
 * </pre>
 * When used by a {@link WCS}, the linear part maps pixel offsets to tangent
 * plane degrees and (E,F) is the reference equatorial coordinate.
 *
 * @author tonyj
 */
public final class AffineParameters {

    // Relative to the square of the largest matrix element
    private static final double DEGENERATE_TOLERANCE = 1e-12;

    private final AffineTransform transform;
    private final AffineTransform inverse;

    public AffineParameters(double a, double b, double c, double d, double e, double f) {
        for (double v : new double[]{a, b, c, d, e, f}) {
            if (!Double.isFinite(v)) {
                throw new InvalidConfigurationException("Affine parameters must be finite");
            }
        }
        double scale = Math.max(Math.max(Math.abs(a), Math.abs(b)), Math.max(Math.abs(c), Math.abs(d)));
        double det = a * d - b * c;
        if (scale == 0 || Math.abs(det) <= DEGENERATE_TOLERANCE * scale * scale) {
            throw new InvalidConfigurationException(String.format("Affine matrix is not invertible: [[%g,%g],[%g,%g]]", a, b, c, d));
        }
        // AffineTransform takes its arguments column by column
        transform = new AffineTransform(a, c, b, d, e, f);
        try {
            inverse = transform.createInverse();
        } catch (NoninvertibleTransformException x) {
            throw new InvalidConfigurationException("Affine matrix is not invertible", x);
        }
    }

    public double getA() {
        return transform.getScaleX();
    }

    public double getB() {
        return transform.getShearX();
    }

    public double getC() {
        return transform.getShearY();
    }

    public double getD() {
        return transform.getScaleY();
    }

    public double getE() {
        return transform.getTranslateX();
    }

    public double getF() {
        return transform.getTranslateY();
    }

    public double getDeterminant() {
        return transform.getDeterminant();
    }

    public Point2D transform(double x, double y) {
        return transform.transform(new Point2D.Double(x, y), null);
    }

    public Point2D inverseTransform(double x, double y) {
        return inverse.transform(new Point2D.Double(x, y), null);
    }

    /**
     * Apply only the linear (A,B,C,D) part, ignoring the translation.
     */
    public Point2D deltaTransform(double dx, double dy) {
        return transform.deltaTransform(new Point2D.Double(dx, dy), null);
    }

    public Point2D inverseDeltaTransform(double dx, double dy) {
        return inverse.deltaTransform(new Point2D.Double(dx, dy), null);
    }

    public AffineTransform toAffineTransform() {
        return new AffineTransform(transform);
    }

    @Override
    public String toString() {
        return "AffineParameters{" + "A=" + getA() + ", B=" + getB() + ", C=" + getC() + ", D=" + getD() + ", E=" + getE() + ", F=" + getF() + '}';
    }

    @Override
    public int hashCode() {
        return transform.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final AffineParameters other = (AffineParameters) obj;
        return transform.equals(other.transform);
    }
}
