package org.lsst.skysim;

/**
 * An ICRS equatorial coordinate. Right ascension is normalized into [0,360),
 * declination must lie in [-90,90]. Both are in degrees.
 *
 * @author tonyj
 */
public final class EquatorialCoordinate {

    private final double ra;
    private final double dec;

    public EquatorialCoordinate(double ra, double dec) {
        if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
            throw new IllegalArgumentException("Coordinate must be finite: ra=" + ra + " dec=" + dec);
        }
        if (dec < -90 || dec > 90) {
            throw new IllegalArgumentException("Declination out of range: " + dec);
        }
        this.ra = normalizeRA(ra);
        this.dec = dec;
    }

    public static double normalizeRA(double ra) {
        double result = ra % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        // -1e-17 % 360 + 360 rounds to 360
        return result >= 360.0 ? 0.0 : result;
    }

    public double getRA() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    @Override
    public String toString() {
        return "EquatorialCoordinate{" + "ra=" + ra + ", dec=" + dec + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 61 * hash + Double.hashCode(this.ra);
        hash = 61 * hash + Double.hashCode(this.dec);
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
        final EquatorialCoordinate other = (EquatorialCoordinate) obj;
        return Double.compare(this.ra, other.ra) == 0 && Double.compare(this.dec, other.dec) == 0;
    }
}
