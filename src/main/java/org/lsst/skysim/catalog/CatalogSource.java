package org.lsst.skysim.catalog;

import java.util.Objects;

/**
 * A point source returned by a catalog query. Positions are in degrees,
 * proper motions in mas/yr, parallax in mas, magnitude in the catalog's
 * photometric band (G for Gaia). Flux is NaN when the catalog does not provide
 * it.
 *
 * @author tonyj
 */
public final class CatalogSource {

    private final String uid;
    private final String designation;
    private final double ra;
    private final double dec;
    private final double properMotionRA;
    private final double properMotionDec;
    private final double parallax;
    private final double flux;
    private final double magnitude;

    public CatalogSource(String uid, String designation, double ra, double dec,
            double properMotionRA, double properMotionDec, double parallax, double flux, double magnitude) {
        this.uid = uid;
        this.designation = designation;
        this.ra = ra;
        this.dec = dec;
        this.properMotionRA = properMotionRA;
        this.properMotionDec = properMotionDec;
        this.parallax = parallax;
        this.flux = flux;
        this.magnitude = magnitude;
    }

    /**
     * Create a source with only a position and a magnitude.
     */
    public CatalogSource(double ra, double dec, double magnitude) {
        this(null, null, ra, dec, 0, 0, 0, Double.NaN, magnitude);
    }

    public String getUID() {
        return uid;
    }

    public String getDesignation() {
        return designation;
    }

    public double getRA() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    public double getProperMotionRA() {
        return properMotionRA;
    }

    public double getProperMotionDec() {
        return properMotionDec;
    }

    public double getParallax() {
        return parallax;
    }

    public double getFlux() {
        return flux;
    }

    public double getMagnitude() {
        return magnitude;
    }

    @Override
    public String toString() {
        return "CatalogSource{" + "uid=" + uid + ", designation=" + designation + ", ra=" + ra + ", dec=" + dec + ", magnitude=" + magnitude + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 29 * hash + Objects.hashCode(this.uid);
        hash = 29 * hash + Double.hashCode(this.ra);
        hash = 29 * hash + Double.hashCode(this.dec);
        hash = 29 * hash + Double.hashCode(this.magnitude);
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
        final CatalogSource other = (CatalogSource) obj;
        return Objects.equals(this.uid, other.uid)
                && Objects.equals(this.designation, other.designation)
                && Double.compare(this.ra, other.ra) == 0
                && Double.compare(this.dec, other.dec) == 0
                && Double.compare(this.properMotionRA, other.properMotionRA) == 0
                && Double.compare(this.properMotionDec, other.properMotionDec) == 0
                && Double.compare(this.parallax, other.parallax) == 0
                && Double.compare(this.flux, other.flux) == 0
                && Double.compare(this.magnitude, other.magnitude) == 0;
    }
}
