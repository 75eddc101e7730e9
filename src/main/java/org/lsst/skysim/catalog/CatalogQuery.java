package org.lsst.skysim.catalog;

import java.util.Objects;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * The parameters of a radial catalog search, usable as a cache key.
 *
 * @author tonyj
 */
public final class CatalogQuery {

    private final EquatorialCoordinate center;
    private final double radius;
    private final int limit;
    private final double magnitudeLimit;

    public CatalogQuery(EquatorialCoordinate center, double radius, int limit, double magnitudeLimit) {
        this.center = Objects.requireNonNull(center, "center");
        if (!(radius > 0) || radius > 180) {
            throw new IllegalArgumentException("Search radius must be in (0,180]: " + radius);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (Double.isNaN(magnitudeLimit)) {
            throw new IllegalArgumentException("Magnitude limit is not set");
        }
        this.radius = radius;
        this.limit = limit;
        this.magnitudeLimit = magnitudeLimit;
    }

    public EquatorialCoordinate getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public int getLimit() {
        return limit;
    }

    public double getMagnitudeLimit() {
        return magnitudeLimit;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + center.hashCode();
        hash = 19 * hash + Double.hashCode(radius);
        hash = 19 * hash + limit;
        hash = 19 * hash + Double.hashCode(magnitudeLimit);
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
        final CatalogQuery other = (CatalogQuery) obj;
        return Double.compare(radius, other.radius) == 0
                && limit == other.limit
                && Double.compare(magnitudeLimit, other.magnitudeLimit) == 0
                && center.equals(other.center);
    }

    @Override
    public String toString() {
        return "CatalogQuery{" + "center=" + center + ", radius=" + radius + ", limit=" + limit + ", magnitudeLimit=" + magnitudeLimit + '}';
    }
}
