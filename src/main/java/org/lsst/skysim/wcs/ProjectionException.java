package org.lsst.skysim.wcs;

/**
 * Thrown when a coordinate cannot be projected onto the tangent plane, because
 * it lies on or beyond the horizon of the tangent point.
 *
 * @author tonyj
 */
public class ProjectionException extends Exception {

    private static final long serialVersionUID = 1L;

    public ProjectionException(String message) {
        super(message);
    }
}
