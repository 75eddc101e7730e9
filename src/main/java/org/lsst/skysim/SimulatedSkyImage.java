package org.lsst.skysim;

import java.util.Objects;
import org.lsst.skysim.wcs.WCS;

/**
 * The geometry and instrument of a simulated field: image dimensions, the
 * pointing, the sensor parameters and the WCS derived from them. The WCS is
 * centred on the image, (width/2, height/2) maps exactly to the pointing, with
 * right ascension increasing towards smaller x.
 *
 * @author tonyj
 */
public final class SimulatedSkyImage {

    private static final double ARCSEC_PER_DEGREE = 3600.0;
    /**
     * The largest number of pixels an image may have, the largest array the
     * JVM will allocate.
     */
    public static final int MAX_PIXELS = Integer.MAX_VALUE - 8;

    private final int width;
    private final int height;
    private final EquatorialCoordinate center;
    private final SensorParams params;
    private final double pixelScaleX;
    private final double pixelScaleY;
    private final WCS wcs;

    public SimulatedSkyImage(int width, int height, EquatorialCoordinate center, SensorParams params) {
        if (width <= 0 || height <= 0) {
            throw new InvalidConfigurationException(String.format("Image dimensions must be positive: %dx%d", width, height));
        }
        if ((long) width * height > MAX_PIXELS) {
            throw new InvalidConfigurationException(String.format("Image %dx%d has more than %d pixels", width, height, MAX_PIXELS));
        }
        this.width = width;
        this.height = height;
        this.center = Objects.requireNonNull(center, "center");
        this.params = Objects.requireNonNull(params, "params");
        this.pixelScaleX = Math.toDegrees(params.getPixelSizeX() / params.getFocalLength());
        this.pixelScaleY = Math.toDegrees(params.getPixelSizeY() / params.getFocalLength());
        this.wcs = WCS.tan(width / 2.0, height / 2.0, center, -pixelScaleX, 0, 0, pixelScaleY);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public EquatorialCoordinate getCenter() {
        return center;
    }

    public SensorParams getSensorParams() {
        return params;
    }

    public WCS getWCS() {
        return wcs;
    }

    /**
     * @return The pixel scale along x in degrees per pixel
     */
    public double getPixelScaleX() {
        return pixelScaleX;
    }

    public double getPixelScaleY() {
        return pixelScaleY;
    }

    /**
     * @return The collecting area of the aperture in m^2
     */
    public double getApertureArea() {
        double r = params.getApertureDiameter() / 2.0;
        return Math.PI * r * r;
    }

    /**
     * @return The sky background rate in electrons per second per pixel
     */
    public double getSkyBackgroundPerPixel() {
        return params.getSkyBackground() * getApertureArea() * pixelScaleX * pixelScaleY * ARCSEC_PER_DEGREE * ARCSEC_PER_DEGREE;
    }

    /**
     * @return The seeing FWHM along x in pixels
     */
    public double getSeeingPixelsX() {
        return params.getSeeing() / (pixelScaleX * ARCSEC_PER_DEGREE);
    }

    public double getSeeingPixelsY() {
        return params.getSeeing() / (pixelScaleY * ARCSEC_PER_DEGREE);
    }

    /**
     * @return The full field of view along x in degrees
     */
    public double getFieldOfViewX() {
        return Math.toDegrees(2 * Math.atan(width * params.getPixelSizeX() / (2 * params.getFocalLength())));
    }

    public double getFieldOfViewY() {
        return Math.toDegrees(2 * Math.atan(height * params.getPixelSizeY() / (2 * params.getFocalLength())));
    }

    /**
     * @return The angular distance from the centre to a corner of the field,
     * in degrees. A catalog search of this radius covers the whole image.
     */
    public double getRadialExtent() {
        return Math.hypot(getFieldOfViewX(), getFieldOfViewY()) / 2;
    }

    @Override
    public String toString() {
        return "SimulatedSkyImage{" + "width=" + width + ", height=" + height + ", center=" + center
                + ", pixelScaleX=" + pixelScaleX + ", pixelScaleY=" + pixelScaleY + '}';
    }
}
