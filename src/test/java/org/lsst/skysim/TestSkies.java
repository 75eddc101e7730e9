package org.lsst.skysim;

/**
 * Sensor configurations shared by tests.
 *
 * @author tonyj
 */
public class TestSkies {

    public static final EquatorialCoordinate PLEIADES = new EquatorialCoordinate(56.75101, 24.11678);

    /**
     * A noiseless small telescope: 10 micron pixels at 1 m focal length
     * (about 2.06 arcsec/pixel), 4 arcsec seeing, unit gain and no bias.
     */
    public static SensorParams.Builder quiet() {
        return SensorParams.builder()
                .exposure(1)
                .maxADU(65535)
                .biasOffset(0)
                .gain(1)
                .readNoise(0)
                .darkCurrent(0)
                .binning(1, 1)
                .pixelSize(1e-5, 1e-5)
                .focalLength(1)
                .apertureDiameter(0.1)
                .skyBackground(0)
                .seeing(4)
                .quantumEfficiency(1);
    }

    /**
     * The default sensor, as shipped in default-sensor.properties.
     */
    public static SensorParams.Builder standard() {
        return SensorParams.builder()
                .exposure(300)
                .maxADU(65535)
                .biasOffset(300)
                .gain(0.5)
                .readNoise(1.2)
                .darkCurrent(0.2)
                .binning(1, 1)
                .pixelSize(0.00054, 0.00054)
                .focalLength(1.2)
                .apertureDiameter(0.417)
                .skyBackground(50)
                .seeing(1.5)
                .quantumEfficiency(0.93);
    }
}
