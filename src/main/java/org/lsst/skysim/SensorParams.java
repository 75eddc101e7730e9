package org.lsst.skysim;

import static org.lsst.skysim.InvalidConfigurationException.requireNonNegative;
import static org.lsst.skysim.InvalidConfigurationException.requirePositive;
import static org.lsst.skysim.InvalidConfigurationException.requireSet;

/**
 * Exposure, sensor, optics and sky parameters of a simulated observation.
 * Instances are created with a {@link Builder}, which validates every value.
 *
 * @author tonyj
 */
public final class SensorParams {

    private final double exposure;
    private final double maxADU;
    private final double biasOffset;
    private final double gain;
    private final double readNoise;
    private final double darkCurrent;
    private final int binningX;
    private final int binningY;
    private final double pixelSizeX;
    private final double pixelSizeY;
    private final double focalLength;
    private final double apertureDiameter;
    private final double skyBackground;
    private final double seeing;
    private final double quantumEfficiency;

    private SensorParams(Builder b) {
        requirePositive(b.exposure, "Exposure duration");
        requirePositive(b.maxADU, "Maximum ADU");
        if (b.maxADU < 1) {
            throw new InvalidConfigurationException("Maximum ADU must be at least 1: " + b.maxADU);
        }
        if (b.maxADU > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException("Maximum ADU is too large: " + b.maxADU);
        }
        requireNonNegative(b.biasOffset, "Bias offset");
        requirePositive(b.gain, "Gain");
        requireNonNegative(b.readNoise, "Read noise");
        requireNonNegative(b.darkCurrent, "Dark current");
        if (b.binningX < 1 || b.binningY < 1) {
            throw new InvalidConfigurationException(String.format("Binning must be at least 1: %dx%d", b.binningX, b.binningY));
        }
        requirePositive(b.pixelSizeX, "Pixel size X");
        requirePositive(b.pixelSizeY, "Pixel size Y");
        requirePositive(b.focalLength, "Focal length");
        requirePositive(b.apertureDiameter, "Aperture diameter");
        requireNonNegative(b.skyBackground, "Sky background");
        requirePositive(b.seeing, "Seeing");
        requireSet(b.quantumEfficiency, "Quantum efficiency");
        if (!(b.quantumEfficiency > 0 && b.quantumEfficiency <= 1)) {
            throw new InvalidConfigurationException("Quantum efficiency must be in (0,1]: " + b.quantumEfficiency);
        }
        this.exposure = b.exposure;
        this.maxADU = b.maxADU;
        this.biasOffset = b.biasOffset;
        this.gain = b.gain;
        this.readNoise = b.readNoise;
        this.darkCurrent = b.darkCurrent;
        this.binningX = b.binningX;
        this.binningY = b.binningY;
        this.pixelSizeX = b.pixelSizeX;
        this.pixelSizeY = b.pixelSizeY;
        this.focalLength = b.focalLength;
        this.apertureDiameter = b.apertureDiameter;
        this.skyBackground = b.skyBackground;
        this.seeing = b.seeing;
        this.quantumEfficiency = b.quantumEfficiency;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .exposure(exposure).maxADU(maxADU).biasOffset(biasOffset).gain(gain)
                .readNoise(readNoise).darkCurrent(darkCurrent).binning(binningX, binningY)
                .pixelSize(pixelSizeX, pixelSizeY).focalLength(focalLength)
                .apertureDiameter(apertureDiameter).skyBackground(skyBackground)
                .seeing(seeing).quantumEfficiency(quantumEfficiency);
    }

    /**
     * @return Exposure duration in seconds
     */
    public double getExposure() {
        return exposure;
    }

    public double getMaxADU() {
        return maxADU;
    }

    /**
     * @return Bias offset in ADU
     */
    public double getBiasOffset() {
        return biasOffset;
    }

    /**
     * @return Gain in electrons per ADU
     */
    public double getGain() {
        return gain;
    }

    /**
     * @return Read noise in electrons rms
     */
    public double getReadNoise() {
        return readNoise;
    }

    /**
     * @return Dark current in electrons/s/pixel
     */
    public double getDarkCurrent() {
        return darkCurrent;
    }

    public int getBinningX() {
        return binningX;
    }

    public int getBinningY() {
        return binningY;
    }

    /**
     * @return Pixel size along x in meters
     */
    public double getPixelSizeX() {
        return pixelSizeX;
    }

    public double getPixelSizeY() {
        return pixelSizeY;
    }

    /**
     * @return Focal length in meters
     */
    public double getFocalLength() {
        return focalLength;
    }

    public double getApertureDiameter() {
        return apertureDiameter;
    }

    /**
     * @return Sky background in electrons/m^2/arcsec^2/s
     */
    public double getSkyBackground() {
        return skyBackground;
    }

    /**
     * @return Seeing FWHM in arcseconds
     */
    public double getSeeing() {
        return seeing;
    }

    public double getQuantumEfficiency() {
        return quantumEfficiency;
    }

    @Override
    public String toString() {
        return "SensorParams{" + "exposure=" + exposure + ", maxADU=" + maxADU + ", biasOffset=" + biasOffset
                + ", gain=" + gain + ", readNoise=" + readNoise + ", darkCurrent=" + darkCurrent
                + ", binning=" + binningX + "x" + binningY + ", pixelSize=" + pixelSizeX + "x" + pixelSizeY
                + ", focalLength=" + focalLength + ", apertureDiameter=" + apertureDiameter
                + ", skyBackground=" + skyBackground + ", seeing=" + seeing + ", quantumEfficiency=" + quantumEfficiency + '}';
    }

    /**
     * Every value must be set explicitly, unset values fail
     * {@link #build()}.
     */
    public static class Builder {

        private double exposure = Double.NaN;
        private double maxADU = Double.NaN;
        private double biasOffset = Double.NaN;
        private double gain = Double.NaN;
        private double readNoise = Double.NaN;
        private double darkCurrent = Double.NaN;
        private int binningX;
        private int binningY;
        private double pixelSizeX = Double.NaN;
        private double pixelSizeY = Double.NaN;
        private double focalLength = Double.NaN;
        private double apertureDiameter = Double.NaN;
        private double skyBackground = Double.NaN;
        private double seeing = Double.NaN;
        private double quantumEfficiency = Double.NaN;

        private Builder() {
        }

        public Builder exposure(double seconds) {
            this.exposure = seconds;
            return this;
        }

        public Builder maxADU(double maxADU) {
            this.maxADU = maxADU;
            return this;
        }

        public Builder biasOffset(double adu) {
            this.biasOffset = adu;
            return this;
        }

        public Builder gain(double electronsPerADU) {
            this.gain = electronsPerADU;
            return this;
        }

        public Builder readNoise(double electrons) {
            this.readNoise = electrons;
            return this;
        }

        public Builder darkCurrent(double electronsPerSecond) {
            this.darkCurrent = electronsPerSecond;
            return this;
        }

        public Builder binning(int x, int y) {
            this.binningX = x;
            this.binningY = y;
            return this;
        }

        public Builder pixelSize(double x, double y) {
            this.pixelSizeX = x;
            this.pixelSizeY = y;
            return this;
        }

        public Builder focalLength(double meters) {
            this.focalLength = meters;
            return this;
        }

        public Builder apertureDiameter(double meters) {
            this.apertureDiameter = meters;
            return this;
        }

        public Builder skyBackground(double electrons) {
            this.skyBackground = electrons;
            return this;
        }

        public Builder seeing(double arcsec) {
            this.seeing = arcsec;
            return this;
        }

        public Builder quantumEfficiency(double qe) {
            this.quantumEfficiency = qe;
            return this;
        }

        public SensorParams build() {
            return new SensorParams(this);
        }
    }
}
