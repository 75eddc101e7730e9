package org.lsst.skysim.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.skysim.InvalidConfigurationException;
import org.lsst.skysim.SensorParams;

/**
 * Reads sensor and telescope parameters from a properties file. Values not
 * given in the file are taken from {@code default-sensor.properties}. Lengths
 * are in metres, times in seconds, the sky background in e⁻/m²/arcsec²/s
 * and the seeing in arcseconds.
 *
 * @author tonyj
 */
public class SensorParamsReader {

    private static final Logger LOG = Logger.getLogger(SensorParamsReader.class.getName());
    static final String DEFAULTS = "default-sensor.properties";
    static final Set<String> KEYS = new HashSet<>(Arrays.asList(
            "exposure", "maxADU", "biasOffset", "gain", "readNoise", "darkCurrent",
            "binningX", "binningY", "pixelSizeX", "pixelSizeY", "focalLength",
            "apertureDiameter", "skyBackground", "seeing", "quantumEfficiency"));

    private final Properties props;

    /**
     * Use the defaults only.
     */
    public SensorParamsReader() throws IOException {
        this.props = new Properties(defaults());
    }

    public SensorParamsReader(File file) throws IOException {
        this(new FileInputStream(file));
        LOG.log(Level.FINE, "Read sensor parameters from {0}", file);
    }

    public SensorParamsReader(URL url) throws IOException {
        this(url.openStream());
    }

    /**
     * @param input The properties to read, closed on return
     */
    public SensorParamsReader(InputStream input) throws IOException {
        this.props = new Properties(defaults());
        try (InputStream in = input) {
            props.load(in);
        }
        for (String key : props.stringPropertyNames()) {
            if (!KEYS.contains(key)) {
                throw new InvalidConfigurationException("Unknown sensor parameter: " + key);
            }
        }
    }

    private static Properties defaults() throws IOException {
        Properties defaults = new Properties();
        try (InputStream in = SensorParamsReader.class.getResourceAsStream(DEFAULTS)) {
            if (in == null) {
                throw new IOException("Missing resource " + DEFAULTS);
            }
            defaults.load(in);
        }
        return defaults;
    }

    public SensorParams getSensorParams() {
        return SensorParams.builder()
                .exposure(number("exposure"))
                .maxADU(number("maxADU"))
                .biasOffset(number("biasOffset"))
                .gain(number("gain"))
                .readNoise(number("readNoise"))
                .darkCurrent(number("darkCurrent"))
                .binning(integer("binningX"), integer("binningY"))
                .pixelSize(number("pixelSizeX"), number("pixelSizeY"))
                .focalLength(number("focalLength"))
                .apertureDiameter(number("apertureDiameter"))
                .skyBackground(number("skyBackground"))
                .seeing(number("seeing"))
                .quantumEfficiency(number("quantumEfficiency"))
                .build();
    }

    private String value(String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(key + " is not set");
        }
        return value.trim();
    }

    private double number(String key) {
        String value = value(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException x) {
            throw new InvalidConfigurationException("Invalid value for " + key + ": " + value, x);
        }
    }

    private int integer(String key) {
        String value = value(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException x) {
            throw new InvalidConfigurationException("Invalid value for " + key + ": " + value, x);
        }
    }
}
