package org.lsst.skysim;

/**
 * Thrown when a simulation is configured with values that cannot produce a
 * physically meaningful image (non-positive dimensions, pixel size, seeing,
 * exposure or gain, or a degenerate WCS matrix). Always raised at
 * construction time, never during rendering.
 *
 * @author tonyj
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    static void requirePositive(double value, String name) {
        requireSet(value, name);
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidConfigurationException(name + " must be positive: " + value);
        }
    }

    static void requireNonNegative(double value, String name) {
        requireSet(value, name);
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidConfigurationException(name + " must not be negative: " + value);
        }
    }

    static void requireSet(double value, String name) {
        if (Double.isNaN(value)) {
            throw new InvalidConfigurationException(name + " is not set");
        }
    }
}
