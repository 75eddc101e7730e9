package org.lsst.skysim.io;

import java.util.Locale;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * Formats coordinates as compact sexagesimal strings for use in file names.
 *
 * @author tonyj
 */
public final class CoordinateFormat {

    private CoordinateFormat() {
    }

    /**
     * Degrees as sign, whole degrees, two digit arc minutes and arc seconds
     * to two decimal places, eg 24.11678 becomes {@code +240700.41}.
     */
    public static String toDMS(double degrees) {
        String sign = degrees < 0 ? "-" : "+";
        long hundredths = Math.round(Math.abs(degrees) * 3600 * 100);
        long d = hundredths / (3600 * 100);
        long m = (hundredths / (60 * 100)) % 60;
        long s = hundredths % (60 * 100);
        return String.format(Locale.ROOT, "%s%d%02d%02d.%02d", sign, d, m, s / 100, s % 100);
    }

    /**
     * File name of the form {@code J2000_<RA><Dec>_<width>_<height>.<extension>}.
     */
    public static String fileName(EquatorialCoordinate center, int width, int height, String extension) {
        return String.format(Locale.ROOT, "J2000_%s%s_%d_%d.%s",
                toDMS(center.getRA()), toDMS(center.getDec()), width, height, extension);
    }
}
