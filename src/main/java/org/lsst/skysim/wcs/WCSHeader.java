package org.lsst.skysim.wcs;

import java.util.LinkedHashMap;
import java.util.Map;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * Converts a {@link WCS} to and from FITS WCS keywords. FITS pixel centres are
 * at integer positions starting from 1, whereas our pixel i spans [i,i+1), so
 * CRPIX = x0 + 0.5.
 *
 * @author tonyj
 */
public final class WCSHeader {

    private WCSHeader() {
    }

    /**
     * @return The keywords in the order they should be written to a header.
     * Values are String, Integer or Double.
     */
    public static Map<String, Object> toKeywords(WCS wcs) {
        AffineParameters p = wcs.getAffineParameters();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("WCSAXES", 2);
        result.put("CTYPE1", wcs.getProjection().getCType1());
        result.put("CTYPE2", wcs.getProjection().getCType2());
        result.put("CUNIT1", "deg");
        result.put("CUNIT2", "deg");
        result.put("RADESYS", "ICRS");
        result.put("EQUINOX", 2000.0);
        result.put("CRPIX1", wcs.getReferencePixelX() + 0.5);
        result.put("CRPIX2", wcs.getReferencePixelY() + 0.5);
        result.put("CRVAL1", p.getE());
        result.put("CRVAL2", p.getF());
        result.put("CD1_1", p.getA());
        result.put("CD1_2", p.getB());
        result.put("CD2_1", p.getC());
        result.put("CD2_2", p.getD());
        return result;
    }

    /**
     * Build a WCS from header keywords, as returned by a
     * {@code Map<String,Object>} view of a FITS header. Numeric values may be
     * any {@link Number} or a parsable String.
     */
    public static WCS fromKeywords(Map<String, ?> keywords) {
        Object ctype = keywords.get("CTYPE1");
        Projection projection = ctype == null ? Projection.TAN : Projection.forCType(ctype.toString());
        EquatorialCoordinate reference = new EquatorialCoordinate(number(keywords, "CRVAL1"), number(keywords, "CRVAL2"));
        AffineParameters params = new AffineParameters(
                number(keywords, "CD1_1"), number(keywords, "CD1_2"),
                number(keywords, "CD2_1"), number(keywords, "CD2_2"),
                reference.getRA(), reference.getDec());
        return new WCS(number(keywords, "CRPIX1") - 0.5, number(keywords, "CRPIX2") - 0.5, projection, params);
    }

    private static double number(Map<String, ?> keywords, String key) {
        Object value = keywords.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing WCS keyword: " + key);
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else {
            return Double.parseDouble(value.toString().trim());
        }
    }
}
