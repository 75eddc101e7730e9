package org.lsst.skysim.wcs;

import java.awt.geom.Point2D;
import java.util.Map;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import org.lsst.skysim.EquatorialCoordinate;
import org.lsst.skysim.InvalidConfigurationException;

/**
 *
 * @author tonyj
 */
public class WCSTest {

    private static final double SCALE = 1.0 / 3600;

    private static WCS field(EquatorialCoordinate center) {
        return WCS.tan(50, 40, center, -SCALE, 0, 0, SCALE);
    }

    @Test
    public void testRoundTrip() throws ProjectionException {
        WCS wcs = field(new EquatorialCoordinate(56.75101, 24.11678));
        for (double px = 0; px <= 100; px += 7.3) {
            for (double py = 0; py <= 80; py += 5.9) {
                EquatorialCoordinate c = wcs.pixelToEquatorial(px, py);
                Point2D p = wcs.equatorialToPixel(c);
                assertEquals(px, p.getX(), 1e-6);
                assertEquals(py, p.getY(), 1e-6);
            }
        }
    }

    @Test
    public void testRoundTripRotated() throws ProjectionException {
        double angle = Math.toRadians(30);
        double cos = Math.cos(angle) * SCALE;
        double sin = Math.sin(angle) * SCALE;
        WCS wcs = WCS.tan(512, 512, new EquatorialCoordinate(350, -60), -cos, sin, sin, cos);
        for (double px = 0; px <= 1024; px += 97) {
            for (double py = 0; py <= 1024; py += 101) {
                Point2D p = wcs.equatorialToPixel(wcs.pixelToEquatorial(px, py));
                assertEquals(px, p.getX(), 1e-6);
                assertEquals(py, p.getY(), 1e-6);
            }
        }
    }

    @Test
    public void testRoundTripAcrossZeroRA() throws ProjectionException {
        WCS wcs = field(new EquatorialCoordinate(0.001, 0));
        EquatorialCoordinate c = wcs.pixelToEquatorial(100, 40);
        Point2D p = wcs.equatorialToPixel(c);
        assertEquals(100, p.getX(), 1e-6);
        assertEquals(40, p.getY(), 1e-6);
    }

    @Test
    public void testCenter() throws ProjectionException {
        EquatorialCoordinate center = new EquatorialCoordinate(56.75101, 24.11678);
        WCS wcs = field(center);
        EquatorialCoordinate c = wcs.pixelToEquatorial(50, 40);
        assertEquals(center.getRA(), c.getRA(), 0);
        assertEquals(center.getDec(), c.getDec(), 0);
        Point2D p = wcs.equatorialToPixel(center);
        assertEquals(50, p.getX(), 1e-9);
        assertEquals(40, p.getY(), 1e-9);
    }

    @Test
    public void testOrientation() throws ProjectionException {
        WCS wcs = field(new EquatorialCoordinate(10, 0));
        // RA increases to the left, Dec increases with y
        Point2D east = wcs.equatorialToPixel(10.01, 0);
        Point2D north = wcs.equatorialToPixel(10, 0.01);
        assertEquals(50 - 36, east.getX(), 0.01);
        assertEquals(40 + 36, north.getY(), 0.01);
    }

    @Test
    public void testGnomonic() throws ProjectionException {
        Point2D p = GnomonicProjection.project(30, 21, 30, 20);
        assertEquals(0, p.getX(), 1e-12);
        assertEquals(Math.toDegrees(Math.tan(Math.toRadians(1))), p.getY(), 1e-9);
        EquatorialCoordinate c = GnomonicProjection.deproject(p.getX(), p.getY(), 30, 20);
        assertEquals(30, c.getRA(), 1e-9);
        assertEquals(21, c.getDec(), 1e-9);
    }

    @Test(expected = ProjectionException.class)
    public void testAntipodal() throws ProjectionException {
        WCS wcs = field(new EquatorialCoordinate(10, 20));
        wcs.equatorialToPixel(190, -20);
    }

    @Test(expected = ProjectionException.class)
    public void testOppositeHemisphere() throws ProjectionException {
        WCS wcs = field(new EquatorialCoordinate(0, 0));
        wcs.equatorialToPixel(95, 0);
    }

    @Test
    public void testDegenerate() {
        try {
            WCS.tan(0, 0, new EquatorialCoordinate(0, 0), SCALE, SCALE, SCALE, SCALE);
            fail("Singular matrix accepted");
        } catch (InvalidConfigurationException x) {
            // expected
        }
        try {
            WCS.tan(0, 0, new EquatorialCoordinate(0, 0), 0, 0, 0, 0);
            fail("Zero matrix accepted");
        } catch (InvalidConfigurationException x) {
            // expected
        }
    }

    @Test
    public void testHeaderKeywords() {
        WCS wcs = field(new EquatorialCoordinate(56.75101, 24.11678));
        Map<String, Object> keywords = WCSHeader.toKeywords(wcs);
        assertEquals("RA---TAN", keywords.get("CTYPE1"));
        assertEquals(50.5, (Double) keywords.get("CRPIX1"), 0);
        assertEquals(40.5, (Double) keywords.get("CRPIX2"), 0);
        assertEquals(-SCALE, (Double) keywords.get("CD1_1"), 0);
        WCS copy = WCSHeader.fromKeywords(keywords);
        assertEquals(wcs, copy);
    }

    @Test
    public void testForCType() {
        assertEquals(Projection.TAN, Projection.forCType("RA---TAN "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedCType() {
        Projection.forCType("RA---SIN");
    }
}
