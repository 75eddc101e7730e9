package org.lsst.skysim.io;

import java.awt.geom.Point2D;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import nom.tam.fits.Header;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.assertEquals;
import org.lsst.skysim.DetectorImage;
import org.lsst.skysim.EquatorialCoordinate;
import org.lsst.skysim.SimulatedSkyImage;
import org.lsst.skysim.SkyImageGenerator;
import org.lsst.skysim.TestSkies;
import org.lsst.skysim.catalog.CatalogSource;
import org.lsst.skysim.noise.RandomVariates;
import org.lsst.skysim.wcs.ProjectionException;
import org.lsst.skysim.wcs.WCS;

/**
 *
 * @author tonyj
 */
public class FitsImageIOTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testWriteRead() throws IOException, ProjectionException {
        SimulatedSkyImage sky = new SimulatedSkyImage(32, 24, TestSkies.PLEIADES, TestSkies.quiet().biasOffset(10).build());
        DetectorImage image = new SkyImageGenerator(sky).generate(
                Collections.singletonList(new CatalogSource(TestSkies.PLEIADES.getRA(), TestSkies.PLEIADES.getDec(), 9)),
                RandomVariates.seeded(1));
        File file = folder.newFile("test.fits");
        new FitsImageWriter().write(sky, image, file);

        FitsImageReader reader = new FitsImageReader(file);
        assertEquals(image, reader.getImage());
        Header header = reader.getHeader();
        assertEquals(1.0, header.getDoubleValue("EXPTIME"), 0);
        assertEquals(10.0, header.getDoubleValue("PEDESTAL"), 0);
        assertEquals(1, header.getIntValue("XBINNING"));
        assertEquals("RA---TAN", header.getStringValue("CTYPE1"));
        assertEquals(16.5, header.getDoubleValue("CRPIX1"), 0);

        WCS wcs = reader.getWCS();
        EquatorialCoordinate corner = sky.getWCS().pixelToEquatorial(0, 0);
        EquatorialCoordinate copy = wcs.pixelToEquatorial(0, 0);
        assertEquals(corner.getRA(), copy.getRA(), 1e-9);
        assertEquals(corner.getDec(), copy.getDec(), 1e-9);
        Point2D center = wcs.equatorialToPixel(TestSkies.PLEIADES);
        assertEquals(16, center.getX(), 1e-6);
        assertEquals(12, center.getY(), 1e-6);
    }

    @Test
    public void testOverwrite() throws IOException {
        File file = folder.newFile("overwrite.fits");
        SimulatedSkyImage big = new SimulatedSkyImage(64, 64, TestSkies.PLEIADES, TestSkies.quiet().build());
        new FitsImageWriter().write(big, new DetectorImage(64, 64, 65535, new int[64 * 64]), file);
        SimulatedSkyImage small = new SimulatedSkyImage(4, 2, TestSkies.PLEIADES, TestSkies.quiet().build());
        DetectorImage image = DetectorImage.of(new int[][]{{1, 2, 3, 4}, {5, 6, 7, 8}}, 65535);
        new FitsImageWriter().write(small, image, file);
        assertEquals(image, new FitsImageReader(file).getImage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSizeMismatch() throws IOException {
        SimulatedSkyImage sky = new SimulatedSkyImage(4, 4, TestSkies.PLEIADES, TestSkies.quiet().build());
        new FitsImageWriter().write(sky, new DetectorImage(2, 2, 10, new int[4]), folder.newFile("bad.fits"));
    }
}
