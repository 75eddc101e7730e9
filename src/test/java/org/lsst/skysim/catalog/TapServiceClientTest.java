package org.lsst.skysim.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.lsst.skysim.EquatorialCoordinate;

/**
 *
 * @author tonyj
 */
public class TapServiceClientTest {

    private static List<CatalogSource> parseResource(String name) throws IOException {
        InputStream in = TapServiceClientTest.class.getResourceAsStream(name);
        assertNotNull(in);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return TapServiceClient.parse(reader);
        }
    }

    @Test
    public void testParseGaia() throws IOException {
        List<CatalogSource> sources = parseResource("gaia.csv");
        // The last row has no RA
        assertEquals(3, sources.size());
        CatalogSource alcyone = sources.get(0);
        assertEquals("66526127137440128", alcyone.getUID());
        assertEquals("Gaia DR3 66526127137440128", alcyone.getDesignation());
        assertEquals(56.871152510372, alcyone.getRA(), 0);
        assertEquals(24.1051465242304, alcyone.getDec(), 0);
        assertEquals(-45.548, alcyone.getProperMotionDec(), 0);
        assertEquals(2.4331776E9, alcyone.getFlux(), 0);
        assertEquals(2.8908217, alcyone.getMagnitude(), 0);
        CatalogSource noAstrometry = sources.get(2);
        assertEquals(0, noAstrometry.getProperMotionRA(), 0);
        assertEquals(0, noAstrometry.getParallax(), 0);
    }

    @Test
    public void testParseSimbad() throws IOException {
        List<CatalogSource> sources = parseResource("simbad.csv");
        // The cluster itself has no magnitude
        assertEquals(2, sources.size());
        assertEquals("* eta Tau", sources.get(0).getDesignation());
        assertTrue(Double.isNaN(sources.get(0).getFlux()));
        assertEquals(3.6349, sources.get(1).getMagnitude(), 0);
    }

    @Test
    public void testReadCSV() throws IOException {
        List<List<String>> records = TapServiceClient.readCSV(new StringReader("a,b\r\n\"x, \"\"y\"\"\",\"line\nbreak\"\n1,"));
        assertEquals(3, records.size());
        assertEquals("x, \"y\"", records.get(1).get(0));
        assertEquals("line\nbreak", records.get(1).get(1));
        assertEquals(2, records.get(2).size());
        assertEquals("", records.get(2).get(1));
    }

    @Test(expected = CatalogException.class)
    public void testMissingColumn() throws CatalogException {
        TapServiceClient.parse(new StringReader("ra,dec\n1,2\n"));
    }

    @Test(expected = CatalogException.class)
    public void testEmpty() throws CatalogException {
        TapServiceClient.parse(new StringReader(""));
    }

    @Test
    public void testNoRows() throws CatalogException {
        assertTrue(TapServiceClient.parse(new StringReader("ra,dec,magnitude\n")).isEmpty());
    }

    @Test
    public void testEncodeForm() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("REQUEST", "doQuery");
        form.put("QUERY", "SELECT a < 1");
        assertEquals("REQUEST=doQuery&QUERY=SELECT+a+%3C+1", TapServiceClient.encodeForm(form));
    }

    @Test
    public void testGaiaQuery() throws IOException {
        GaiaServiceClient client = new GaiaServiceClient();
        assertEquals(new URL(GaiaServiceClient.DEFAULT_URL), client.getURL());
        String adql = client.buildQuery(new CatalogQuery(new EquatorialCoordinate(56.75101, 24.11678), 1.7, 1000, 13));
        assertTrue(adql, adql.startsWith("SELECT TOP 1000 "));
        assertTrue(adql, adql.contains("CIRCLE('ICRS', 56.75101, 24.11678, 1.7)"));
        assertTrue(adql, adql.contains("phot_g_mean_mag < 13.0"));
        assertTrue(adql, adql.contains("phot_proc_mode = '0'"));
    }

    @Test
    public void testSimbadQuery() throws IOException {
        SimbadServiceClient client = new SimbadServiceClient();
        String adql = client.buildQuery(new CatalogQuery(new EquatorialCoordinate(10, -5.5), 0.5, 20, 9.5));
        assertTrue(adql, adql.startsWith("SELECT TOP 20 "));
        assertTrue(adql, adql.contains("CIRCLE('ICRS', 10.0, -5.5, 0.5)"));
        assertTrue(adql, adql.contains("allfluxes.G < 9.5"));
    }

    @Test
    public void testCatalogForName() {
        assertEquals(Catalog.SIMBAD, Catalog.forName("simbad"));
        assertTrue(CatalogServices.create(Catalog.GAIA) instanceof CachingCatalogService);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadQuery() {
        new CatalogQuery(new EquatorialCoordinate(0, 0), -1, 10, 10);
    }

    @Test
    public void testSourceWithoutDesignation() {
        CatalogSource source = new CatalogSource(1, 2, 3);
        assertNull(source.getDesignation());
    }
}
