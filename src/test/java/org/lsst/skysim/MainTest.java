package org.lsst.skysim;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 *
 * @author tonyj
 */
public class MainTest {

    @Test
    public void testReport() {
        SimulatedSkyImage sky = new SimulatedSkyImage(2048, 2048, TestSkies.PLEIADES, TestSkies.standard().build());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Main.report(sky, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String report = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(report, report.contains("RA 56.75101 Dec 24.11678"));
        assertTrue(report, report.contains("2048 x 2048 pixels"));
        assertTrue(report, report.contains("92.819 x 92.819 arcsec/pixel"));
    }

    @Test
    public void testTimedReturnsValue() {
        assertEquals(Integer.valueOf(42), Timed.execute(Level.INFO, () -> 42, "Answer took %dms"));
    }

    @Test
    public void testTimedRethrows() {
        IOException failure = new IOException("boom");
        try {
            Timed.execute(() -> {
                throw failure;
            }, "Failing %s took %dms", "task");
            fail("Exception swallowed");
        } catch (Exception x) {
            assertTrue(x == failure);
        }
    }

    @Test
    public void testArgumentCounts() {
        assertTrue(Main.isValidArgumentCount(0));
        assertTrue(Main.isValidArgumentCount(2));
        assertTrue(Main.isValidArgumentCount(8));
        assertTrue(!Main.isValidArgumentCount(1));
        assertTrue(!Main.isValidArgumentCount(3));
        assertTrue(!Main.isValidArgumentCount(9));
    }

    @Test
    public void testLoneArgumentPrintsUsage() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream saved = System.out;
        System.setOut(new PrintStream(bytes, true, "UTF-8"));
        try {
            Main.main(new String[]{"56.75"});
        } finally {
            System.setOut(saved);
        }
        assertEquals(Main.USAGE, bytes.toString("UTF-8").trim());
    }
}
