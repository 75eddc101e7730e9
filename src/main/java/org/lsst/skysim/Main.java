package org.lsst.skysim;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.skysim.catalog.CachingCatalogService;
import org.lsst.skysim.catalog.Catalog;
import org.lsst.skysim.catalog.CatalogService;
import org.lsst.skysim.catalog.CatalogServices;
import org.lsst.skysim.catalog.CatalogSource;
import org.lsst.skysim.config.SensorParamsReader;
import org.lsst.skysim.io.CoordinateFormat;
import org.lsst.skysim.io.DisplayImageWriter;
import org.lsst.skysim.io.FitsImageWriter;
import org.lsst.skysim.noise.RandomVariates;
import org.lsst.skysim.scale.DisplayNormalizer;
import org.lsst.skysim.scale.MedianStdDevScale;
import org.lsst.skysim.stats.Stats;

/**
 * Simulate a field: query a catalog around the field centre, render the
 * detector image and write it as FITS plus a normalized 16 bit PNG.
 * <pre>
 * Main [ra dec [width height [sensor.properties|- [outputDir [GAIA|SIMBAD [seed]]]]]]
 * </pre>
 * With no arguments the Pleiades are simulated on a 2048x2048 sensor.
 *
 * @author tonyj
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final double DEFAULT_RA = 56.75101;
    static final double DEFAULT_DEC = 24.11678;
    static final int DEFAULT_SIZE = 2048;
    static final int CATALOG_LIMIT = 1000;
    static final double MAGNITUDE_LIMIT = 13;
    static final String USAGE = "Usage: Main [ra dec [width height [sensor.properties|- [outputDir [GAIA|SIMBAD [seed]]]]]]";

    public static void main(String[] args) throws IOException {
        if (!isValidArgumentCount(args.length) || args.length > 0 && ("-h".equals(args[0]) || "--help".equals(args[0]))) {
            System.out.println(USAGE);
            return;
        }
        double ra = args.length > 1 ? Double.parseDouble(args[0]) : DEFAULT_RA;
        double dec = args.length > 1 ? Double.parseDouble(args[1]) : DEFAULT_DEC;
        int width = args.length > 3 ? Integer.parseInt(args[2]) : DEFAULT_SIZE;
        int height = args.length > 3 ? Integer.parseInt(args[3]) : DEFAULT_SIZE;
        SensorParamsReader reader = args.length > 4 && !"-".equals(args[4]) ? new SensorParamsReader(new File(args[4])) : new SensorParamsReader();
        File outputDir = new File(args.length > 5 ? args[5] : ".");
        Catalog catalog = args.length > 6 ? Catalog.forName(args[6]) : Catalog.GAIA;
        RandomVariates random = args.length > 7 ? RandomVariates.seeded(Long.parseLong(args[7])) : RandomVariates.unseeded();

        SimulatedSkyImage sky = new SimulatedSkyImage(width, height, new EquatorialCoordinate(ra, dec), reader.getSensorParams());
        report(sky, System.out);

        CatalogService service = CatalogServices.create(catalog);
        double radius = Math.ceil(sky.getRadialExtent() * 10) / 10;
        List<CatalogSource> sources = service.performRadialSearch(sky.getCenter(), radius, CATALOG_LIMIT, MAGNITUDE_LIMIT);
        System.out.printf(Locale.ROOT, "Found %d sources within %.1f degrees in %s%n", sources.size(), radius, catalog);

        SkyImageGenerator generator = new SkyImageGenerator(sky, new GeneratorOptions().setParallel(true));
        DetectorImage image = generator.generate(sources, random);

        Stats stats = Stats.of(image);
        int median = stats.fastMedian();
        System.out.printf(Locale.ROOT, "Image statistics: min=%d max=%d mean=%.2f median=%d stdDev=%.2f%n",
                stats.getMin(), stats.getMax(), stats.getMean(), median, stats.getStdDev());

        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            throw new IOException("Unable to create output directory " + outputDir);
        }
        File fitsFile = new File(outputDir, CoordinateFormat.fileName(sky.getCenter(), width, height, "fits"));
        new FitsImageWriter().write(sky, image, fitsFile);

        DisplayNormalizer normalizer = new DisplayNormalizer();
        int[][] normalized = normalizer.normalize(image, median, stats.getStdDev(), MedianStdDevScale.DEFAULT_SCALE_FACTOR);
        File pngFile = new File(outputDir, CoordinateFormat.fileName(sky.getCenter(), width, height, "png"));
        new DisplayImageWriter().write(normalized, pngFile);

        if (service instanceof CachingCatalogService) {
            ((CachingCatalogService) service).report();
        }
        System.out.printf("Image saved as '%s' and '%s'%n", fitsFile, pngFile);
        LOG.log(Level.FINE, "Done");
    }

    // ra and dec, width and height only make sense in pairs
    static boolean isValidArgumentCount(int n) {
        return n == 0 || n == 2 || (n >= 4 && n <= 8);
    }

    static void report(SimulatedSkyImage sky, PrintStream out) {
        SensorParams p = sky.getSensorParams();
        out.printf(Locale.ROOT, "Field centre:        RA %.5f Dec %.5f%n", sky.getCenter().getRA(), sky.getCenter().getDec());
        out.printf(Locale.ROOT, "Image size:          %d x %d pixels%n", sky.getWidth(), sky.getHeight());
        out.printf(Locale.ROOT, "Pixel scale:         %.3f x %.3f arcsec/pixel%n", sky.getPixelScaleX() * 3600, sky.getPixelScaleY() * 3600);
        out.printf(Locale.ROOT, "Field of view:       %.3f x %.3f degrees%n", sky.getFieldOfViewX(), sky.getFieldOfViewY());
        out.printf(Locale.ROOT, "Exposure:            %.1f s%n", p.getExposure());
        out.printf(Locale.ROOT, "Gain:                %.3f e-/ADU, bias %.1f ADU, max %.0f ADU%n", p.getGain(), p.getBiasOffset(), p.getMaxADU());
        out.printf(Locale.ROOT, "Read noise:          %.2f e-, dark current %.3f e-/s%n", p.getReadNoise(), p.getDarkCurrent());
        out.printf(Locale.ROOT, "Aperture:            %.3f m (%.4f m2), focal length %.3f m%n", p.getApertureDiameter(), sky.getApertureArea(), p.getFocalLength());
        out.printf(Locale.ROOT, "Seeing:              %.2f arcsec (%.2f x %.2f pixels)%n", p.getSeeing(), sky.getSeeingPixelsX(), sky.getSeeingPixelsY());
        out.printf(Locale.ROOT, "Sky background:      %.2f e-/s/pixel%n", sky.getSkyBackgroundPerPixel());
    }
}
