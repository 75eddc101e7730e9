package org.lsst.skysim;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.skysim.catalog.CatalogSource;
import org.lsst.skysim.noise.BackgroundModel.RowFiller;
import org.lsst.skysim.noise.RandomVariates;
import org.lsst.skysim.psf.Stamp;
import org.lsst.skysim.wcs.ProjectionException;
import org.lsst.skysim.wcs.WCS;

/**
 * Renders a simulated detector image of a field. Rendering proceeds in three
 * steps:
 * <ol>
 * <li>Background electrons (dark current, read noise, sky) are added
 * according to the configured {@link org.lsst.skysim.noise.BackgroundModel}.
 * <li>Each catalog source inside the field is converted to electrons and
 * spread over a PSF stamp.
 * <li>Electrons are converted to ADU using the gain and bias offset, and
 * clamped to [0, maxADU].
 * </ol>
 * All randomness comes from the {@link RandomVariates} passed in, so a fixed
 * seed gives an identical image. Rows are rendered independently, each with
 * its own random stream split from the caller's before any work starts, so
 * parallel rendering gives exactly the same result as sequential rendering.
 *
 * @author tonyj
 */
public class SkyImageGenerator {

    private static final Logger LOG = Logger.getLogger(SkyImageGenerator.class.getName());
    private static final int ROWS_PER_TASK = 32;

    private final SimulatedSkyImage sky;
    private final GeneratorOptions options;

    public SkyImageGenerator(SimulatedSkyImage sky) {
        this(sky, new GeneratorOptions());
    }

    public SkyImageGenerator(SimulatedSkyImage sky, GeneratorOptions options) {
        this.sky = Objects.requireNonNull(sky, "sky");
        this.options = Objects.requireNonNull(options, "options");
    }

    public SimulatedSkyImage getSky() {
        return sky;
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    /**
     * Render the field containing the given sources.
     *
     * @param sources The catalog sources, sources outside the field are
     * ignored
     * @param random The random source for the noise model
     * @return The detector image in ADU
     */
    public DetectorImage generate(List<CatalogSource> sources, RandomVariates random) {
        return toDetectorImage(generateElectrons(sources, random));
    }

    /**
     * @return The background only, in electrons, flat row-major
     */
    public double[] generateBackground(RandomVariates random) {
        return render(Collections.emptyList(), random);
    }

    /**
     * @return The background plus sources, in electrons, flat row-major
     */
    public double[] generateElectrons(List<CatalogSource> sources, RandomVariates random) {
        List<PlacedSource> placed = place(sources);
        return Timed.execute(() -> render(placed, random), "Rendered %dx%d image with %d sources in %dms",
                sky.getWidth(), sky.getHeight(), placed.size());
    }

    /**
     * Work out where each source falls on the image, its signal and its PSF
     * stamp. Sources which are outside the field (allowing for the edge
     * margin), which cannot be projected, or which have no positive signal
     * are skipped.
     */
    public List<PlacedSource> place(List<CatalogSource> sources) {
        SensorParams params = sky.getSensorParams();
        WCS wcs = sky.getWCS();
        double area = sky.getApertureArea();
        double fwhmX = sky.getSeeingPixelsX();
        double fwhmY = sky.getSeeingPixelsY();
        double margin = options.getEdgeMargin();

        List<PlacedSource> result = new ArrayList<>();
        int outside = 0;
        int unprojectable = 0;
        int noSignal = 0;
        for (CatalogSource source : sources) {
            if (!Double.isFinite(source.getRA()) || !(Math.abs(source.getDec()) <= 90)) {
                LOG.fine(() -> "Skipping source with invalid position: " + source);
                unprojectable++;
                continue;
            }
            Point2D p;
            try {
                p = wcs.equatorialToPixel(source.getRA(), source.getDec());
            } catch (ProjectionException x) {
                LOG.log(Level.FINE, "Skipping source {0}: {1}", new Object[]{source, x.getMessage()});
                unprojectable++;
                continue;
            }
            double x = p.getX();
            double y = p.getY();
            if (x < -margin || x >= sky.getWidth() + margin || y < -margin || y >= sky.getHeight() + margin) {
                outside++;
                continue;
            }
            double electrons = options.getPhotometricModel().electrons(source, area, params.getQuantumEfficiency(), params.getExposure());
            if (!(electrons > 0) || Double.isInfinite(electrons)) {
                LOG.log(Level.FINE, "Skipping source {0} with signal {1}", new Object[]{source, electrons});
                noSignal++;
                continue;
            }
            Stamp stamp = options.getPSF().render(x, y, fwhmX, fwhmY, options.getStampExtent());
            result.add(new PlacedSource(source, x, y, electrons, stamp));
        }
        LOG.log(Level.INFO, "Placed {0} of {1} sources ({2} outside the field, {3} not projectable, {4} without signal)",
                new Object[]{result.size(), sources.size(), outside, unprojectable, noSignal});
        return result;
    }

    private double[] render(List<PlacedSource> placed, RandomVariates random) {
        final int width = sky.getWidth();
        final int height = sky.getHeight();
        SensorParams params = sky.getSensorParams();
        double exposure = params.getExposure();

        RowFiller background = options.getBackgroundModel().prepare(
                params.getDarkCurrent() * exposure,
                sky.getSkyBackgroundPerPixel() * exposure,
                params.getReadNoise(), random);
        RandomVariates[] rowRandom = new RandomVariates[height];
        for (int y = 0; y < height; y++) {
            rowRandom[y] = random.split();
        }

        double[] image = new double[width * height];
        if (options.isParallel()) {
            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            for (int from = 0; from < height; from += ROWS_PER_TASK) {
                final int start = from;
                final int end = Math.min(height, from + ROWS_PER_TASK);
                tasks.add(CompletableFuture.runAsync(() -> renderRows(image, start, end, background, rowRandom, placed), options.getExecutor()));
            }
            try {
                CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException x) {
                Throwable cause = x.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw x;
            }
        } else {
            renderRows(image, 0, height, background, rowRandom, placed);
        }
        return image;
    }

    private void renderRows(double[] image, int from, int to, RowFiller background, RandomVariates[] rowRandom, List<PlacedSource> placed) {
        int width = sky.getWidth();
        for (int y = from; y < to; y++) {
            background.fill(image, y * width, width, rowRandom[y]);
            for (PlacedSource source : placed) {
                source.getStamp().addRow(image, width, y, source.getElectrons());
            }
        }
    }

    /**
     * Convert electrons to ADU: {@code round(clamp(e / gain + bias, 0, maxADU))}.
     */
    public DetectorImage toDetectorImage(double[] electrons) {
        int width = sky.getWidth();
        int height = sky.getHeight();
        if (electrons.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + electrons.length);
        }
        SensorParams params = sky.getSensorParams();
        int maxADU = (int) Math.floor(params.getMaxADU());
        double gain = params.getGain();
        double bias = params.getBiasOffset();
        int[] adu = new int[electrons.length];
        for (int i = 0; i < electrons.length; i++) {
            double value = electrons[i] / gain + bias;
            if (Double.isNaN(value) || value < 0) {
                value = 0;
            } else if (value > maxADU) {
                value = maxADU;
            }
            adu[i] = (int) Math.round(value);
        }
        return new DetectorImage(width, height, maxADU, adu);
    }
}
