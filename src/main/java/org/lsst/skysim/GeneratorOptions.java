package org.lsst.skysim;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.lsst.skysim.noise.BackgroundModel;
import org.lsst.skysim.photometry.PhotometricModel;
import org.lsst.skysim.photometry.ZeroPointPhotometry;
import org.lsst.skysim.psf.GaussianPSF;
import org.lsst.skysim.psf.PointSpreadFunction;

/**
 * Rendering choices for a {@link SkyImageGenerator}, as opposed to the
 * physical description in {@link SimulatedSkyImage}.
 *
 * @author tonyj
 */
public class GeneratorOptions {

    private BackgroundModel backgroundModel = BackgroundModel.PER_PIXEL;
    private PointSpreadFunction psf = new GaussianPSF();
    private PhotometricModel photometricModel = new ZeroPointPhotometry();
    private double stampExtent = 3.0;
    private double edgeMargin = 0;
    private boolean parallel = false;
    private Executor executor = ForkJoinPool.commonPool();

    public BackgroundModel getBackgroundModel() {
        return backgroundModel;
    }

    public GeneratorOptions setBackgroundModel(BackgroundModel backgroundModel) {
        this.backgroundModel = Objects.requireNonNull(backgroundModel);
        return this;
    }

    public PointSpreadFunction getPSF() {
        return psf;
    }

    public GeneratorOptions setPSF(PointSpreadFunction psf) {
        this.psf = Objects.requireNonNull(psf);
        return this;
    }

    public PhotometricModel getPhotometricModel() {
        return photometricModel;
    }

    public GeneratorOptions setPhotometricModel(PhotometricModel photometricModel) {
        this.photometricModel = Objects.requireNonNull(photometricModel);
        return this;
    }

    /**
     * @return The half size of each PSF stamp, in equivalent Gaussian sigmas
     */
    public double getStampExtent() {
        return stampExtent;
    }

    public GeneratorOptions setStampExtent(double stampExtent) {
        if (!(stampExtent > 0) || Double.isInfinite(stampExtent)) {
            throw new InvalidConfigurationException("Stamp extent must be positive: " + stampExtent);
        }
        this.stampExtent = stampExtent;
        return this;
    }

    /**
     * @return How far outside the image, in pixels, a source may lie and
     * still be rendered
     */
    public double getEdgeMargin() {
        return edgeMargin;
    }

    public GeneratorOptions setEdgeMargin(double edgeMargin) {
        if (!(edgeMargin >= 0) || Double.isInfinite(edgeMargin)) {
            throw new InvalidConfigurationException("Edge margin must not be negative: " + edgeMargin);
        }
        this.edgeMargin = edgeMargin;
        return this;
    }

    public boolean isParallel() {
        return parallel;
    }

    public GeneratorOptions setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    public Executor getExecutor() {
        return executor;
    }

    public GeneratorOptions setExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor);
        return this;
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" + "backgroundModel=" + backgroundModel + ", psf=" + psf + ", photometricModel=" + photometricModel
                + ", stampExtent=" + stampExtent + ", edgeMargin=" + edgeMargin + ", parallel=" + parallel + '}';
    }
}
