package org.lsst.skysim.noise;

/**
 * How the background (dark current, read noise and sky) is added to the
 * image.
 *
 * @author tonyj
 */
public enum BackgroundModel {

    /**
     * No background at all.
     */
    NONE {
        @Override
        public RowFiller prepare(double darkElectrons, double skyElectrons, double readNoise, RandomVariates random) {
            return (row, offset, length, rowRandom) -> {
            };
        }
    },
    /**
     * A single noise value drawn for the whole image, multiplied at each pixel
     * by a uniform jitter in [0,1). Cheap, but not physically meaningful.
     */
    SHARED_SCALAR {
        @Override
        public RowFiller prepare(double darkElectrons, double skyElectrons, double readNoise, RandomVariates random) {
            final double background = random.poisson(darkElectrons)
                    + random.normal(0, readNoise)
                    + random.poisson(skyElectrons);
            return (row, offset, length, rowRandom) -> {
                for (int i = offset; i < offset + length; i++) {
                    row[i] += background * rowRandom.uniform();
                }
            };
        }
    },
    /**
     * Independent shot noise for dark current and sky, plus Gaussian read
     * noise, at every pixel.
     */
    PER_PIXEL {
        @Override
        public RowFiller prepare(double darkElectrons, double skyElectrons, double readNoise, RandomVariates random) {
            return (row, offset, length, rowRandom) -> {
                for (int i = offset; i < offset + length; i++) {
                    row[i] += rowRandom.poisson(darkElectrons)
                            + rowRandom.normal(0, readNoise)
                            + rowRandom.poisson(skyElectrons);
                }
            };
        }
    };

    /**
     * Prepare to fill an image. Any image-wide random draws are taken from
     * {@code random} here, before any row is filled.
     *
     * @param darkElectrons Expected dark electrons per pixel over the exposure
     * @param skyElectrons Expected sky electrons per pixel over the exposure
     * @param readNoise Read noise in electrons rms
     * @param random The image-wide random source
     * @return A filler which can be called concurrently for disjoint rows
     */
    public abstract RowFiller prepare(double darkElectrons, double skyElectrons, double readNoise, RandomVariates random);

    public interface RowFiller {

        /**
         * Add background electrons to {@code length} pixels starting at
         * {@code offset} of the flat image buffer.
         */
        void fill(double[] image, int offset, int length, RandomVariates rowRandom);
    }
}
