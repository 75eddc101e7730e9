package org.lsst.skysim.noise;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Source of the random variates used by the noise model. All draws come from
 * the injected generator, so a fixed seed gives reproducible images.
 * <p>
 * Instances are not thread safe. Each worker should use its own instance
 * obtained from {@link #split()}.
 *
 * @author tonyj
 */
public class RandomVariates {

    private static final int MAX_CACHED_DISTRIBUTIONS = 16;

    private final RandomGenerator generator;
    private final Map<Double, PoissonDistribution> poissonCache = new LinkedHashMap<Double, PoissonDistribution>(16, 0.75f, true) {
        private static final long serialVersionUID = 1L;

        @Override
        protected boolean removeEldestEntry(Map.Entry<Double, PoissonDistribution> eldest) {
            return size() > MAX_CACHED_DISTRIBUTIONS;
        }
    };

    public RandomVariates(RandomGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public static RandomVariates seeded(long seed) {
        return new RandomVariates(new Well19937c(seed));
    }

    public static RandomVariates unseeded() {
        return new RandomVariates(new Well19937c());
    }

    /**
     * Draw a Poisson distributed count with the given expectation.
     *
     * @param lambda The expected count, must be finite and non-negative
     * @return The sample, always 0 when lambda is 0
     */
    public long poisson(double lambda) {
        if (!(lambda >= 0) || Double.isInfinite(lambda)) {
            throw new IllegalArgumentException("Poisson mean must be finite and non-negative: " + lambda);
        }
        if (lambda == 0) {
            return 0;
        }
        return poissonCache.computeIfAbsent(lambda, (l) -> new PoissonDistribution(generator, l,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS)).sample();
    }

    /**
     * Draw a Gaussian distributed value. Uses the generator's polar
     * Box-Muller deviate, so the samples really are normally distributed.
     *
     * @param mean The mean of the distribution
     * @param stdDev The standard deviation, must be non-negative
     * @return The sample, exactly mean when stdDev is 0
     */
    public double normal(double mean, double stdDev) {
        if (!(stdDev >= 0) || Double.isInfinite(stdDev)) {
            throw new IllegalArgumentException("Standard deviation must be finite and non-negative: " + stdDev);
        }
        if (stdDev == 0) {
            return mean;
        }
        return mean + stdDev * generator.nextGaussian();
    }

    /**
     * @return A uniform value in [0,1)
     */
    public double uniform() {
        return generator.nextDouble();
    }

    /**
     * Create an independent stream seeded from this one. Calling split the
     * same number of times on identically seeded instances gives identically
     * seeded children.
     */
    public RandomVariates split() {
        return seeded(generator.nextLong());
    }
}
