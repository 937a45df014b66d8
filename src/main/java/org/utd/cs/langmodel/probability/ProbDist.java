package org.utd.cs.langmodel.probability;

import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Contract for every probability estimator.
 *
 * A distribution maps samples to probabilities in [0, 1]. Estimators built on a
 * {@link FreqDist} only read from it.
 */
public interface ProbDist<T> {

    double prob(T sample);

    /**
     * Base-2 log of {@link #prob}. Zero-probability samples return
     * {@link LogMath#NINF} instead of negative infinity.
     */
    default double logprob(T sample) {
        double p = prob(sample);
        if (p == 0) return LogMath.NINF;
        return LogMath.log2(p);
    }

    /** The most probable sample, or null if there are none. */
    T max();

    List<T> samples();

    /** Fraction of probability mass reserved for unseen samples. */
    default double discount() {
        return 0.0;
    }

    /** True if the probabilities of all samples always sum to one. */
    default boolean sumsToOne() {
        return true;
    }

    /**
     * Draws a sample with probability {@link #prob}. Rounding error up to 1e-4
     * is tolerated; beyond that a uniformly chosen sample is returned.
     */
    default T generate(Random random) {
        List<T> samples = samples();
        if (samples.isEmpty()) {
            throw new IllegalStateException("Cannot generate from a distribution with no samples");
        }

        double p = random.nextDouble();
        T last = null;
        for (T sample : samples) {
            p -= prob(sample);
            last = sample;
            if (p <= 0) return sample;
        }
        if (p < .0001) return last;

        if (sumsToOne()) {
            LoggerFactory.getLogger(ProbDist.class).warn(
                    "{} sums to {}; generate() is returning an arbitrary sample.", this, 1 - p);
        }
        return samples.get(random.nextInt(samples.size()));
    }
}
