/**
 * LidstoneProbDist.java
 * Language Model Toolkit
 *
 * Description: Additive smoothing. Adds gamma to the count of every bin and
 * takes the maximum likelihood estimate of the result:
 *
 *      P(x) = (c + gamma) / (N + B * gamma)
 *
 * Laplace (gamma = 1) and ELE (gamma = 0.5) are the two named members of
 * this family.
 */

package org.utd.cs.langmodel.probability;

import java.util.List;

public class LidstoneProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final FreqDist<T> freqdist;
    private final int bins;
    private final long n;
    private double gamma;
    private double divisor;

    public LidstoneProbDist(FreqDist<T> freqdist, double gamma) {
        this(freqdist, gamma, null);
    }

    /**
     * @param bins number of possible outcomes; must be at least
     *             {@code freqdist.getB()} for the probabilities to sum to one.
     *             Defaults to {@code freqdist.getB()} when null.
     * @throws ConfigurationException if bins is too small or resolves to zero
     */
    public LidstoneProbDist(FreqDist<T> freqdist, double gamma, Integer bins) {
        this.freqdist = freqdist;
        this.bins = Bins.resolveNonZero(freqdist, bins, estimatorName());
        this.gamma = gamma;
        this.n = freqdist.getN();
        this.divisor = n + this.bins * gamma;

        if (divisor == 0.0) {
            // only reachable with gamma == 0 and no data; every count is 0 anyway
            this.gamma = 0;
            this.divisor = 1;
        }
    }

    protected String estimatorName() {
        return "Lidstone";
    }

    public FreqDist<T> getFreqDist() {
        return freqdist;
    }

    public double getGamma() {
        return gamma;
    }

    public int getBins() {
        return bins;
    }

    @Override
    public double prob(T sample) {
        return (freqdist.count(sample) + gamma) / divisor;
    }

    /** Probability is monotonic in count, so the most frequent sample is the most probable. */
    @Override
    public T max() {
        return freqdist.max();
    }

    @Override
    public List<T> samples() {
        return freqdist.keys();
    }

    @Override
    public double discount() {
        double gb = gamma * bins;
        return gb / (n + gb);
    }

    @Override
    public boolean sumsToOne() {
        return false;
    }

    @Override
    public String toString() {
        return estimatorName() + "ProbDist based on " + n + " samples";
    }
}
