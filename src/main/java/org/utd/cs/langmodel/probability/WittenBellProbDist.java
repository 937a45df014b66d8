/**
 * WittenBellProbDist.java
 * Language Model Toolkit
 *
 * Description: Witten-Bell estimate (flat form). The mass reserved for
 * unseen outcomes is the maximum likelihood estimate of seeing a new type,
 * T / (N + T), spread uniformly over the Z = bins - T unseen bins:
 *
 *      P(x) = T / (Z * (N + T))   if c(x) == 0
 *      P(x) = c / (N + T)         otherwise
 */

package org.utd.cs.langmodel.probability;

import java.util.List;

public class WittenBellProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final FreqDist<T> freqdist;
    private final int t;
    private final int z;
    private final long n;
    // P(0), precalculated
    private final double p0;

    public WittenBellProbDist(FreqDist<T> freqdist) {
        this(freqdist, null);
    }

    public WittenBellProbDist(FreqDist<T> freqdist, Integer bins) {
        int resolved = Bins.resolveNonZero(freqdist, bins, "WittenBell");
        this.freqdist = freqdist;
        this.t = freqdist.getB();
        this.z = resolved - t;
        this.n = freqdist.getN();

        if (z == 0) {
            // every possible outcome has been seen, nothing is left for unseen ones
            this.p0 = 0.0;
        } else if (n == 0) {
            // no data: uniform over the unseen bins
            this.p0 = 1.0 / z;
        } else {
            this.p0 = t / ((double) z * (n + t));
        }
    }

    public FreqDist<T> getFreqDist() {
        return freqdist;
    }

    @Override
    public double prob(T sample) {
        int c = freqdist.count(sample);
        if (c == 0) return p0;
        return c / (double) (n + t);
    }

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
        if (n + t == 0) return 0.0;
        return t / (double) (n + t);
    }

    @Override
    public String toString() {
        return "WittenBellProbDist based on " + n + " samples";
    }
}
