/**
 * GoodTuringProbDist.java
 * Language Model Toolkit
 *
 * Description: Good-Turing estimate. A sample seen c times is given the
 * adjusted count
 *
 *      c* = (c + 1) * Nr(c + 1) / Nr(c)
 *
 * and unseen samples share Nr(1) / N, the mass of the things seen once.
 *
 * Counts whose Nr(c) is zero (a hole in the frequency-of-frequency table)
 * get probability 0. The smoothed estimator in SimpleGoodTuringProbDist
 * does not have that gap.
 */

package org.utd.cs.langmodel.probability;

import java.util.List;

public class GoodTuringProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final FreqDist<T> freqdist;
    private final int bins;

    public GoodTuringProbDist(FreqDist<T> freqdist) {
        this(freqdist, null);
    }

    public GoodTuringProbDist(FreqDist<T> freqdist, Integer bins) {
        this.bins = Bins.resolve(freqdist, bins, "GoodTuring");
        this.freqdist = freqdist;
    }

    public FreqDist<T> getFreqDist() {
        return freqdist;
    }

    @Override
    public double prob(T sample) {
        long n = freqdist.getN();
        if (n == 0) return 0.0;

        int count = freqdist.count(sample);
        if (count == 0) {
            int unseenBins = bins - freqdist.getB();
            if (unseenBins == 0) return 0.0;
            return (double) freqdist.frequencyOfFrequency(1) / n / unseenBins;
        }

        int nc = freqdist.frequencyOfFrequency(count);
        int ncn = freqdist.frequencyOfFrequency(count + 1);
        if (nc == 0) return 0.0;
        return (double) (count + 1) * ncn / ((double) nc * n);
    }

    @Override
    public T max() {
        return freqdist.max();
    }

    @Override
    public List<T> samples() {
        return freqdist.keys();
    }

    /** Mass transferred from the seen samples to the unseen ones, Nr(1) / N. */
    @Override
    public double discount() {
        if (freqdist.getN() == 0) return 0.0;
        return (double) freqdist.frequencyOfFrequency(1) / freqdist.getN();
    }

    @Override
    public String toString() {
        return "GoodTuringProbDist based on " + freqdist.getN() + " samples";
    }
}
