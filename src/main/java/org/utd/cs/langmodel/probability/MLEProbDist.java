package org.utd.cs.langmodel.probability;

import java.util.List;

/**
 * Maximum likelihood estimate: the probability of a sample is its relative
 * frequency in the underlying distribution.
 */
public class MLEProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final FreqDist<T> freqdist;

    public MLEProbDist(FreqDist<T> freqdist) {
        this.freqdist = freqdist;
    }

    public FreqDist<T> getFreqDist() {
        return freqdist;
    }

    @Override
    public double prob(T sample) {
        return freqdist.freq(sample);
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
    public String toString() {
        return "MLEProbDist based on " + freqdist.getN() + " samples";
    }
}
