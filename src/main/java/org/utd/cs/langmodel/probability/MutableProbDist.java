package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * A copy of another distribution over a fixed list of samples whose
 * probabilities can be changed one at a time. Values are stored either as
 * base-2 logs or as plain probabilities.
 *
 * Updates are not renormalized, so after changing a probability the
 * distribution no longer has to sum to one until the caller fixes it up.
 */
public class MutableProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final List<T> samples;
    private final Map<T, Integer> index = new HashMap<>();
    private final double[] data;
    private final boolean logs;

    public MutableProbDist(ProbDist<T> base, List<T> samples) {
        this(base, samples, true);
    }

    public MutableProbDist(ProbDist<T> base, List<T> samples, boolean storeLogs) {
        this.samples = List.copyOf(samples);
        this.data = new double[this.samples.size()];
        this.logs = storeLogs;
        for (int i = 0; i < data.length; i++) {
            T sample = this.samples.get(i);
            index.put(sample, i);
            data[i] = storeLogs ? base.logprob(sample) : base.prob(sample);
        }
    }

    @Override
    public double prob(T sample) {
        Integer i = index.get(sample);
        if (i == null) return 0.0;
        return logs ? Math.pow(2, data[i]) : data[i];
    }

    @Override
    public double logprob(T sample) {
        Integer i = index.get(sample);
        if (i == null) return LogMath.NINF;
        if (logs) return data[i];
        if (data[i] == 0) return LogMath.NINF;
        return LogMath.log2(data[i]);
    }

    /**
     * Sets the probability of a known sample.
     *
     * @param log whether {@code prob} is a base-2 log probability
     * @throws IllegalArgumentException if the sample was not given at construction
     */
    public void update(T sample, double prob, boolean log) {
        Integer i = index.get(sample);
        if (i == null) {
            throw new IllegalArgumentException("Unknown sample " + sample);
        }
        if (logs) {
            data[i] = log ? prob : (prob == 0 ? LogMath.NINF : LogMath.log2(prob));
        } else {
            data[i] = log ? Math.pow(2, prob) : prob;
        }
    }

    /** Most probable sample; ties go to the greatest sample. */
    @Override
    public T max() {
        T best = null;
        double bestP = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < data.length; i++) {
            T sample = samples.get(i);
            if (data[i] > bestP || (data[i] == bestP && best != null && sample.compareTo(best) > 0)) {
                best = sample;
                bestP = data[i];
            }
        }
        return best;
    }

    /** The samples in the order given at construction. */
    @Override
    public List<T> samples() {
        return samples;
    }

    @Override
    public String toString() {
        return "MutableProbDist with " + samples.size() + " samples";
    }
}
