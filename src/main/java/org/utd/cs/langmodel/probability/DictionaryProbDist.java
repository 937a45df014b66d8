package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * A distribution given explicitly as a sample -> probability map. Values may be
 * stored as base-2 log probabilities, and can be normalized to sum to one.
 */
public class DictionaryProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final Map<T, Double> probs;
    private final boolean log;
    private T maxCache;

    public DictionaryProbDist(Map<T, Double> probs) {
        this(probs, false, false);
    }

    public DictionaryProbDist(Map<T, Double> probs, boolean log, boolean normalize) {
        this.probs = new HashMap<>(probs);
        this.log = log;

        if (normalize && !this.probs.isEmpty()) {
            if (log) {
                double valueSum = LogMath.sumLogs(new ArrayList<>(this.probs.values()));
                if (valueSum <= LogMath.NINF) {
                    double logp = LogMath.log2(1.0 / this.probs.size());
                    this.probs.replaceAll((k, v) -> logp);
                } else {
                    this.probs.replaceAll((k, v) -> v - valueSum);
                }
            } else {
                double valueSum = 0.0;
                for (double v : this.probs.values()) valueSum += v;
                if (valueSum == 0) {
                    double p = 1.0 / this.probs.size();
                    this.probs.replaceAll((k, v) -> p);
                } else {
                    double norm = 1.0 / valueSum;
                    this.probs.replaceAll((k, v) -> v * norm);
                }
            }
        }
    }

    @Override
    public double prob(T sample) {
        Double v = probs.get(sample);
        if (v == null) return 0.0;
        return log ? Math.pow(2, v) : v;
    }

    @Override
    public double logprob(T sample) {
        Double v = probs.get(sample);
        if (v == null) return LogMath.NINF;
        if (log) return v;
        if (v == 0) return LogMath.NINF;
        return LogMath.log2(v);
    }

    /** Most probable sample; ties go to the greatest sample. */
    @Override
    public T max() {
        if (maxCache == null && !probs.isEmpty()) {
            T best = null;
            double bestP = Double.NEGATIVE_INFINITY;
            for (Map.Entry<T, Double> e : probs.entrySet()) {
                double v = e.getValue();
                if (v > bestP || (v == bestP && e.getKey().compareTo(best) > 0)) {
                    best = e.getKey();
                    bestP = v;
                }
            }
            maxCache = best;
        }
        return maxCache;
    }

    @Override
    public List<T> samples() {
        List<T> out = new ArrayList<>(probs.keySet());
        Collections.sort(out);
        return out;
    }

    @Override
    public String toString() {
        return "DictionaryProbDist with " + probs.size() + " samples";
    }
}
