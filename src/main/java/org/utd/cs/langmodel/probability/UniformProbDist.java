package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * Equal probability for every sample in a fixed set, zero for everything else.
 */
public class UniformProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final Set<T> sampleSet;
    private final List<T> samples;
    private final double p;

    public UniformProbDist(Collection<? extends T> samples) {
        if (samples.isEmpty()) {
            throw new ConfigurationException("A Uniform probability distribution must have at least one sample.");
        }
        this.sampleSet = new HashSet<>(samples);
        List<T> sorted = new ArrayList<>(sampleSet);
        Collections.sort(sorted);
        this.samples = Collections.unmodifiableList(sorted);
        this.p = 1.0 / sampleSet.size();
    }

    @Override
    public double prob(T sample) {
        return sampleSet.contains(sample) ? p : 0.0;
    }

    @Override
    public T max() {
        return samples.get(0);
    }

    @Override
    public List<T> samples() {
        return samples;
    }

    @Override
    public String toString() {
        return "UniformProbDist with " + samples.size() + " samples";
    }
}
