package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * Cross-validation estimate: the mean of the heldout estimates over every
 * ordered pair of distinct frequency distributions.
 */
public class CrossValidationProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final List<FreqDist<T>> freqdists;
    private final List<HeldoutProbDist<T>> heldoutProbdists = new ArrayList<>();

    public CrossValidationProbDist(List<FreqDist<T>> freqdists, Integer bins) {
        if (freqdists.size() < 2) {
            throw new ConfigurationException("Cross-validation needs at least two frequency distributions.");
        }
        this.freqdists = List.copyOf(freqdists);

        for (int i = 0; i < freqdists.size(); i++) {
            for (int j = 0; j < freqdists.size(); j++) {
                if (i == j) continue;
                heldoutProbdists.add(new HeldoutProbDist<>(freqdists.get(i), freqdists.get(j), bins));
            }
        }
    }

    public List<FreqDist<T>> getFreqDists() {
        return freqdists;
    }

    @Override
    public double prob(T sample) {
        double p = 0.0;
        for (HeldoutProbDist<T> heldout : heldoutProbdists) p += heldout.prob(sample);
        return p / heldoutProbdists.size();
    }

    @Override
    public T max() {
        T best = null;
        double bestP = -1;
        for (T s : samples()) {
            double p = prob(s);
            if (p > bestP) {
                best = s;
                bestP = p;
            }
        }
        return best;
    }

    /** Union of the samples of every distribution, in ascending order. */
    @Override
    public List<T> samples() {
        Set<T> all = new TreeSet<>();
        for (FreqDist<T> fd : freqdists) all.addAll(fd.keys());
        return new ArrayList<>(all);
    }

    @Override
    public double discount() {
        throw new UnsupportedOperationException("Cross-validation estimates do not define a discount");
    }

    @Override
    public boolean sumsToOne() {
        return false;
    }

    @Override
    public String toString() {
        return "CrossValidationProbDist: " + freqdists.size() + "-way";
    }
}
