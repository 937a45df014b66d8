package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * One probability distribution per condition, built from a conditional
 * frequency distribution and a {@link ProbDistFactory}.
 *
 * Asking for a condition that was never seen builds a distribution from an
 * empty frequency distribution, which for most estimators is uniform.
 */
public class ConditionalProbDist<C extends Comparable<? super C>, T extends Comparable<? super T>> {

    private final ProbDistFactory<T> factory;
    private final Map<C, ProbDist<T>> pdists = new HashMap<>();

    public ConditionalProbDist(ConditionalFreqDist<C, T> cfdist, ProbDistFactory<T> factory) {
        this.factory = factory;
        for (C c : cfdist.conditions()) {
            pdists.put(c, factory.create(cfdist.getOrCreate(c)));
        }
    }

    public ProbDist<T> get(C condition) {
        return pdists.computeIfAbsent(condition, k -> factory.create(new FreqDist<>()));
    }

    public boolean contains(C condition) {
        return pdists.containsKey(condition);
    }

    public List<C> conditions() {
        List<C> out = new ArrayList<>(pdists.keySet());
        Collections.sort(out);
        return out;
    }

    public int size() {
        return pdists.size();
    }
}
