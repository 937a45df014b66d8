package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * Conditional distribution given directly as a map from condition to
 * {@link ProbDist}. Unlike {@link ConditionalProbDist} there is no factory, so
 * an unknown condition is an error rather than a fresh empty distribution.
 */
public class DictionaryConditionalProbDist<C extends Comparable<? super C>, T> {

    private final Map<C, ProbDist<T>> pdists;

    public DictionaryConditionalProbDist(Map<C, ? extends ProbDist<T>> pdists) {
        this.pdists = new HashMap<>(pdists);
    }

    /** @throws NoSuchElementException if the condition has no distribution */
    public ProbDist<T> get(C condition) {
        ProbDist<T> pd = pdists.get(condition);
        if (pd == null) {
            throw new NoSuchElementException("No distribution for condition " + condition);
        }
        return pd;
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
