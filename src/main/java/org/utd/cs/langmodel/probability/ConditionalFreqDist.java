package org.utd.cs.langmodel.probability;

import java.util.*;

/**
 * A collection of frequency distributions, one per condition.
 *
 * A condition's distribution is created empty the first time it is requested
 * through {@link #getOrCreate}, and from then on it is reported by
 * {@link #conditions()} even if nothing was ever counted under it.
 */
public class ConditionalFreqDist<C extends Comparable<? super C>, T extends Comparable<? super T>> {

    private final Map<C, FreqDist<T>> fdists = new HashMap<>();

    public FreqDist<T> getOrCreate(C condition) {
        return fdists.computeIfAbsent(condition, k -> new FreqDist<>());
    }

    /** Existing distribution for the condition, or null. Never creates one. */
    public FreqDist<T> get(C condition) {
        return fdists.get(condition);
    }

    public boolean contains(C condition) {
        return fdists.containsKey(condition);
    }

    public void increment(C condition, T sample) {
        getOrCreate(condition).increment(sample);
    }

    /** Touched conditions in ascending order. */
    public List<C> conditions() {
        List<C> out = new ArrayList<>(fdists.keySet());
        Collections.sort(out);
        return out;
    }

    /** Sum of N over every condition's distribution. */
    public long total() {
        long total = 0;
        for (FreqDist<T> fd : fdists.values()) total += fd.getN();
        return total;
    }

    public int size() {
        return fdists.size();
    }

    public Map<C, FreqDist<T>> asMap() {
        return Collections.unmodifiableMap(fdists);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConditionalFreqDist)) return false;
        return fdists.equals(((ConditionalFreqDist<?, ?>) o).fdists);
    }

    @Override
    public int hashCode() {
        return fdists.hashCode();
    }

    @Override
    public String toString() {
        return "ConditionalFreqDist{" + fdists.size() + " conditions}";
    }
}
