/**
 * FreqDist.java
 * Language Model Toolkit
 *
 * Description: Counts of discrete outcomes with cached derived views.
 *
 * A frequency distribution records how many times each outcome of an
 * experiment occurred. Derived views (the frequency-sorted item list,
 * the frequency-of-frequency histogram and the most frequent outcome)
 * are computed on demand and dropped on every mutation.
 *
 * Not thread-safe: a single writer is assumed while counting, and the
 * distribution is treated as read-only once an estimator wraps it.
 */

package org.utd.cs.langmodel.probability;

import java.util.*;

public class FreqDist<T extends Comparable<? super T>> {

    private final Map<T, Integer> counts = new HashMap<>();
    private long n = 0;

    // derived caches, null means "stale"
    private List<Map.Entry<T, Integer>> itemCache;
    private int[] nrCache;
    private T maxCache;

    public FreqDist() {}

    public FreqDist(Iterable<? extends T> samples) {
        update(samples);
    }

    /** Adds one occurrence of the given outcome. */
    public void increment(T sample) {
        increment(sample, 1);
    }

    /**
     * Adjusts the count of an outcome. A zero delta is a no-op; a count that
     * reaches zero removes the outcome so that {@link #getB()} only reports
     * outcomes that were actually observed.
     *
     * @throws IllegalArgumentException if the resulting count would be negative
     */
    public void increment(T sample, int by) {
        if (by == 0) return;
        Objects.requireNonNull(sample, "sample");

        int current = counts.getOrDefault(sample, 0);
        int updated = current + by;
        if (updated < 0) {
            throw new IllegalArgumentException(
                    "Count for " + sample + " would become negative (" + updated + ")");
        }
        if (updated == 0) {
            counts.remove(sample);
        } else {
            counts.put(sample, updated);
        }
        n += by;
        resetCaches();
    }

    public void update(Iterable<? extends T> samples) {
        for (T s : samples) increment(s);
    }

    public void update(FreqDist<T> other) {
        for (Map.Entry<T, Integer> e : other.counts.entrySet()) {
            increment(e.getKey(), e.getValue());
        }
    }

    public void clear() {
        counts.clear();
        n = 0;
        resetCaches();
    }

    public int count(T sample) {
        return counts.getOrDefault(sample, 0);
    }

    public boolean contains(T sample) {
        return counts.containsKey(sample);
    }

    /** Relative frequency of an outcome; 0 when nothing has been recorded. */
    public double freq(T sample) {
        if (n == 0) return 0.0;
        return (double) count(sample) / n;
    }

    /** Total number of outcomes recorded. */
    public long getN() {
        return n;
    }

    /** Number of distinct outcomes with a count greater than zero. */
    public int getB() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int frequencyOfFrequency(int r) {
        return frequencyOfFrequency(r, null);
    }

    /**
     * Number of outcomes seen exactly {@code r} times. For {@code r == 0} this
     * is {@code bins - B}, or 0 when bins is not given.
     */
    public int frequencyOfFrequency(int r, Integer bins) {
        if (r < 0) throw new IllegalArgumentException("r must be non-negative, got " + r);

        if (r == 0) {
            return bins == null ? 0 : bins - getB();
        }

        if (nrCache == null) cacheNrValues();
        if (r >= nrCache.length) return 0;
        return nrCache[r];
    }

    private void cacheNrValues() {
        int maxCount = 0;
        for (int c : counts.values()) maxCount = Math.max(maxCount, c);

        int[] nr = new int[maxCount + 1];
        for (int c : counts.values()) nr[c]++;
        nrCache = nr;
    }

    /** Outcomes observed exactly once. */
    public List<T> hapaxes() {
        List<T> out = new ArrayList<>();
        for (Map.Entry<T, Integer> e : items()) {
            if (e.getValue() == 1) out.add(e.getKey());
        }
        return out;
    }

    /** Outcomes sorted by decreasing count, ties broken by ascending outcome. */
    public List<T> keys() {
        List<T> out = new ArrayList<>(counts.size());
        for (Map.Entry<T, Integer> e : sortedItems()) out.add(e.getKey());
        return out;
    }

    public List<T> samples() {
        return keys();
    }

    /** (outcome, count) pairs in the same order as {@link #keys()}. */
    public List<Map.Entry<T, Integer>> items() {
        return new ArrayList<>(sortedItems());
    }

    private List<Map.Entry<T, Integer>> sortedItems() {
        if (itemCache == null) {
            List<Map.Entry<T, Integer>> items = new ArrayList<>(counts.size());
            for (Map.Entry<T, Integer> e : counts.entrySet()) {
                items.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
            }
            items.sort((a, b) -> {
                int byCount = Integer.compare(b.getValue(), a.getValue());
                return byCount != 0 ? byCount : a.getKey().compareTo(b.getKey());
            });
            itemCache = Collections.unmodifiableList(items);
        }
        return itemCache;
    }

    /**
     * The outcome with the greatest count. Ties go to the greatest outcome in
     * natural order. Returns null for an empty distribution.
     */
    public T max() {
        if (maxCache == null && !counts.isEmpty()) {
            T best = null;
            int bestCount = -1;
            for (Map.Entry<T, Integer> e : counts.entrySet()) {
                int c = e.getValue();
                if (c > bestCount || (c == bestCount && e.getKey().compareTo(best) > 0)) {
                    best = e.getKey();
                    bestCount = c;
                }
            }
            maxCache = best;
        }
        return maxCache;
    }

    /** Running totals of the counts of the given samples (all keys when null). */
    public List<Long> cumulativeFrequencies(List<T> samples) {
        List<T> order = (samples == null || samples.isEmpty()) ? keys() : samples;
        List<Long> out = new ArrayList<>(order.size());
        long cf = 0;
        for (T s : order) {
            cf += count(s);
            out.add(cf);
        }
        return out;
    }

    public FreqDist<T> copy() {
        FreqDist<T> clone = new FreqDist<>();
        clone.update(this);
        return clone;
    }

    private void resetCaches() {
        itemCache = null;
        nrCache = null;
        maxCache = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FreqDist)) return false;
        return counts.equals(((FreqDist<?>) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FreqDist{");
        boolean first = true;
        for (Map.Entry<T, Integer> e : sortedItems()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
