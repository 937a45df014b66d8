/**
 * HeldoutProbDist.java
 * Language Model Toolkit
 *
 * Description: Heldout estimate. A sample seen r times in the base
 * distribution gets the average heldout frequency of all samples seen r times
 * in the base distribution:
 *
 *      estimate[r] = Tr[r] / (Nr[r] * N)
 *
 * where Tr[r] is the heldout count of those samples, Nr[r] their number, and
 * N the size of the heldout distribution. The estimates are precomputed for
 * every r up to the base distribution's largest count.
 */

package org.utd.cs.langmodel.probability;

import java.util.List;

public class HeldoutProbDist<T extends Comparable<? super T>> implements ProbDist<T> {

    private final FreqDist<T> baseFdist;
    private final FreqDist<T> heldoutFdist;
    private final double[] estimate;

    public HeldoutProbDist(FreqDist<T> baseFdist, FreqDist<T> heldoutFdist) {
        this(baseFdist, heldoutFdist, null);
    }

    public HeldoutProbDist(FreqDist<T> baseFdist, FreqDist<T> heldoutFdist, Integer bins) {
        Integer resolved = (bins == null) ? null : Bins.resolve(baseFdist, bins, "Heldout");
        this.baseFdist = baseFdist;
        this.heldoutFdist = heldoutFdist;

        T top = baseFdist.max();
        int maxR = (top == null) ? 0 : baseFdist.count(top);

        // 1. Tr: heldout counts grouped by base count
        double[] tr = new double[maxR + 1];
        for (T sample : heldoutFdist.keys()) {
            int r = baseFdist.count(sample);
            tr[r] += heldoutFdist.count(sample);
        }

        // 2. Nr and N
        long n = heldoutFdist.getN();

        // 3. estimate[r]; left at 0 where Nr[r] == 0, those r are never looked up
        estimate = new double[maxR + 1];
        for (int r = 0; r <= maxR; r++) {
            int nr = baseFdist.frequencyOfFrequency(r, resolved);
            if (nr != 0 && n != 0) estimate[r] = tr[r] / (nr * (double) n);
        }
    }

    public FreqDist<T> getBaseFdist() {
        return baseFdist;
    }

    public FreqDist<T> getHeldoutFdist() {
        return heldoutFdist;
    }

    @Override
    public double prob(T sample) {
        return estimate[baseFdist.count(sample)];
    }

    /**
     * Heldout estimates are not necessarily monotonic in the base count, so this
     * is only right most of the time.
     */
    @Override
    public T max() {
        return baseFdist.max();
    }

    @Override
    public List<T> samples() {
        return baseFdist.keys();
    }

    @Override
    public double discount() {
        throw new UnsupportedOperationException("Heldout estimates do not define a discount");
    }

    @Override
    public boolean sumsToOne() {
        return false;
    }

    @Override
    public String toString() {
        return "HeldoutProbDist: " + baseFdist.getN() + " base samples; "
                + heldoutFdist.getN() + " heldout samples";
    }
}
