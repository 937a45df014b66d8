package org.utd.cs.langmodel.probability;

/**
 * Lidstone estimate with gamma = 1: {@code (c + 1) / (N + B)}.
 */
public class LaplaceProbDist<T extends Comparable<? super T>> extends LidstoneProbDist<T> {

    public LaplaceProbDist(FreqDist<T> freqdist) {
        this(freqdist, null);
    }

    public LaplaceProbDist(FreqDist<T> freqdist, Integer bins) {
        super(freqdist, 1.0, bins);
    }

    @Override
    protected String estimatorName() {
        return "Laplace";
    }
}
