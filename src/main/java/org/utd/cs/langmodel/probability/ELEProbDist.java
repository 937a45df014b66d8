package org.utd.cs.langmodel.probability;

/**
 * Expected likelihood estimate, the Lidstone estimate with gamma = 0.5.
 */
public class ELEProbDist<T extends Comparable<? super T>> extends LidstoneProbDist<T> {

    public ELEProbDist(FreqDist<T> freqdist) {
        this(freqdist, null);
    }

    public ELEProbDist(FreqDist<T> freqdist, Integer bins) {
        super(freqdist, 0.5, bins);
    }

    @Override
    protected String estimatorName() {
        return "ELE";
    }
}
