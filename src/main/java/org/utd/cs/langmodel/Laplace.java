package org.utd.cs.langmodel;

/**
 * Add-one smoothing; Lidstone with gamma = 1.
 */
public class Laplace extends Lidstone {

    public Laplace(int order) {
        super(1.0, order);
    }

    public Laplace(int order, Vocabulary vocabulary) {
        super(1.0, order, vocabulary);
    }

    public Laplace(int order, Vocabulary vocabulary, NgramCounter counts) {
        super(1.0, order, vocabulary, counts);
    }
}
