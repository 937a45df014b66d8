package org.utd.cs.langmodel.probability;

/**
 * Builds a probability distribution from a condition's frequency distribution.
 * Estimator constructors fit directly, e.g. {@code MLEProbDist::new} or
 * {@code fd -> new ELEProbDist<>(fd, 10)}.
 */
@FunctionalInterface
public interface ProbDistFactory<T extends Comparable<? super T>> {

    ProbDist<T> create(FreqDist<T> freqdist);
}
