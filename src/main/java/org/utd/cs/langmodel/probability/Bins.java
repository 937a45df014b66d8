package org.utd.cs.langmodel.probability;

/**
 * Validation of the {@code bins} argument shared by the estimators.
 */
final class Bins {

    private Bins() {}

    /** Bins to use for {@code fd}: the given value, or {@code fd.getB()} when null. */
    static int resolve(FreqDist<?> fd, Integer bins, String estimator) {
        if (bins == null) return fd.getB();
        if (bins < fd.getB()) {
            throw new ConfigurationException(String.format(
                    "The number of bins in a %s distribution (%d) must be greater than or equal to "
                            + "the number of bins in the FreqDist used to create it (%d).",
                    estimator, bins, fd.getB()));
        }
        return bins;
    }

    /** Like {@link #resolve}, but an effective bin count of zero is also rejected. */
    static int resolveNonZero(FreqDist<?> fd, Integer bins, String estimator) {
        int resolved = resolve(fd, bins, estimator);
        if (resolved == 0) {
            throw new ConfigurationException("A " + estimator + " probability distribution must have at least one bin.");
        }
        return resolved;
    }
}
