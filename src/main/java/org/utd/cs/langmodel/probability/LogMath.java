package org.utd.cs.langmodel.probability;

import java.util.List;

/**
 * Base-2 log helpers shared by the estimators.
 */
public final class LogMath {

    /** Stand-in for log(0) that keeps sums of log probabilities finite. */
    public static final double NINF = -1e300;

    // If the difference is bigger than this, just take the bigger one.
    private static final double ADD_LOGS_MAX_DIFF = log2(1e-30);

    private LogMath() {}

    public static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    /** log2(2^logx + 2^logy) without leaving log space. */
    public static double addLogs(double logx, double logy) {
        if (logx < logy + ADD_LOGS_MAX_DIFF) return logy;
        if (logy < logx + ADD_LOGS_MAX_DIFF) return logx;
        double base = Math.min(logx, logy);
        return base + log2(Math.pow(2, logx - base) + Math.pow(2, logy - base));
    }

    public static double sumLogs(List<Double> logs) {
        if (logs.isEmpty()) return NINF;
        double total = logs.get(0);
        for (int i = 1; i < logs.size(); i++) total = addLogs(total, logs.get(i));
        return total;
    }

    /** Entropy (in bits) of a distribution over its own samples. */
    public static <T> double entropy(ProbDist<T> pdist) {
        double h = 0.0;
        for (T s : pdist.samples()) {
            double p = pdist.prob(s);
            if (p > 0) h -= p * log2(p);
        }
        return h;
    }

    /**
     * Expected log probability of {@code test} under {@code actual}, summed over
     * the samples of {@code actual}.
     */
    public static <T> double logLikelihood(ProbDist<T> test, ProbDist<T> actual) {
        double total = 0.0;
        for (T s : actual.samples()) {
            total += actual.prob(s) * test.logprob(s);
        }
        return total;
    }
}
