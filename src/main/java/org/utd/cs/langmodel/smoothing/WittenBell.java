package org.utd.cs.langmodel.smoothing;

import org.utd.cs.langmodel.Ngram;
import org.utd.cs.langmodel.NgramCounter;
import org.utd.cs.langmodel.Vocabulary;
import org.utd.cs.langmodel.probability.FreqDist;

/**
 * Witten-Bell interpolation. The weight given to the lower order grows with the
 * number of distinct words seen after the context:
 *
 *      gamma = n+ / (n+ + N(ctx))
 *      alpha = (1 - gamma) * MLE(word | ctx)
 */
public class WittenBell extends Smoothing {

    public WittenBell(Vocabulary vocabulary, NgramCounter counts) {
        super(vocabulary, counts);
    }

    @Override
    public AlphaGamma alphaGamma(String word, Ngram context) {
        FreqDist<String> fd = counts.lookup(context);
        double alpha = fd.freq(word);
        double gamma = gamma(fd);
        return new AlphaGamma((1.0 - gamma) * alpha, gamma);
    }

    private static double gamma(FreqDist<String> fd) {
        int nPlus = fd.getB();
        if (nPlus == 0) return 1.0;
        return nPlus / (double) (nPlus + fd.getN());
    }

    @Override
    public double unigramScore(String word) {
        return counts.unigrams().freq(word);
    }

    @Override
    public String getName() {
        return "WittenBell";
    }
}
