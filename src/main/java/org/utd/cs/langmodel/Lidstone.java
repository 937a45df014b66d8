package org.utd.cs.langmodel;

import org.json.JSONObject;
import org.utd.cs.langmodel.probability.FreqDist;

/**
 * Additive smoothing: every vocabulary word gets {@code gamma} extra counts in
 * every context.
 *
 *      score = (c + gamma) / (N(ctx) + |V| * gamma)
 */
public class Lidstone extends LanguageModel {

    protected final double gamma;

    public Lidstone(double gamma, int order) {
        super(order);
        this.gamma = gamma;
    }

    public Lidstone(double gamma, int order, Vocabulary vocabulary) {
        super(order, vocabulary);
        this.gamma = gamma;
    }

    public Lidstone(double gamma, int order, Vocabulary vocabulary, NgramCounter counts) {
        super(order, vocabulary, counts);
        this.gamma = gamma;
    }

    @Override
    protected double unmaskedScore(String word, Ngram context) {
        FreqDist<String> fd = contextCounts(context);
        double divisor = fd.getN() + vocabulary.size() * gamma;
        if (divisor == 0) return 0.0;
        return (fd.count(word) + gamma) / divisor;
    }

    public double getGamma() {
        return gamma;
    }

    @Override
    protected JSONObject parameters() {
        return new JSONObject().put("gamma", gamma);
    }
}
