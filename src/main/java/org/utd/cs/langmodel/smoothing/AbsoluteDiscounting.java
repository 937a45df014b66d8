package org.utd.cs.langmodel.smoothing;

import org.json.JSONObject;
import org.utd.cs.langmodel.Ngram;
import org.utd.cs.langmodel.NgramCounter;
import org.utd.cs.langmodel.Vocabulary;
import org.utd.cs.langmodel.probability.FreqDist;

/**
 * Absolute discounting: subtract a fixed {@code d} from every seen count and
 * pass the collected mass to the lower order.
 *
 *      alpha = max(c(word | ctx) - d, 0) / N(ctx)
 *      gamma = d * n+(ctx) / N(ctx)
 *
 * Unigrams are uniform over the vocabulary.
 */
public class AbsoluteDiscounting extends Smoothing {

    public static final double DEFAULT_DISCOUNT = 0.75;

    private final double discount;

    public AbsoluteDiscounting(Vocabulary vocabulary, NgramCounter counts) {
        this(vocabulary, counts, DEFAULT_DISCOUNT);
    }

    public AbsoluteDiscounting(Vocabulary vocabulary, NgramCounter counts, double discount) {
        super(vocabulary, counts);
        this.discount = discount;
    }

    @Override
    public AlphaGamma alphaGamma(String word, Ngram context) {
        FreqDist<String> fd = counts.lookup(context);
        long n = fd.getN();
        if (n == 0) return AlphaGamma.DEFER;
        double alpha = Math.max(fd.count(word) - discount, 0.0) / n;
        double gamma = discount * fd.getB() / n;
        return new AlphaGamma(alpha, gamma);
    }

    @Override
    public double unigramScore(String word) {
        int v = vocabulary.size();
        return (v == 0) ? 0.0 : 1.0 / v;
    }

    public double getDiscount() {
        return discount;
    }

    @Override
    public String getName() {
        return "AbsoluteDiscounting";
    }

    @Override
    public JSONObject parameters() {
        return new JSONObject().put("discount", discount);
    }
}
