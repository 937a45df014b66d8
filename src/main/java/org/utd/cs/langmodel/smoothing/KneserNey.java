/**
 * KneserNey.java
 * Language Model Toolkit
 *
 * Description: Interpolated Kneser-Ney smoothing.
 *
 * Below the highest order, a word's count in a context is replaced by its
 * continuation count: the number of distinct words that precede the
 * (context, word) sequence. For a context c this means scanning the contexts
 * one order up whose tail is c:
 *
 *      cc(word | c) = |{ x : count(word | x + c) > 0 }|
 *      total(c)     = sum over x of n+(x + c)
 *
 * At the highest order raw counts are used. In both cases
 *
 *      alpha = max(count - d, 0) / total
 *      gamma = d * n+(c) / total
 */

package org.utd.cs.langmodel.smoothing;

import org.json.JSONObject;
import org.utd.cs.langmodel.Ngram;
import org.utd.cs.langmodel.NgramCounter;
import org.utd.cs.langmodel.Vocabulary;
import org.utd.cs.langmodel.probability.ConditionalFreqDist;
import org.utd.cs.langmodel.probability.FreqDist;

import java.util.Map;

public class KneserNey extends Smoothing {

    public static final double DEFAULT_DISCOUNT = 0.1;

    private final int order;
    private final double discount;

    public KneserNey(Vocabulary vocabulary, NgramCounter counts, int order) {
        this(vocabulary, counts, order, DEFAULT_DISCOUNT);
    }

    public KneserNey(Vocabulary vocabulary, NgramCounter counts, int order, double discount) {
        super(vocabulary, counts);
        this.order = order;
        this.discount = discount;
    }

    @Override
    public double unigramScore(String word) {
        long[] cc = continuationCounts(word, Ngram.empty());
        if (cc[1] == 0) {
            int v = vocabulary.size();
            return (v == 0) ? 0.0 : 1.0 / v;
        }
        return cc[0] / (double) cc[1];
    }

    @Override
    public AlphaGamma alphaGamma(String word, Ngram context) {
        FreqDist<String> prefixCounts = counts.lookup(context);
        long wordCount, total;
        if (context.size() + 1 == order) {
            wordCount = prefixCounts.count(word);
            total = prefixCounts.getN();
        } else {
            long[] cc = continuationCounts(word, context);
            wordCount = cc[0];
            total = cc[1];
        }
        if (total == 0) return AlphaGamma.DEFER;

        double alpha = Math.max(wordCount - discount, 0.0) / total;
        double gamma = discount * prefixCounts.getB() / total;
        return new AlphaGamma(alpha, gamma);
    }

    // {continuation count of word, total continuation count} for the context
    private long[] continuationCounts(String word, Ngram context) {
        ConditionalFreqDist<Ngram, String> higher = counts.ngramsOfOrder(context.size() + 2);
        long withWord = 0;
        long total = 0;
        for (Map.Entry<Ngram, FreqDist<String>> e : higher.asMap().entrySet()) {
            if (!e.getKey().tail().equals(context)) continue;
            FreqDist<String> fd = e.getValue();
            if (fd.count(word) > 0) withWord++;
            total += fd.getB();
        }
        return new long[]{ withWord, total };
    }

    public int getOrder() {
        return order;
    }

    public double getDiscount() {
        return discount;
    }

    @Override
    public String getName() {
        return "KneserNey";
    }

    @Override
    public JSONObject parameters() {
        return new JSONObject().put("discount", discount).put("order", order);
    }
}
