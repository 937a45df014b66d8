/**
 * InterpolatedLanguageModel.java
 * Language Model Toolkit
 *
 * Description: Language model that mixes estimates from every context length.
 * Starting from the full context, each step adds the smoothing strategy's
 * alpha for the current context (scaled by the weight left so far) and hands
 * gamma of the remaining weight to the context without its first token. What
 * is left at the end goes to the unigram score:
 *
 *      score = a(ctx) + g(ctx) * (a(ctx') + g(ctx') * ( ... * unigram(word)))
 *
 * A context that was never followed by anything contributes nothing and
 * passes all of its weight down.
 */

package org.utd.cs.langmodel;

import org.json.JSONObject;
import org.utd.cs.langmodel.smoothing.AlphaGamma;
import org.utd.cs.langmodel.smoothing.Smoothing;

import java.util.function.BiFunction;

public class InterpolatedLanguageModel extends LanguageModel {

    protected final Smoothing smoothing;

    public InterpolatedLanguageModel(BiFunction<Vocabulary, NgramCounter, Smoothing> smoothing,
                                     int order) {
        this(smoothing, order, new CountingVocabulary(), new NgramCounter());
    }

    public InterpolatedLanguageModel(BiFunction<Vocabulary, NgramCounter, Smoothing> smoothing,
                                     int order, Vocabulary vocabulary) {
        this(smoothing, order, vocabulary, new NgramCounter());
    }

    public InterpolatedLanguageModel(BiFunction<Vocabulary, NgramCounter, Smoothing> smoothing,
                                     int order, Vocabulary vocabulary, NgramCounter counts) {
        super(order, vocabulary, counts);
        this.smoothing = smoothing.apply(this.vocabulary, this.counts);
    }

    @Override
    protected double unmaskedScore(String word, Ngram context) {
        double score = 0.0;
        double weight = 1.0;
        for (Ngram ctx = context; !ctx.isEmpty(); ctx = ctx.tail()) {
            AlphaGamma ag = contextCounts(ctx).isEmpty()
                    ? AlphaGamma.DEFER
                    : smoothing.alphaGamma(word, ctx);
            score += weight * ag.getAlpha();
            weight *= ag.getGamma();
        }
        return score + weight * smoothing.unigramScore(word);
    }

    public Smoothing getSmoothing() {
        return smoothing;
    }

    @Override
    public String getName() {
        return smoothing.getName() + "Interpolated";
    }

    @Override
    protected JSONObject parameters() {
        return smoothing.parameters();
    }
}
