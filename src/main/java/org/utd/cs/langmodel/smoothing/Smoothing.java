/**
 * Smoothing.java
 * Language Model Toolkit
 *
 * Description: Base class for interpolation smoothing. A strategy answers two
 * questions for the interpolated model: how much probability a word gets in a
 * context, and how much weight is left over for the shorter context. The
 * recursion bottoms out in the strategy's unigram score.
 */

package org.utd.cs.langmodel.smoothing;

import org.json.JSONObject;
import org.utd.cs.langmodel.Ngram;
import org.utd.cs.langmodel.NgramCounter;
import org.utd.cs.langmodel.Vocabulary;

public abstract class Smoothing {

    protected final Vocabulary vocabulary;
    protected final NgramCounter counts;

    protected Smoothing(Vocabulary vocabulary, NgramCounter counts) {
        this.vocabulary = vocabulary;
        this.counts = counts;
    }

    public abstract double unigramScore(String word);

    /** Called only for non-empty contexts with at least one count. */
    public abstract AlphaGamma alphaGamma(String word, Ngram context);

    public abstract String getName();

    /** Tunable parameters, for model summaries. */
    public JSONObject parameters() {
        return new JSONObject();
    }
}
