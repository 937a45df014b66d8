package org.utd.cs.langmodel;

import org.utd.cs.langmodel.smoothing.KneserNey;

/** Interpolated Kneser-Ney model. */
public class KneserNeyInterpolated extends InterpolatedLanguageModel {

    public KneserNeyInterpolated(int order) {
        this(order, KneserNey.DEFAULT_DISCOUNT, new CountingVocabulary());
    }

    public KneserNeyInterpolated(int order, double discount, Vocabulary vocabulary) {
        this(order, discount, vocabulary, new NgramCounter());
    }

    public KneserNeyInterpolated(int order, double discount, Vocabulary vocabulary, NgramCounter counts) {
        super((v, c) -> new KneserNey(v, c, order, discount), order, vocabulary, counts);
    }
}
