package org.utd.cs.langmodel;

import org.utd.cs.langmodel.smoothing.AbsoluteDiscounting;

/** Interpolated model with absolute discounting. */
public class AbsoluteDiscountingInterpolated extends InterpolatedLanguageModel {

    public AbsoluteDiscountingInterpolated(int order) {
        this(order, AbsoluteDiscounting.DEFAULT_DISCOUNT, new CountingVocabulary());
    }

    public AbsoluteDiscountingInterpolated(int order, double discount, Vocabulary vocabulary) {
        this(order, discount, vocabulary, new NgramCounter());
    }

    public AbsoluteDiscountingInterpolated(int order, double discount, Vocabulary vocabulary, NgramCounter counts) {
        super((v, c) -> new AbsoluteDiscounting(v, c, discount), order, vocabulary, counts);
    }
}
