package org.utd.cs.langmodel;

/**
 * Maximum likelihood estimate: the relative frequency of the word after the
 * context. Unseen words score 0.
 */
public class MLE extends LanguageModel {

    public MLE(int order) {
        super(order);
    }

    public MLE(int order, Vocabulary vocabulary) {
        super(order, vocabulary);
    }

    public MLE(int order, Vocabulary vocabulary, NgramCounter counts) {
        super(order, vocabulary, counts);
    }

    @Override
    protected double unmaskedScore(String word, Ngram context) {
        return contextCounts(context).freq(word);
    }
}
