package org.utd.cs.langmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared training data: two sentences, "abcd" and "egadbe", over a vocabulary
 * that leaves out e and g so they are counted as the unknown-word label.
 */
final class TrainingFixtures {

    static final List<String> VOCABULARY_WORDS = List.of("a", "b", "c", "d", "z", "<s>", "</s>");

    static final List<List<String>> TEXT = List.of(
            List.of("a", "b", "c", "d"),
            List.of("e", "g", "a", "d", "b", "e"));

    private TrainingFixtures() {}

    static CountingVocabulary vocabulary() {
        return new CountingVocabulary(VOCABULARY_WORDS, 1, "<UNK>");
    }

    static List<List<Ngram>> paddedEverygrams(int order) {
        NgramPreprocessing prep = new NgramPreprocessing();
        List<List<Ngram>> out = new ArrayList<>();
        for (List<String> sentence : TEXT) out.add(prep.paddedEverygrams(sentence, order));
        return out;
    }

    static <M extends LanguageModel> M fitted(M model) {
        model.fit(paddedEverygrams(model.getOrder()));
        return model;
    }

    static List<Ngram> bigrams(String... pairs) {
        List<Ngram> out = new ArrayList<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) out.add(Ngram.of(pairs[i], pairs[i + 1]));
        return out;
    }
}
