/**
 * NgramPreprocessing.java
 * Language Model Toolkit
 *
 * Description: Turns tokenized sentences into training input for a language
 * model. Each sentence is padded with n-1 start and end symbols and broken
 * into every n-gram of length 1..n; the padded sentences, flattened, make up
 * the text the vocabulary is built from.
 */

package org.utd.cs.langmodel;

import java.util.*;

public class NgramPreprocessing {

    public static final String DEFAULT_PAD_LEFT = "<s>";
    public static final String DEFAULT_PAD_RIGHT = "</s>";

    private final String padLeft;
    private final String padRight;

    public NgramPreprocessing() {
        this(DEFAULT_PAD_LEFT, DEFAULT_PAD_RIGHT);
    }

    public NgramPreprocessing(String padLeft, String padRight) {
        this.padLeft = padLeft;
        this.padRight = padRight;
    }

    public NgramPreprocessing(LanguageModelConfig config) {
        this(config.getPadLeft(), config.getPadRight());
    }

    public List<String> padBothEnds(List<String> tokens, int n) {
        List<String> out = new ArrayList<>(tokens.size() + 2 * Math.max(n - 1, 0));
        for (int i = 1; i < n; i++) out.add(padLeft);
        out.addAll(tokens);
        for (int i = 1; i < n; i++) out.add(padRight);
        return out;
    }

    public static List<Ngram> ngrams(List<String> tokens, int n) {
        if (n < 1) throw new IllegalArgumentException("n must be at least 1, got " + n);
        List<Ngram> out = new ArrayList<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            out.add(Ngram.of(tokens.subList(i, i + n)));
        }
        return out;
    }

    /** All n-grams of length 1 through {@code maxLen}, shortest first. */
    public static List<Ngram> everygrams(List<String> tokens, int maxLen) {
        List<Ngram> out = new ArrayList<>();
        for (int n = 1; n <= Math.min(maxLen, tokens.size()); n++) out.addAll(ngrams(tokens, n));
        return out;
    }

    public List<Ngram> paddedEverygrams(List<String> tokens, int order) {
        return everygrams(padBothEnds(tokens, order), order);
    }

    public TrainingData paddedEverygramPipeline(int order, List<? extends List<String>> text) {
        List<List<Ngram>> ngrams = new ArrayList<>(text.size());
        List<String> vocabularyText = new ArrayList<>();
        for (List<String> sentence : text) {
            List<String> padded = padBothEnds(sentence, order);
            ngrams.add(everygrams(padded, order));
            vocabularyText.addAll(padded);
        }
        return new TrainingData(ngrams, vocabularyText);
    }

    /** Per-sentence training n-grams and the flattened padded text. */
    public static class TrainingData {
        private final List<List<Ngram>> ngrams;
        private final List<String> vocabularyText;

        public TrainingData(List<List<Ngram>> ngrams, List<String> vocabularyText) {
            this.ngrams = Collections.unmodifiableList(ngrams);
            this.vocabularyText = Collections.unmodifiableList(vocabularyText);
        }

        public List<List<Ngram>> getNgrams() {
            return ngrams;
        }

        public List<String> getVocabularyText() {
            return vocabularyText;
        }
    }
}
