package org.utd.cs.langmodel;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.utd.cs.langmodel.TrainingFixtures.*;

class InterpolatedLanguageModelTest {

    private static final double EPS = 1e-9;

    private static final List<Ngram> UNTRAINED_BIGRAMS =
            bigrams("<s>", "a", "a", "c", "c", "<UNK>", "<UNK>", "d", "d", "c", "c", "</s>");

    private static void assertSumsToOne(LanguageModel model, List<String> context) {
        double total = 0.0;
        for (String w : model.getVocabulary().words()) total += model.score(w, context);
        assertEquals(1.0, total, 1e-9, model.getName() + " context " + context);
    }

    @Test
    void testWittenBellBigram() {
        WittenBellInterpolated model = fitted(new WittenBellInterpolated(2, vocabulary()));

        // gamma(b) = 2 / (2 + 2), MLE(c | b) = 1/2, unigram(c) = 1/14
        assertEquals(0.2857142857142857, model.score("c", List.of("b")), EPS);
        assertEquals(0.5714285714285714, model.score("d", List.of("c")), EPS);
        assertEquals(0.3214285714285714, model.score("a", List.of("<s>")), EPS);
        assertEquals(0.10714285714285714, model.score("e", List.of("a")), EPS);
        assertEquals(0.0, model.score("z", List.of("a")), EPS);
        // unseen context defers to the unigram
        assertEquals(1.0 / 14, model.score("c", List.of("z")), EPS);
        assertEquals(3.681540338363693, model.entropy(UNTRAINED_BIGRAMS), EPS);
    }

    @Test
    void testWittenBellTrigram() {
        WittenBellInterpolated model = fitted(new WittenBellInterpolated(3, vocabulary()));

        assertEquals(0.6388888888888888, model.score("c", List.of("a", "b")), EPS);
        assertEquals(0.7777777777777778, model.score("d", List.of("b", "c")), EPS);
        assertEquals(0.34523809523809523, model.score("a", List.of("<s>", "<s>")), EPS);
        assertEquals(0.6527777777777778, model.score("b", List.of("a", "d")), EPS);
        assertEquals(2.0 / 18, model.score("a"), EPS);
        assertSumsToOne(model, List.of("a", "b"));
        assertSumsToOne(model, List.of("z", "a"));
    }

    @Test
    void testAbsoluteDiscountingBigram() {
        AbsoluteDiscountingInterpolated model = fitted(new AbsoluteDiscountingInterpolated(2, 0.75, vocabulary()));

        // (1 - 0.75) / 2 + (0.75 * 2 / 2) * 1/8
        assertEquals(0.21875, model.score("c", List.of("b")), EPS);
        assertEquals(0.34375, model.score("d", List.of("c")), EPS);
        assertEquals(0.09375, model.score("z", List.of("a")), EPS);
        assertEquals(0.125, model.score("a"), EPS);
        assertEquals(3.2113054290561025, model.entropy(UNTRAINED_BIGRAMS), EPS);
        for (String c : List.of("a", "z", "<s>")) assertSumsToOne(model, List.of(c));
    }

    @Test
    void testAbsoluteDiscountingTrigram() {
        AbsoluteDiscountingInterpolated model = fitted(new AbsoluteDiscountingInterpolated(3, 0.75, vocabulary()));

        assertEquals(0.4140625, model.score("c", List.of("a", "b")), EPS);
        assertEquals(0.5078125, model.score("d", List.of("b", "c")), EPS);
        assertEquals(0.224609375, model.score("a", List.of("<s>", "<s>")), EPS);
        assertEquals(0.125, model.score("z", List.of("z", "z")), EPS);
        assertSumsToOne(model, List.of("<s>", "<s>"));
    }

    @Test
    void testKneserNeyBigram() {
        KneserNeyInterpolated model = fitted(new KneserNeyInterpolated(2, 0.1, vocabulary()));

        assertEquals(0.45833333333333337, model.score("c", List.of("b")), EPS);
        assertEquals(0.9166666666666667, model.score("d", List.of("c")), EPS);
        assertEquals(0.4666666666666667, model.score("a", List.of("<s>")), EPS);
        // continuation unigram: a follows two distinct words out of 12 bigram types
        assertEquals(0.16666666666666666, model.score("a"), EPS);
        assertEquals(0.0, model.score("z"), EPS);
        assertEquals(5.341504358478725, model.entropy(UNTRAINED_BIGRAMS), EPS);
        for (String c : List.of("a", "z", "<s>")) assertSumsToOne(model, List.of(c));
    }

    @Test
    void testKneserNeyTrigram() {
        KneserNeyInterpolated model = fitted(new KneserNeyInterpolated(3, 0.1, vocabulary()));

        assertEquals(0.9457142857142857, model.score("c", List.of("a", "b")), EPS);
        assertEquals(0.9914285714285714, model.score("d", List.of("b", "c")), EPS);
        assertEquals(0.49714285714285716, model.score("a", List.of("<s>", "<s>")), EPS);
        assertEquals(0.002142857142857143, model.score("e", List.of("a", "d")), EPS);
        assertEquals(0.14285714285714285, model.score("a"), EPS);
        assertSumsToOne(model, List.of("a", "b"));
    }

    @Test
    void testNamesAndDescribe() {
        KneserNeyInterpolated kn = fitted(new KneserNeyInterpolated(3, 0.1, vocabulary()));
        assertEquals("KneserNeyInterpolated", kn.getName());
        JSONObject params = kn.describe().getJSONObject("parameters");
        assertEquals(0.1, params.getDouble("discount"), 1e-12);
        assertEquals(3, params.getInt("order"));

        assertEquals("WittenBellInterpolated", new WittenBellInterpolated(2).getName());
        assertEquals("AbsoluteDiscountingInterpolated", new AbsoluteDiscountingInterpolated(2).getName());
    }

    @Test
    void testGenerateFromSmoothedModel() {
        WittenBellInterpolated model = fitted(new WittenBellInterpolated(3, vocabulary()));
        List<String> words = model.generate(5, List.of("<s>", "<s>"), new java.util.Random(5));

        assertEquals(5, words.size());
        for (String w : words) assertTrue(model.getVocabulary().contains(w), w);
    }
}
