package org.utd.cs.langmodel.smoothing;

import org.junit.jupiter.api.Test;
import org.utd.cs.langmodel.CountingVocabulary;
import org.utd.cs.langmodel.Ngram;
import org.utd.cs.langmodel.NgramCounter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmoothingTest {

    private static final double EPS = 1e-12;

    // a b, a b, a c, x b ; unigrams a a a x b b b c
    private static NgramCounter counts() {
        return new NgramCounter(List.of(List.of(
                Ngram.of("a"), Ngram.of("a"), Ngram.of("a"), Ngram.of("x"),
                Ngram.of("b"), Ngram.of("b"), Ngram.of("b"), Ngram.of("c"),
                Ngram.of("a", "b"), Ngram.of("a", "b"), Ngram.of("a", "c"), Ngram.of("x", "b"))));
    }

    private static CountingVocabulary vocabulary() {
        return new CountingVocabulary(List.of("a", "b", "c", "x"), 1, "<UNK>");
    }

    @Test
    void testWittenBell() {
        WittenBell wb = new WittenBell(vocabulary(), counts());

        AlphaGamma ag = wb.alphaGamma("b", Ngram.of("a"));
        // n+ = 2, N = 3
        assertEquals(0.4, ag.getGamma(), EPS);
        assertEquals(0.6 * 2 / 3, ag.getAlpha(), EPS);
        assertEquals(3.0 / 8, wb.unigramScore("b"), EPS);
        assertEquals(0.0, wb.unigramScore("<UNK>"), EPS);
    }

    @Test
    void testAbsoluteDiscounting() {
        AbsoluteDiscounting ad = new AbsoluteDiscounting(vocabulary(), counts(), 0.5);

        AlphaGamma ag = ad.alphaGamma("b", Ngram.of("a"));
        assertEquals(1.5 / 3, ag.getAlpha(), EPS);
        assertEquals(0.5 * 2 / 3, ag.getGamma(), EPS);
        assertEquals(0.0, ad.alphaGamma("x", Ngram.of("a")).getAlpha(), EPS);
        // four words plus <UNK>
        assertEquals(0.2, ad.unigramScore("anything"), EPS);
        assertEquals(0.75, new AbsoluteDiscounting(vocabulary(), counts()).getDiscount());
    }

    @Test
    void testAbsoluteDiscountingEmptyVocabulary() {
        AbsoluteDiscounting ad = new AbsoluteDiscounting(new CountingVocabulary(), new NgramCounter());
        assertEquals(0.0, ad.unigramScore("a"));
    }

    @Test
    void testKneserNeyContinuationUnigrams() {
        KneserNey kn = new KneserNey(vocabulary(), counts(), 2, 0.1);

        // bigram types: (a b) (a c) (x b); b follows two distinct words
        assertEquals(2.0 / 3, kn.unigramScore("b"), EPS);
        assertEquals(1.0 / 3, kn.unigramScore("c"), EPS);
        assertEquals(0.0, kn.unigramScore("a"), EPS);
    }

    @Test
    void testKneserNeyHighestOrderUsesRawCounts() {
        KneserNey kn = new KneserNey(vocabulary(), counts(), 2, 0.1);

        AlphaGamma ag = kn.alphaGamma("b", Ngram.of("a"));
        assertEquals(1.9 / 3, ag.getAlpha(), EPS);
        assertEquals(0.1 * 2 / 3, ag.getGamma(), EPS);
    }

    @Test
    void testKneserNeyLowerOrderWithoutContinuationsDefers() {
        // order 3 model, but no trigrams counted: (a) has no continuation counts
        KneserNey kn = new KneserNey(vocabulary(), counts(), 3, 0.1);

        AlphaGamma ag = kn.alphaGamma("b", Ngram.of("a"));
        assertEquals(0.0, ag.getAlpha());
        assertEquals(1.0, ag.getGamma());
    }

    @Test
    void testKneserNeyUniformWithoutBigrams() {
        NgramCounter unigramsOnly = new NgramCounter(List.of(List.of(Ngram.of("a"), Ngram.of("b"))));
        KneserNey kn = new KneserNey(vocabulary(), unigramsOnly, 1);

        assertEquals(0.2, kn.unigramScore("a"), EPS);
        assertEquals(KneserNey.DEFAULT_DISCOUNT, kn.getDiscount());
    }
}
