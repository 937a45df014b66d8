package org.utd.cs.langmodel;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.utd.cs.langmodel.probability.FreqDist;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NgramCounterTest {

    @Test
    void testBigramsOnly() {
        NgramCounter counter = new NgramCounter();
        counter.update(List.of(List.of(Ngram.of("a", "b"), Ngram.of("b", "c"))));

        assertEquals(1, counter.ngramsOfOrder(2).get(Ngram.of("a")).count("b"));
        assertEquals(1, counter.ngramsOfOrder(2).get(Ngram.of("b")).count("c"));
        assertTrue(counter.unigrams().isEmpty());
        assertEquals(2, counter.getN());
        assertEquals(List.of(2), counter.orders());
    }

    @Test
    void testListTokensAreAccepted() {
        NgramCounter counter = new NgramCounter(List.of(
                List.of(List.of("a"), List.of("a", "b"), List.of("a", "b", "c"))));

        assertEquals(1, counter.unigrams().count("a"));
        assertEquals(1, counter.lookup(List.of("a")).count("b"));
        assertEquals(1, counter.lookup(Ngram.of("a", "b")).count("c"));
        assertEquals(List.of(1, 2, 3), counter.orders());
    }

    @Test
    void testLookupEmptyContextIsUnigrams() {
        NgramCounter counter = new NgramCounter(TrainingFixtures.paddedEverygrams(3));
        assertSame(counter.unigrams(), counter.lookup(Ngram.empty()));
        assertEquals(18, counter.unigrams().getN());
    }

    @Test
    void testLookupAddsUnseenContext() {
        NgramCounter counter = new NgramCounter();
        FreqDist<String> fd = counter.lookup(Ngram.of("x", "y"));

        assertTrue(fd.isEmpty());
        assertTrue(counter.ngramsOfOrder(3).contains(Ngram.of("x", "y")));
        assertEquals(0, counter.getN());
    }

    @Test
    void testTypeMismatch() {
        NgramCounter counter = new NgramCounter();

        List<List<String>> tokensNotNgrams = List.of(List.of("a", "b"));
        assertThrows(TypeMismatchException.class, () -> counter.update(tokensNotNgrams));

        List<Ngram> sentenceIsNgram = List.of(Ngram.of("a", "b"));
        assertThrows(TypeMismatchException.class, () -> counter.update(List.of(sentenceIsNgram.get(0))));

        List<List<List<Object>>> badToken = List.of(List.of(List.of("a", 1)));
        assertThrows(TypeMismatchException.class, () -> counter.update(badToken));

        List<List<Ngram>> emptyNgram = List.of(List.of(Ngram.empty()));
        assertThrows(TypeMismatchException.class, () -> counter.update(emptyNgram));
    }

    @Test
    void testOrderBounds() {
        NgramCounter counter = new NgramCounter(List.of(List.of(Ngram.of("a"))));
        assertThrows(IllegalArgumentException.class, () -> counter.ngramsOfOrder(1));
        assertThrows(IllegalArgumentException.class, () -> counter.ngramsOfOrder(0));
        // order 1 lives in the unigrams
        assertEquals(1, counter.unigrams().count("a"));
        assertSame(counter.unigrams(), counter.lookup(Ngram.empty()));
    }

    @Test
    void testNSumsAcrossOrders() {
        NgramCounter counter = new NgramCounter(List.of(
                List.of(Ngram.of("a"), Ngram.of("b"), Ngram.of("a", "b"), Ngram.of("a", "b", "c")),
                List.of(Ngram.of("a", "b"), Ngram.of("b", "c"))));

        assertEquals(2, counter.unigrams().getN());
        assertEquals(3, counter.ngramsOfOrder(2).total());
        assertEquals(1, counter.ngramsOfOrder(3).total());
        // every fed n-gram counts once, whatever its order
        assertEquals(6, counter.getN());
        assertEquals(counter.unigrams().getN() + counter.ngramsOfOrder(2).total()
                + counter.ngramsOfOrder(3).total(), counter.getN());
    }

    @Test
    void testFrequencyOfFrequency() {
        NgramCounter counter = new NgramCounter(List.of(List.of(
                Ngram.of("a"), Ngram.of("a"), Ngram.of("b"),
                Ngram.of("a", "b"), Ngram.of("a", "b"), Ngram.of("b", "c"))));

        Map<Integer, ? extends Map<Integer, Integer>> fof = counter.frequencyOfFrequency();
        assertEquals(Map.of(1, 1, 2, 1), fof.get(1));
        assertEquals(Map.of(1, 1, 2, 1), fof.get(2));
        assertEquals(List.of(1, 2), List.copyOf(fof.keySet()));
    }

    @Test
    void testToJson() {
        NgramCounter counter = new NgramCounter(TrainingFixtures.paddedEverygrams(2));
        JSONObject json = counter.toJson();

        assertEquals(counter.getN(), json.getLong("N"));
        assertEquals(2, json.getJSONArray("orders").length());
        JSONObject unigrams = json.getJSONArray("orders").getJSONObject(0);
        assertEquals(1, unigrams.getInt("order"));
        assertEquals(14, unigrams.getLong("N"));
    }
}
