package org.utd.cs.langmodel.probability;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalProbDistTest {

    private static final double EPS = 1e-12;

    private static ConditionalFreqDist<String, String> cfd() {
        ConditionalFreqDist<String, String> cfd = new ConditionalFreqDist<>();
        cfd.increment("the", "cat");
        cfd.increment("the", "cat");
        cfd.increment("the", "dog");
        cfd.increment("a", "cat");
        return cfd;
    }

    @Test
    void testMlePerCondition() {
        ConditionalProbDist<String, String> cpd = new ConditionalProbDist<>(cfd(), MLEProbDist::new);

        assertEquals(List.of("a", "the"), cpd.conditions());
        assertEquals(2.0 / 3, cpd.get("the").prob("cat"), EPS);
        assertEquals(1.0, cpd.get("a").prob("cat"), EPS);
        assertEquals("cat", cpd.get("the").max());
    }

    @Test
    void testUnseenConditionUsesEmptyDistribution() {
        ConditionalProbDist<String, String> cpd = new ConditionalProbDist<>(cfd(), fd -> new ELEProbDist<>(fd, 5));

        assertFalse(cpd.contains("an"));
        // 0.5 / (5 * 0.5)
        assertEquals(0.2, cpd.get("an").prob("cat"), EPS);
        assertTrue(cpd.contains("an"));
    }

    @Test
    void testDictionaryNormalization() {
        DictionaryProbDist<String> pd = new DictionaryProbDist<>(Map.of("a", 1.0, "b", 3.0), false, true);
        assertEquals(0.25, pd.prob("a"), EPS);
        assertEquals(0.75, pd.prob("b"), EPS);
        assertEquals("b", pd.max());
        assertEquals(List.of("a", "b"), pd.samples());

        DictionaryProbDist<String> zeros = new DictionaryProbDist<>(Map.of("a", 0.0, "b", 0.0), false, true);
        assertEquals(0.5, zeros.prob("a"), EPS);
    }

    @Test
    void testDictionaryLogValues() {
        DictionaryProbDist<String> pd = new DictionaryProbDist<>(
                Map.of("a", 0.0, "b", LogMath.log2(3)), true, true);
        assertEquals(-2.0, pd.logprob("a"), 1e-9);
        assertEquals(0.25, pd.prob("a"), 1e-9);
        assertEquals(0.75, pd.prob("b"), 1e-9);
        assertEquals(LogMath.NINF, pd.logprob("c"));
    }

    @Test
    void testDictionaryConditionalProbDist() {
        DictionaryConditionalProbDist<String, String> cpd = new DictionaryConditionalProbDist<>(Map.<String, ProbDist<String>>of(
                "the", new MLEProbDist<>(cfd().getOrCreate("the")),
                "a", new UniformProbDist<>(List.of("cat", "dog"))));

        assertEquals(List.of("a", "the"), cpd.conditions());
        assertEquals(2, cpd.size());
        assertEquals(2.0 / 3, cpd.get("the").prob("cat"), EPS);
        assertEquals(0.5, cpd.get("a").prob("dog"), EPS);

        // no factory to fall back on
        assertFalse(cpd.contains("an"));
        assertThrows(NoSuchElementException.class, () -> cpd.get("an"));
        assertEquals(2, cpd.size());
    }
}
