package org.utd.cs.langmodel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NgramPreprocessingTest {

    private final NgramPreprocessing prep = new NgramPreprocessing();

    @Test
    void testPadBothEnds() {
        assertEquals(List.of("<s>", "<s>", "a", "b", "</s>", "</s>"), prep.padBothEnds(List.of("a", "b"), 3));
        assertEquals(List.of("a", "b"), prep.padBothEnds(List.of("a", "b"), 1));

        NgramPreprocessing custom = new NgramPreprocessing("BOS", "EOS");
        assertEquals(List.of("BOS", "a", "EOS"), custom.padBothEnds(List.of("a"), 2));
    }

    @Test
    void testNgramsAndEverygrams() {
        List<String> tokens = List.of("a", "b", "c");

        assertEquals(List.of(Ngram.of("a", "b"), Ngram.of("b", "c")), NgramPreprocessing.ngrams(tokens, 2));
        assertTrue(NgramPreprocessing.ngrams(tokens, 4).isEmpty());
        assertEquals(List.of(Ngram.of("a"), Ngram.of("b"), Ngram.of("c"), Ngram.of("a", "b"), Ngram.of("b", "c")),
                NgramPreprocessing.everygrams(tokens, 2));
        assertEquals(6, NgramPreprocessing.everygrams(tokens, 5).size());
        assertThrows(IllegalArgumentException.class, () -> NgramPreprocessing.ngrams(tokens, 0));
    }

    @Test
    void testPipeline() {
        NgramPreprocessing.TrainingData data = prep.paddedEverygramPipeline(2, TrainingFixtures.TEXT);

        assertEquals(2, data.getNgrams().size());
        // 6 unigrams + 5 bigrams for "<s> a b c d </s>"
        assertEquals(11, data.getNgrams().get(0).size());
        assertEquals(14, data.getVocabularyText().size());
        assertEquals("<s>", data.getVocabularyText().get(0));
        assertEquals("</s>", data.getVocabularyText().get(13));
    }

    @Test
    void testConfiguredPadding() {
        java.util.Properties props = new java.util.Properties();
        props.setProperty("lm.pad.left", "[");
        props.setProperty("lm.pad.right", "]");
        NgramPreprocessing configured = new NgramPreprocessing(LanguageModelConfig.fromProperties(props));

        assertEquals(List.of("[", "x", "]"), configured.padBothEnds(List.of("x"), 2));
    }
}
