/**
 * LanguageModel.java
 * Language Model Toolkit
 *
 * Description: Base class for n-gram language models.
 *
 * A model owns a vocabulary and an n-gram counter. Fitting maps every token
 * through the vocabulary (unknown words become the unknown-word label) and
 * counts the result. Scoring does the same lookup on the word and its context
 * and then asks the subclass for the probability of the word given the
 * context; everything else (log scores, entropy, perplexity, generation) is
 * built on that single method.
 */

package org.utd.cs.langmodel;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.utd.cs.langmodel.probability.ConfigurationException;
import org.utd.cs.langmodel.probability.FreqDist;
import org.utd.cs.langmodel.probability.LogMath;

import java.util.*;

public abstract class LanguageModel {
    private static final Logger logger = LoggerFactory.getLogger(LanguageModel.class);

    protected final int order;
    protected final Vocabulary vocabulary;
    protected final NgramCounter counts;
    private Random random = new Random();

    protected LanguageModel(int order) {
        this(order, new CountingVocabulary(), new NgramCounter());
    }

    protected LanguageModel(int order, Vocabulary vocabulary) {
        this(order, vocabulary, new NgramCounter());
    }

    protected LanguageModel(int order, Vocabulary vocabulary, NgramCounter counts) {
        if (order < 1) {
            throw new ConfigurationException("Model order must be at least 1, got " + order);
        }
        this.order = order;
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.counts = Objects.requireNonNull(counts, "counts");
    }

    // ---------- training ----------

    /** Trains on text whose vocabulary has already been built. */
    public void fit(Iterable<? extends Iterable<?>> text) {
        fit(text, null);
    }

    /**
     * Trains on the given sentences of n-grams. If the vocabulary is still
     * empty it is first built from {@code vocabularyText}.
     *
     * @throws ConfigurationException if the vocabulary is empty and no
     *         vocabulary text was given
     */
    public void fit(Iterable<? extends Iterable<?>> text, Iterable<String> vocabularyText) {
        if (vocabulary.isEmpty()) {
            if (vocabularyText == null) {
                throw new ConfigurationException("Cannot fit without a vocabulary or text to create it from.");
            }
            vocabulary.update(vocabularyText);
        }

        List<List<Ngram>> mapped = new ArrayList<>();
        for (Iterable<?> sentence : text) {
            if (sentence instanceof Ngram) {
                throw new TypeMismatchException("Expected a sentence of n-grams, got Ngram " + sentence);
            }
            List<Ngram> out = new ArrayList<>();
            for (Object element : sentence) out.add(vocabulary.lookup(NgramCounter.toNgram(element)));
            mapped.add(out);
        }
        counts.update(mapped);

        logger.info("Fitted {} (order {}) on {} sentences: vocabulary size {}, {} ngrams counted",
                getName(), order, mapped.size(), vocabulary.size(), counts.getN());
    }

    // ---------- scoring ----------

    public double score(String word) {
        return score(word, Ngram.empty());
    }

    public double score(String word, List<String> context) {
        return score(word, Ngram.of(context));
    }

    /**
     * Probability of the word given the context. Both are mapped through the
     * vocabulary first; contexts longer than order - 1 keep their last
     * order - 1 tokens.
     */
    public double score(String word, Ngram context) {
        Ngram ctx = vocabulary.lookup(context.suffix(order - 1));
        return unmaskedScore(vocabulary.lookup(word), ctx);
    }

    /** Score for a word and context that are already vocabulary-mapped. */
    protected abstract double unmaskedScore(String word, Ngram context);

    public double logscore(String word) {
        return logscore(word, Ngram.empty());
    }

    public double logscore(String word, List<String> context) {
        return logscore(word, Ngram.of(context));
    }

    /** Base-2 log of {@link #score}; negative infinity for a zero score. */
    public double logscore(String word, Ngram context) {
        return LogMath.log2(score(word, context));
    }

    /** Counts of words seen after the context; the empty context gives the unigrams. */
    public FreqDist<String> contextCounts(Ngram context) {
        if (context.isEmpty()) return counts.unigrams();
        return counts.lookup(context);
    }

    /** Average negative log score over the n-grams, in bits. */
    public double entropy(Collection<Ngram> textNgrams) {
        if (textNgrams.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute entropy of an empty text");
        }
        double sum = 0.0;
        for (Ngram ng : textNgrams) sum += logscore(ng.word(), ng.context());
        return -sum / textNgrams.size();
    }

    public double perplexity(Collection<Ngram> textNgrams) {
        return Math.pow(2.0, entropy(textNgrams));
    }

    // ---------- generation ----------

    public List<String> generate(int numWords) {
        return generate(numWords, Collections.emptyList(), random);
    }

    public List<String> generate(int numWords, List<String> textSeed) {
        return generate(numWords, textSeed, random);
    }

    /**
     * Generates words one at a time, each conditioned on the seed plus the
     * words generated so far. The seed is not part of the result.
     */
    public List<String> generate(int numWords, List<String> textSeed, Random random) {
        if (numWords < 1) {
            throw new IllegalArgumentException("Number of words to generate must be at least 1, got " + numWords);
        }
        List<String> history = new ArrayList<>(textSeed);
        List<String> generated = new ArrayList<>(numWords);
        for (int i = 0; i < numWords; i++) {
            String next = generateOne(history, random);
            generated.add(next);
            history.add(next);
        }
        return generated;
    }

    /**
     * Draws one word after the seed. The context is the last order - 1 tokens
     * of the seed; while nothing was ever seen after it, its leftmost token is
     * dropped.
     */
    public String generateOne(List<String> textSeed, Random random) {
        if (counts.getN() == 0) {
            throw new IllegalStateException("Cannot generate from a model that has not been fitted");
        }

        int size = Math.min(order - 1, textSeed.size());
        Ngram context = Ngram.of(textSeed.subList(textSeed.size() - size, textSeed.size()));
        FreqDist<String> samples = contextCounts(vocabulary.lookup(context));
        while (!context.isEmpty() && samples.isEmpty()) {
            context = context.tail();
            samples = contextCounts(vocabulary.lookup(context));
        }
        if (samples.isEmpty()) {
            throw new IllegalStateException("No continuation was counted for any suffix of the seed, even the empty one");
        }

        List<String> population = new ArrayList<>(samples.keys());
        Collections.sort(population);
        double[] weights = new double[population.size()];
        for (int i = 0; i < weights.length; i++) weights[i] = score(population.get(i), context);
        return weightedChoice(population, weights, random);
    }

    private static String weightedChoice(List<String> population, double[] weights, Random random) {
        if (population.isEmpty()) {
            throw new IllegalStateException("Cannot choose from an empty population");
        }
        double total = 0.0;
        for (double w : weights) total += w;

        if (total <= 0) {
            logger.warn("All {} candidate words scored 0; choosing uniformly", population.size());
            return population.get(random.nextInt(population.size()));
        }

        double threshold = total * random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (threshold < cumulative) return population.get(i);
        }

        return population.get(population.size() - 1);
    }

    // ---------- accessors ----------

    public int getOrder() {
        return order;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public NgramCounter getCounts() {
        return counts;
    }

    public void setRandom(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String getName() {
        return getClass().getSimpleName();
    }

    /** Model parameters for {@link #describe()}; none by default. */
    protected JSONObject parameters() {
        return new JSONObject();
    }

    /** Summary of the model: name, order, vocabulary, parameters and counts. */
    public JSONObject describe() {
        JSONObject json = new JSONObject();
        json.put("model", getName());
        json.put("order", order);
        json.put("vocabularySize", vocabulary.size());
        json.put("unkLabel", vocabulary.getUnkLabel());
        json.put("parameters", parameters());
        json.put("counts", counts.toJson());
        return json;
    }

    @Override
    public String toString() {
        return "<" + getName() + " order=" + order + ", " + counts + ">";
    }
}
