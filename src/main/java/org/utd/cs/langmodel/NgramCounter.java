/**
 * NgramCounter.java
 * Language Model Toolkit
 *
 * Description: Counts n-grams of every order seen in a text.
 *
 * Unigrams go into a single FreqDist. Higher orders are kept as one
 * ConditionalFreqDist per order, keyed by the n-gram's context, with the
 * n-gram's last token as the counted outcome:
 *
 *      ("a", "b", "c")  ->  ngramsOfOrder(3).getOrCreate(("a", "b")).increment("c")
 */

package org.utd.cs.langmodel;

import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.utd.cs.langmodel.probability.ConditionalFreqDist;
import org.utd.cs.langmodel.probability.FreqDist;

import java.util.*;

public class NgramCounter {
    private static final Logger logger = LoggerFactory.getLogger(NgramCounter.class);

    private final FreqDist<String> unigrams = new FreqDist<>();
    private final Map<Integer, ConditionalFreqDist<Ngram, String>> byOrder = new TreeMap<>();

    public NgramCounter() {}

    public NgramCounter(Iterable<? extends Iterable<?>> text) {
        update(text);
    }

    /**
     * Counts every n-gram of every sentence. A sentence is an iterable of
     * n-grams, each either an {@link Ngram} or a list of string tokens.
     *
     * @throws TypeMismatchException if a sentence or n-gram is of the wrong
     *         type, or an n-gram is empty
     */
    public void update(Iterable<? extends Iterable<?>> text) {
        int sentences = 0;
        long counted = 0;
        for (Object sentence : text) {
            if (!(sentence instanceof Iterable) || sentence instanceof Ngram) {
                throw new TypeMismatchException("Expected a sentence of n-grams, got " + describe(sentence));
            }
            for (Object element : (Iterable<?>) sentence) {
                Ngram ngram = toNgram(element);
                if (ngram.size() == 1) {
                    unigrams.increment(ngram.word());
                } else {
                    ngramsOfOrder(ngram.size()).getOrCreate(ngram.context()).increment(ngram.word());
                }
                counted++;
            }
            sentences++;
        }
        logger.debug("Counted {} n-grams from {} sentences", counted, sentences);
    }

    /** Converts an {@link Ngram} or a list of string tokens; anything else is a type error. */
    static Ngram toNgram(Object element) {
        Ngram ngram;
        if (element instanceof Ngram) {
            ngram = (Ngram) element;
        } else if (element instanceof List) {
            List<String> tokens = new ArrayList<>();
            for (Object token : (List<?>) element) {
                if (!(token instanceof String)) {
                    throw new TypeMismatchException("N-gram tokens must be strings, got " + describe(token));
                }
                tokens.add((String) token);
            }
            ngram = Ngram.of(tokens);
        } else {
            throw new TypeMismatchException("Ngram text has to be made of n-grams, got " + describe(element));
        }
        if (ngram.isEmpty()) {
            throw new TypeMismatchException("Cannot count an empty n-gram");
        }
        return ngram;
    }

    private static String describe(Object o) {
        return (o == null) ? "null" : o.getClass().getSimpleName() + " " + o;
    }

    /** Order 1 counts. {@link #ngramsOfOrder(int)} only covers orders of 2 and up. */
    public FreqDist<String> unigrams() {
        return unigrams;
    }

    /**
     * The conditional distribution of n-grams of the given order, created
     * empty if that order was never counted. Unigrams have no context and are
     * read through {@link #unigrams()} or {@code lookup(Ngram.empty())}.
     *
     * @throws IllegalArgumentException if {@code order} is below 2
     */
    public ConditionalFreqDist<Ngram, String> ngramsOfOrder(int order) {
        if (order < 2) {
            throw new IllegalArgumentException("Order must be at least 2 for conditional counts, got " + order);
        }
        return byOrder.computeIfAbsent(order, k -> new ConditionalFreqDist<>());
    }

    /** Counts of words following the context; the empty context gives the unigrams. */
    public FreqDist<String> lookup(Ngram context) {
        if (context.isEmpty()) return unigrams;
        return ngramsOfOrder(context.size() + 1).getOrCreate(context);
    }

    public FreqDist<String> lookup(List<String> context) {
        return lookup(Ngram.of(context));
    }

    /** Total count over every order. */
    public long getN() {
        long n = unigrams.getN();
        for (ConditionalFreqDist<Ngram, String> cfd : byOrder.values()) n += cfd.total();
        return n;
    }

    /** Orders that have at least one count, ascending. */
    public List<Integer> orders() {
        List<Integer> out = new ArrayList<>();
        if (!unigrams.isEmpty()) out.add(1);
        for (Map.Entry<Integer, ConditionalFreqDist<Ngram, String>> e : byOrder.entrySet()) {
            if (e.getValue().total() > 0) out.add(e.getKey());
        }
        return out;
    }

    /**
     * For each order, how many cells have each count. A cell is a unigram, or
     * a (context, word) pair for higher orders.
     */
    public SortedMap<Integer, SortedMap<Integer, Integer>> frequencyOfFrequency() {
        SortedMap<Integer, SortedMap<Integer, Integer>> out = new TreeMap<>();

        SortedMap<Integer, Integer> uni = new TreeMap<>();
        for (Map.Entry<String, Integer> e : unigrams.items()) uni.merge(e.getValue(), 1, Integer::sum);
        if (!uni.isEmpty()) out.put(1, uni);

        for (Map.Entry<Integer, ConditionalFreqDist<Ngram, String>> e : byOrder.entrySet()) {
            SortedMap<Integer, Integer> hist = new TreeMap<>();
            for (FreqDist<String> fd : e.getValue().asMap().values()) {
                for (Map.Entry<String, Integer> item : fd.items()) hist.merge(item.getValue(), 1, Integer::sum);
            }
            if (!hist.isEmpty()) out.put(e.getKey(), hist);
        }
        return out;
    }

    /** Per-order summary: N and the number of distinct n-grams. */
    public JSONObject toJson() {
        JSONArray orders = new JSONArray();
        for (int order : orders()) {
            JSONObject o = new JSONObject();
            o.put("order", order);
            if (order == 1) {
                o.put("N", unigrams.getN());
                o.put("B", unigrams.getB());
            } else {
                ConditionalFreqDist<Ngram, String> cfd = byOrder.get(order);
                int b = 0;
                for (FreqDist<String> fd : cfd.asMap().values()) b += fd.getB();
                o.put("N", cfd.total());
                o.put("B", b);
                o.put("contexts", cfd.size());
            }
            orders.put(o);
        }

        JSONObject json = new JSONObject();
        json.put("N", getN());
        json.put("orders", orders);
        return json;
    }

    @Override
    public String toString() {
        return "<NgramCounter with " + orders().size() + " ngram orders and " + getN() + " ngrams>";
    }
}
