/**
 * CountingVocabulary.java
 * Language Model Toolkit
 *
 * Description: Vocabulary built by counting words. A word becomes part of the
 * vocabulary once it has been seen at least {@code unkCutoff} times; rarer
 * words are looked up as the unknown-word label, which is always a member.
 */

package org.utd.cs.langmodel;

import org.utd.cs.langmodel.probability.ConfigurationException;
import org.utd.cs.langmodel.probability.FreqDist;

import java.util.*;

public class CountingVocabulary implements Vocabulary {

    public static final String DEFAULT_UNK_LABEL = "<UNK>";

    private final FreqDist<String> counts = new FreqDist<>();
    private final int unkCutoff;
    private final String unkLabel;

    // rebuilt lazily after each update
    private List<String> words;

    public CountingVocabulary() {
        this(1, DEFAULT_UNK_LABEL);
    }

    public CountingVocabulary(int unkCutoff, String unkLabel) {
        if (unkCutoff < 1) {
            throw new ConfigurationException("Cutoff value cannot be less than 1. Got: " + unkCutoff);
        }
        this.unkCutoff = unkCutoff;
        this.unkLabel = Objects.requireNonNull(unkLabel, "unkLabel");
    }

    public CountingVocabulary(Iterable<String> words, int unkCutoff, String unkLabel) {
        this(unkCutoff, unkLabel);
        update(words);
    }

    @Override
    public void update(Iterable<String> words) {
        counts.update(words);
        this.words = null;
    }

    @Override
    public boolean contains(String word) {
        if (unkLabel.equals(word)) return true;
        return counts.count(word) >= unkCutoff;
    }

    @Override
    public String lookup(String word) {
        return contains(word) ? word : unkLabel;
    }

    public List<String> lookup(List<String> words) {
        List<String> out = new ArrayList<>(words.size());
        for (String w : words) out.add(lookup(w));
        return out;
    }

    /** Known words by decreasing count, then the unknown-word label. Unmodifiable. */
    @Override
    public List<String> words() {
        if (words == null) {
            if (counts.isEmpty()) {
                words = Collections.emptyList();
            } else {
                List<String> out = new ArrayList<>();
                for (String w : counts.keys()) {
                    if (!w.equals(unkLabel) && contains(w)) out.add(w);
                }
                out.add(unkLabel);
                words = Collections.unmodifiableList(out);
            }
        }
        return words;
    }

    @Override
    public int size() {
        return words().size();
    }

    @Override
    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int count(String word) {
        return counts.count(word);
    }

    public int getUnkCutoff() {
        return unkCutoff;
    }

    @Override
    public String getUnkLabel() {
        return unkLabel;
    }

    @Override
    public String toString() {
        return "<Vocabulary with cutoff=" + unkCutoff + " unk_label='" + unkLabel + "' and " + size() + " items>";
    }
}
