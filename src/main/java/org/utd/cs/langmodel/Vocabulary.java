package org.utd.cs.langmodel;

import java.util.List;

/**
 * The set of words a language model knows about. Words outside it are mapped
 * to a single unknown-word label before counting or scoring.
 */
public interface Vocabulary {

    void update(Iterable<String> words);

    boolean contains(String word);

    /** The word itself if it is in the vocabulary, otherwise the unknown-word label. */
    String lookup(String word);

    default Ngram lookup(Ngram ngram) {
        String[] mapped = new String[ngram.size()];
        for (int i = 0; i < mapped.length; i++) mapped[i] = lookup(ngram.get(i));
        return Ngram.of(mapped);
    }

    List<String> words();

    default int size() {
        return words().size();
    }

    boolean isEmpty();

    String getUnkLabel();
}
