package org.utd.cs.langmodel;

import java.util.*;

/**
 * An immutable sequence of tokens. The last token is the n-gram's word and
 * everything before it is its context.
 *
 * Ordering is lexicographic by token, with a shorter n-gram sorting first when
 * it is a prefix of the other.
 */
public final class Ngram implements Comparable<Ngram>, Iterable<String> {

    private static final Ngram EMPTY = new Ngram(Collections.emptyList());

    private final List<String> tokens;

    private Ngram(List<String> tokens) {
        this.tokens = tokens;
    }

    public static Ngram empty() {
        return EMPTY;
    }

    public static Ngram of(String... tokens) {
        return of(Arrays.asList(tokens));
    }

    public static Ngram of(List<String> tokens) {
        if (tokens.isEmpty()) return EMPTY;
        for (String t : tokens) Objects.requireNonNull(t, "token");
        return new Ngram(List.copyOf(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public String get(int i) {
        return tokens.get(i);
    }

    /** The last token. */
    public String word() {
        if (tokens.isEmpty()) throw new NoSuchElementException("Empty n-gram has no word");
        return tokens.get(tokens.size() - 1);
    }

    /** Everything but the last token. */
    public Ngram context() {
        if (tokens.isEmpty()) return EMPTY;
        return new Ngram(tokens.subList(0, tokens.size() - 1));
    }

    /** Everything but the first token. */
    public Ngram tail() {
        if (tokens.isEmpty()) return EMPTY;
        return new Ngram(tokens.subList(1, tokens.size()));
    }

    /** The last {@code n} tokens, or the whole n-gram if it is shorter. */
    public Ngram suffix(int n) {
        if (n <= 0) return EMPTY;
        if (n >= tokens.size()) return this;
        return new Ngram(tokens.subList(tokens.size() - n, tokens.size()));
    }

    public Ngram append(String token) {
        List<String> out = new ArrayList<>(tokens.size() + 1);
        out.addAll(tokens);
        out.add(Objects.requireNonNull(token, "token"));
        return new Ngram(Collections.unmodifiableList(out));
    }

    public List<String> asList() {
        return tokens;
    }

    @Override
    public Iterator<String> iterator() {
        return tokens.iterator();
    }

    @Override
    public int compareTo(Ngram other) {
        int n = Math.min(tokens.size(), other.tokens.size());
        for (int i = 0; i < n; i++) {
            int c = tokens.get(i).compareTo(other.tokens.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(tokens.size(), other.tokens.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ngram)) return false;
        return tokens.equals(((Ngram) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", tokens) + ")";
    }
}
