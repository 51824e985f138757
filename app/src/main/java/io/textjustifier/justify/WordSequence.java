package io.textjustifier.justify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered list of words with constant-time measurement of contiguous runs.
 */
public final class WordSequence {

    private static final WordSequence EMPTY = new WordSequence(List.of());

    private final List<Word> words;
    private final long[] prefixLengths;

    private WordSequence(List<Word> words) {
        this.words = words;
        this.prefixLengths = new long[words.size() + 1];
        for (int i = 0; i < words.size(); i++) {
            prefixLengths[i + 1] = prefixLengths[i] + words.get(i).length();
        }
    }

    public static WordSequence empty() {
        return EMPTY;
    }

    public static WordSequence of(String... tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return fromTokens(Arrays.asList(tokens));
    }

    public static WordSequence fromTokens(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            return EMPTY;
        }
        List<Word> words = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            words.add(new Word(token));
        }
        return new WordSequence(Collections.unmodifiableList(words));
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public Word get(int index) {
        return words.get(index);
    }

    public List<Word> words() {
        return words;
    }

    /**
     * Characters needed to print words {@code [start, end)} separated by single spaces.
     */
    public long rawLength(int start, int end) {
        Objects.checkFromToIndex(start, end, words.size());
        if (start == end) {
            return 0;
        }
        return prefixLengths[end] - prefixLengths[start] + (end - start - 1);
    }

    public String join(int start, int end) {
        Objects.checkFromToIndex(start, end, words.size());
        StringBuilder builder = new StringBuilder((int) Math.min(Integer.MAX_VALUE, rawLength(start, end)));
        for (int i = start; i < end; i++) {
            if (i > start) {
                builder.append(' ');
            }
            builder.append(words.get(i).text());
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WordSequence that)) {
            return false;
        }
        return words.equals(that.words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
