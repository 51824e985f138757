package io.textjustifier.justify;

import java.util.Objects;

/**
 * A single non-empty token of text that never contains whitespace.
 */
public record Word(String text) {

    public Word {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("word must not be empty");
        }
        if (text.codePoints().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("word must not contain whitespace: '" + text + "'");
        }
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return text;
    }
}
