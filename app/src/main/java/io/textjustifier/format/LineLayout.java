package io.textjustifier.format;

/**
 * How the words of a line are spaced out.
 */
public enum LineLayout {
    /** Single spaces between words, no padding. */
    RAGGED,
    /** Lines other than the last padded to the full width. */
    FULL;

    public static LineLayout from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RAGGED;
        }
        for (LineLayout layout : values()) {
            if (layout.name().equalsIgnoreCase(raw.trim())) {
                return layout;
            }
        }
        throw new IllegalArgumentException("Unsupported line layout: " + raw);
    }
}
