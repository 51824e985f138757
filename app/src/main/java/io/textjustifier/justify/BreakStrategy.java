package io.textjustifier.justify;

/**
 * Algorithm used to choose line breaks.
 */
public enum BreakStrategy {
    OPTIMAL,
    GREEDY;

    public static BreakStrategy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPTIMAL;
        }
        for (BreakStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(raw.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unsupported break strategy: " + raw);
    }
}
