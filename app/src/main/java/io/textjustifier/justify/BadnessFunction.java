package io.textjustifier.justify;

/**
 * Penalty assigned to placing a span on one line.
 */
@FunctionalInterface
public interface BadnessFunction {

    /**
     * @param span  candidate line
     * @param words the whole text; {@code span.end() == words.size()} marks the final line
     * @param width target line width
     * @return non-negative penalty
     */
    long of(LineSpan span, WordSequence words, int width);
}
