package io.textjustifier.justify;

/**
 * Squares the leftover characters of a line. The final line and forced overflow lines cost nothing.
 */
public final class SquaredSlackBadness implements BadnessFunction {

    public static final SquaredSlackBadness INSTANCE = new SquaredSlackBadness();

    private SquaredSlackBadness() {
    }

    @Override
    public long of(LineSpan span, WordSequence words, int width) {
        if (span.end() == words.size()) {
            return 0;
        }
        long slack = span.slack(words, width);
        if (slack < 0) {
            if (span.isOverflow(words, width)) {
                return 0;
            }
            throw new IllegalArgumentException("Span " + span + " does not fit width " + width);
        }
        return slack * slack;
    }
}
