package io.textjustifier.justify;

import java.util.List;
import java.util.Objects;

/**
 * Gapless cover of a word sequence by line spans, together with its total badness.
 */
public record Partition(List<LineSpan> spans, long totalBadness) {

    public Partition {
        spans = List.copyOf(Objects.requireNonNull(spans, "spans"));
        if (totalBadness < 0) {
            throw new IllegalArgumentException("totalBadness must not be negative");
        }
        int expectedStart = 0;
        for (LineSpan span : spans) {
            if (span.start() != expectedStart) {
                throw new IllegalArgumentException("Spans must be contiguous: expected start " + expectedStart + " but got " + span);
            }
            expectedStart = span.end();
        }
    }

    public static Partition empty() {
        return new Partition(List.of(), 0);
    }

    public int lineCount() {
        return spans.size();
    }

    public int wordCount() {
        return spans.isEmpty() ? 0 : spans.get(spans.size() - 1).end();
    }

    public boolean covers(WordSequence words) {
        return wordCount() == words.size();
    }

    /**
     * Scores a list of spans with the given badness function.
     */
    public static Partition scored(List<LineSpan> spans, WordSequence words, int width, BadnessFunction badness) {
        long total = 0;
        for (LineSpan span : spans) {
            total += badness.of(span, words, width);
        }
        return new Partition(spans, total);
    }
}
