package io.textjustifier.justify;

/**
 * Contiguous run of words {@code [start, end)} placed on one output line.
 */
public record LineSpan(int start, int end) {

    public LineSpan {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid line span [" + start + ", " + end + ")");
        }
    }

    public int wordCount() {
        return end - start;
    }

    public long rawLength(WordSequence words) {
        return words.rawLength(start, end);
    }

    public long slack(WordSequence words, int width) {
        return width - rawLength(words);
    }

    public boolean fits(WordSequence words, int width) {
        return slack(words, width) >= 0;
    }

    /**
     * A single word that is longer than the line width on its own.
     */
    public boolean isOverflow(WordSequence words, int width) {
        return wordCount() == 1 && !fits(words, width);
    }
}
