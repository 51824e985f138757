package io.textjustifier.format;

import io.textjustifier.justify.LineSpan;
import io.textjustifier.justify.Partition;
import io.textjustifier.justify.WordSequence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders the spans of a partition into output lines.
 */
public class LineFormatter {

    public List<String> format(WordSequence words, Partition partition, int width, LineLayout layout) {
        Objects.requireNonNull(words, "words");
        Objects.requireNonNull(partition, "partition");
        if (!partition.covers(words)) {
            throw new IllegalArgumentException("Partition covers " + partition.wordCount() + " of " + words.size() + " words");
        }
        LineLayout effective = layout == null ? LineLayout.RAGGED : layout;
        List<String> lines = new ArrayList<>(partition.lineCount());
        for (LineSpan span : partition.spans()) {
            boolean lastLine = span.end() == words.size();
            if (effective == LineLayout.FULL && !lastLine && span.fits(words, width)) {
                lines.add(pad(words, span, width));
            } else {
                lines.add(words.join(span.start(), span.end()));
            }
        }
        return lines;
    }

    private String pad(WordSequence words, LineSpan span, int width) {
        int slack = (int) span.slack(words, width);
        StringBuilder builder = new StringBuilder(width);
        builder.append(words.get(span.start()).text());
        int gaps = span.wordCount() - 1;
        if (gaps == 0) {
            builder.append(" ".repeat(slack));
            return builder.toString();
        }
        int perGap = slack / gaps;
        int remainder = slack % gaps;
        for (int i = 1; i <= gaps; i++) {
            int spaces = 1 + perGap + (i <= remainder ? 1 : 0);
            builder.append(" ".repeat(spaces));
            builder.append(words.get(span.start() + i).text());
        }
        return builder.toString();
    }
}
