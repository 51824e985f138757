package io.textjustifier.justify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-fit filling: each line takes as many words as fit before moving on.
 */
public class GreedyLineBreaker implements LineBreaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreedyLineBreaker.class);

    private final BadnessFunction badness;

    public GreedyLineBreaker() {
        this(SquaredSlackBadness.INSTANCE);
    }

    public GreedyLineBreaker(BadnessFunction badness) {
        this.badness = Objects.requireNonNull(badness, "badness");
    }

    @Override
    public Partition partition(WordSequence words, int width) {
        Objects.requireNonNull(words, "words");
        InvalidWidthException.requireValid(width);
        List<LineSpan> spans = new ArrayList<>();
        int start = 0;
        while (start < words.size()) {
            int end = start + 1;
            while (end < words.size() && words.rawLength(start, end + 1) <= width) {
                end++;
            }
            spans.add(new LineSpan(start, end));
            start = end;
        }
        Partition partition = Partition.scored(spans, words, width, badness);
        LOGGER.debug("Greedy layout of {} words at width {}: {} lines, badness {}",
                words.size(), width, partition.lineCount(), partition.totalBadness());
        return partition;
    }
}
