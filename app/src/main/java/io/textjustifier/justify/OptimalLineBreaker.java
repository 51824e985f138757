package io.textjustifier.justify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimizes total badness over every possible set of breaks with a dynamic program over suffixes.
 *
 * <p>{@code cost[k]} holds the cheapest way to lay out words {@code [k, n)} and {@code next[k]} the end
 * of the first line in that layout. Ties go to the longer first line.
 */
public class OptimalLineBreaker implements LineBreaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimalLineBreaker.class);

    private final BadnessFunction badness;

    public OptimalLineBreaker() {
        this(SquaredSlackBadness.INSTANCE);
    }

    public OptimalLineBreaker(BadnessFunction badness) {
        this.badness = Objects.requireNonNull(badness, "badness");
    }

    @Override
    public Partition partition(WordSequence words, int width) {
        Objects.requireNonNull(words, "words");
        InvalidWidthException.requireValid(width);
        int n = words.size();
        if (n == 0) {
            return Partition.empty();
        }

        long[] cost = new long[n + 1];
        int[] next = new int[n + 1];
        cost[n] = 0;
        next[n] = n;

        for (int k = n - 1; k >= 0; k--) {
            long best = Long.MAX_VALUE;
            int bestEnd = k + 1;
            for (int j = k + 1; j <= n; j++) {
                LineSpan candidate = new LineSpan(k, j);
                if (!candidate.fits(words, width) && !candidate.isOverflow(words, width)) {
                    // longer spans from k only get wider
                    break;
                }
                long total = badness.of(candidate, words, width) + cost[j];
                if (total <= best) {
                    best = total;
                    bestEnd = j;
                }
            }
            cost[k] = best;
            next[k] = bestEnd;
        }

        List<LineSpan> spans = new ArrayList<>();
        for (int k = 0; k < n; k = next[k]) {
            spans.add(new LineSpan(k, next[k]));
        }
        LOGGER.debug("Optimal layout of {} words at width {}: {} lines, badness {}", n, width, spans.size(), cost[0]);
        return new Partition(spans, cost[0]);
    }
}
