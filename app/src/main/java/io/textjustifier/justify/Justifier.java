package io.textjustifier.justify;

import io.textjustifier.format.LineFormatter;
import io.textjustifier.format.LineLayout;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breaks a sequence of words into lines no wider than a target width.
 *
 * <p>The default entry points use the optimal breaker and single-space layout. Instances hold no
 * per-call state and may be shared between threads.
 */
public class Justifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Justifier.class);

    private final LineBreakerFactory breakerFactory;
    private final LineFormatter formatter;

    public Justifier() {
        this(new LineBreakerFactory(), new LineFormatter());
    }

    public Justifier(LineBreakerFactory breakerFactory, LineFormatter formatter) {
        this.breakerFactory = Objects.requireNonNull(breakerFactory, "breakerFactory");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public List<String> justify(List<String> words, int width) {
        InvalidWidthException.requireValid(width);
        return justify(WordSequence.fromTokens(words), width);
    }

    public List<String> justify(WordSequence words, int width) {
        return run(words, width, BreakStrategy.OPTIMAL, LineLayout.RAGGED).lines();
    }

    public Partition partition(WordSequence words, int width) {
        InvalidWidthException.requireValid(width);
        return breakerFactory.select(BreakStrategy.OPTIMAL).partition(words, width);
    }

    /**
     * Lays out the words with the given strategy and renders them with the given layout.
     *
     * @throws InvalidWidthException if {@code width < 1}
     */
    public JustificationResult run(WordSequence words, int width, BreakStrategy strategy, LineLayout layout) {
        Objects.requireNonNull(words, "words");
        InvalidWidthException.requireValid(width);
        BreakStrategy effective = strategy == null ? BreakStrategy.OPTIMAL : strategy;
        Partition partition = breakerFactory.select(effective).partition(words, width);
        List<String> lines = formatter.format(words, partition, width, layout);
        LOGGER.debug("Justified {} words into {} lines ({} strategy, badness {})",
                words.size(), lines.size(), effective, partition.totalBadness());
        return new JustificationResult(lines, partition, effective);
    }
}
