package io.textjustifier.justify;

import java.util.List;
import java.util.Objects;

/**
 * Formatted lines together with the layout that produced them.
 */
public record JustificationResult(List<String> lines, Partition partition, BreakStrategy strategy) {

    public JustificationResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(partition, "partition");
        Objects.requireNonNull(strategy, "strategy");
        if (lines.size() != partition.lineCount()) {
            throw new IllegalArgumentException("Expected " + partition.lineCount() + " lines but got " + lines.size());
        }
    }

    public long totalBadness() {
        return partition.totalBadness();
    }
}
