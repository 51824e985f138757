package io.textjustifier.justify;

import java.util.Objects;

/**
 * Selects the line breaker for the requested strategy.
 */
public class LineBreakerFactory {

    private final LineBreaker optimal;
    private final LineBreaker greedy;

    public LineBreakerFactory() {
        this(new OptimalLineBreaker(), new GreedyLineBreaker());
    }

    public LineBreakerFactory(LineBreaker optimal, LineBreaker greedy) {
        this.optimal = Objects.requireNonNull(optimal, "optimal");
        this.greedy = Objects.requireNonNull(greedy, "greedy");
    }

    public LineBreaker select(BreakStrategy strategy) {
        if (strategy == null) {
            return optimal;
        }
        return switch (strategy) {
            case OPTIMAL -> optimal;
            case GREEDY -> greedy;
        };
    }
}
