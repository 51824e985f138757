package io.textjustifier.config;

import io.textjustifier.format.LineLayout;
import io.textjustifier.justify.BreakStrategy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * <p>An empty {@code input} means standard input, an empty {@code output} standard output.
 */
public record Config(
        int width,
        BreakStrategy strategy,
        LineLayout layout,
        LogFormat logFormat,
        Optional<Path> input,
        Optional<Path> output
) {

    public Config {
        if (width < 1) {
            throw new IllegalArgumentException("line width must be a positive integer, got " + width);
        }
        strategy = Objects.requireNonNull(strategy, "strategy");
        layout = Objects.requireNonNull(layout, "layout");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
    }

    public String inputDescription() {
        return input.map(Path::toString).orElse("standard input");
    }

    public String outputDescription() {
        return output.map(Path::toString).orElse("standard output");
    }
}
