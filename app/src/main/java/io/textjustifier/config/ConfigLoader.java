package io.textjustifier.config;

import io.textjustifier.cli.CliArguments;
import io.textjustifier.format.LineLayout;
import io.textjustifier.justify.BreakStrategy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_WIDTH = "JUSTIFY_WIDTH";
    static final String ENV_STRATEGY = "JUSTIFY_STRATEGY";
    static final String ENV_LAYOUT = "JUSTIFY_LAYOUT";
    static final String ENV_INPUT = "JUSTIFY_INPUT";
    static final String ENV_OUTPUT = "JUSTIFY_OUTPUT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int width = resolveWidth(arguments);
        BreakStrategy strategy = Optional.ofNullable(arguments.strategy())
                .or(() -> environmentReader.getNonBlank(ENV_STRATEGY).map(BreakStrategy::from))
                .orElse(BreakStrategy.OPTIMAL);
        LineLayout layout = Optional.ofNullable(arguments.layout())
                .or(() -> environmentReader.getNonBlank(ENV_LAYOUT).map(LineLayout::from))
                .orElse(LineLayout.RAGGED);
        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.getNonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);
        Optional<Path> input = resolvePath(arguments.input(), ENV_INPUT);
        Optional<Path> output = resolvePath(arguments.output(), ENV_OUTPUT);

        return new Config(width, strategy, layout, logFormat, input, output);
    }

    private int resolveWidth(CliArguments arguments) {
        Integer cliWidth = arguments.width();
        if (cliWidth != null) {
            return requirePositive(cliWidth, "line width");
        }
        String raw = environmentReader.getNonBlank(ENV_WIDTH)
                .orElseThrow(() -> new IllegalStateException(
                        "line width must be provided as an argument or via " + ENV_WIDTH));
        return requirePositive(parseInteger(raw, ENV_WIDTH), ENV_WIDTH);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.getNonBlank(envKey).map(Path::of);
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid " + name + " format, expected integer, got " + raw, ex);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be a positive integer, got " + value);
        }
        return value;
    }
}
