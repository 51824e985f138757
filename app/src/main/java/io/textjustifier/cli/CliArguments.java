package io.textjustifier.cli;

import io.textjustifier.config.LogFormat;
import io.textjustifier.format.LineLayout;
import io.textjustifier.justify.BreakStrategy;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "text-justifier", mixinStandardHelpOptions = true, version = "text-justifier 1.0.0",
        description = "Reformats text read from standard input (or a file) into lines of at most WIDTH characters, "
                + "choosing line breaks that minimize the squared leftover space.")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "WIDTH",
            description = "Maximum line length in characters (falls back to JUSTIFY_WIDTH)")
    private Integer width;

    @CommandLine.Option(names = "--strategy", converter = BreakStrategyConverter.class,
            description = "Line breaking strategy: optimal or greedy", paramLabel = "STRATEGY")
    private BreakStrategy strategy;

    @CommandLine.Option(names = "--layout", converter = LineLayoutConverter.class,
            description = "Line layout: ragged (single spaces) or full (padded to WIDTH)", paramLabel = "LAYOUT")
    private LineLayout layout;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Read text from FILE instead of standard input", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write lines to FILE instead of standard output", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Integer width() {
        return width;
    }

    public BreakStrategy strategy() {
        return strategy;
    }

    public LineLayout layout() {
        return layout;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
