package io.textjustifier.cli;

import io.textjustifier.config.Config;
import io.textjustifier.config.ConfigLoader;
import io.textjustifier.config.EnvironmentReader;
import io.textjustifier.io.LineWriter;
import io.textjustifier.io.WordReader;
import io.textjustifier.justify.JustificationException;
import io.textjustifier.justify.JustificationResult;
import io.textjustifier.justify.Justifier;
import io.textjustifier.justify.WordSequence;
import io.textjustifier.logging.LoggingConfigurator;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and justifier.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Justifier justifier;
    private final WordReader wordReader;
    private final LineWriter lineWriter;
    private final InputStream standardInput;
    private final OutputStream standardOutput;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new Justifier(), new WordReader(), new LineWriter(),
                System.in, System.out);
    }

    CliApplication(ConfigLoader configLoader, Justifier justifier, WordReader wordReader, LineWriter lineWriter,
                   InputStream standardInput, OutputStream standardOutput) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.justifier = Objects.requireNonNull(justifier, "justifier");
        this.wordReader = Objects.requireNonNull(wordReader, "wordReader");
        this.lineWriter = Objects.requireNonNull(lineWriter, "lineWriter");
        this.standardInput = Objects.requireNonNull(standardInput, "standardInput");
        this.standardOutput = Objects.requireNonNull(standardOutput, "standardOutput");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("{}", ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        try {
            LOGGER.info("Reading text from {} ...", config.inputDescription());
            WordSequence words = config.input()
                    .map(wordReader::read)
                    .orElseGet(() -> wordReader.read(standardInput));
            LOGGER.info("Read {} words", words.size());

            JustificationResult result = justifier.run(words, config.width(), config.strategy(), config.layout());
            LOGGER.info("Justified {} words into {} lines with {} strategy (total badness {})",
                    words.size(), result.lines().size(), result.strategy(), result.totalBadness());

            if (config.output().isPresent()) {
                lineWriter.write(config.output().get(), result.lines());
            } else {
                lineWriter.write(standardOutput, result.lines());
            }
            LOGGER.info("Text justified successfully, written to {}", config.outputDescription());
            return 0;
        } catch (JustificationException | UncheckedIOException | IllegalArgumentException ex) {
            LOGGER.error("Failed to justify text: {}", ex.getMessage(), ex);
            return 1;
        }
    }
}
