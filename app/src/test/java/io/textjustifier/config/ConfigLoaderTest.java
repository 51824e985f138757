package io.textjustifier.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.textjustifier.cli.CliArguments;
import io.textjustifier.format.LineLayout;
import io.textjustifier.justify.BreakStrategy;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--strategy", "greedy",
                "--layout", "FULL",
                "--input", "in.txt",
                "--output", "out.txt",
                "--log-format", "json",
                "40");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.width()).isEqualTo(40);
        assertThat(config.strategy()).isEqualTo(BreakStrategy.GREEDY);
        assertThat(config.layout()).isEqualTo(LineLayout.FULL);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.input()).contains(Path.of("in.txt"));
        assertThat(config.output()).contains(Path.of("out.txt"));
    }

    @Test
    void appliesDefaultsWhenOnlyWidthGiven() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "12");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.width()).isEqualTo(12);
        assertThat(config.strategy()).isEqualTo(BreakStrategy.OPTIMAL);
        assertThat(config.layout()).isEqualTo(LineLayout.RAGGED);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.input()).isEmpty();
        assertThat(config.inputDescription()).isEqualTo("standard input");
        assertThat(config.outputDescription()).isEqualTo("standard output");
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_WIDTH, " 30 ",
                ConfigLoader.ENV_STRATEGY, "greedy",
                ConfigLoader.ENV_LAYOUT, "full",
                ConfigLoader.ENV_INPUT, "/tmp/in.txt",
                ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(key -> Optional.ofNullable(env.get(key))).load(cliArguments);

        assertThat(config.width()).isEqualTo(30);
        assertThat(config.strategy()).isEqualTo(BreakStrategy.GREEDY);
        assertThat(config.layout()).isEqualTo(LineLayout.FULL);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.input()).contains(Path.of("/tmp/in.txt"));
        assertThat(config.output()).isEmpty();
    }

    @Test
    void cliWidthWinsOverEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "8");

        Config config = new ConfigLoader(key -> key.equals(ConfigLoader.ENV_WIDTH) ? Optional.of("99") : Optional.empty())
                .load(cliArguments);

        assertThat(config.width()).isEqualTo(8);
    }

    @Test
    void missingWidthThrows() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ConfigLoader.ENV_WIDTH);
    }

    @Test
    void nonPositiveWidthIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void nonNumericEnvironmentWidthIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> key.equals(ConfigLoader.ENV_WIDTH) ? Optional.of("wide") : Optional.empty())
                .load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected integer");
    }
}
