package io.textjustifier.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("io.textjustifier.cli.CliApplication");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }

    @Test
    void formatsEventAsSingleJsonLine() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();

        String json = layout.doLayout(event(context, "Read 12 words"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"Read 12 words\"");
        assertThat(json).contains("\"logger\":\"io.textjustifier.cli.CliApplication\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"exception\"");
        assertThat(json).endsWith("}" + System.lineSeparator());
    }

    @Test
    void includesExceptionText() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = event(context, "Failed to justify text");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: boom");
    }

    @Test
    void escapesControlCharactersAndQuotes() {
        assertThat(SimpleJsonLayout.quote("a \"b\"\n\tc\u0001")).isEqualTo("\"a \\\"b\\\"\\n\\tc\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }
}
