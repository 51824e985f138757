package io.textjustifier.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes justified lines, one per output line.
 */
public class LineWriter {

    public void write(Path target, List<String> lines) {
        if (target == null || lines == null) {
            throw new IllegalArgumentException("target and lines must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write justified text: " + target, ex);
        }
    }

    /**
     * Writes to the stream and flushes it. The stream stays open.
     */
    public void write(OutputStream output, List<String> lines) {
        if (output == null || lines == null) {
            throw new IllegalArgumentException("output and lines must be provided");
        }
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        try {
            write(writer, lines);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write justified text to standard output", ex);
        }
    }

    private void write(Writer writer, List<String> lines) throws IOException {
        for (String line : lines) {
            writer.write(line);
            writer.write(System.lineSeparator());
        }
        writer.flush();
    }
}
