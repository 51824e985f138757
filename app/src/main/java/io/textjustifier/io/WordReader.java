package io.textjustifier.io;

import io.textjustifier.justify.WordSequence;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads free text and splits it into words on runs of whitespace.
 *
 * <p>Whitespace is whatever {@link Character#isWhitespace(int)} accepts, the same rule
 * {@link io.textjustifier.justify.Word} enforces, so every token read is a valid word.
 */
public class WordReader {

    public WordSequence read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return WordSequence.fromTokens(tokenize(reader));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read text from " + path, ex);
        }
    }

    /**
     * Reads the stream to its end without closing it.
     */
    public WordSequence read(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("input must be provided");
        }
        try {
            return WordSequence.fromTokens(tokenize(new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read text from standard input", ex);
        }
    }

    public WordSequence read(Reader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader must be provided");
        }
        try {
            BufferedReader buffered = reader instanceof BufferedReader existing ? existing : new BufferedReader(reader);
            return WordSequence.fromTokens(tokenize(buffered));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read text", ex);
        }
    }

    static List<String> split(String line) {
        List<String> tokens = new ArrayList<>();
        int start = -1;
        int index = 0;
        while (index < line.length()) {
            int codePoint = line.codePointAt(index);
            if (Character.isWhitespace(codePoint)) {
                if (start >= 0) {
                    tokens.add(line.substring(start, index));
                    start = -1;
                }
            } else if (start < 0) {
                start = index;
            }
            index += Character.charCount(codePoint);
        }
        if (start >= 0) {
            tokens.add(line.substring(start));
        }
        return tokens;
    }

    private List<String> tokenize(BufferedReader reader) throws IOException {
        List<String> tokens = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            tokens.addAll(split(line));
        }
        return tokens;
    }
}
