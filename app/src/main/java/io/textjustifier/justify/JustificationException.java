package io.textjustifier.justify;

/**
 * Runtime exception used to propagate justification failures.
 */
public class JustificationException extends RuntimeException {

    public JustificationException(String message) {
        super(message);
    }
}
