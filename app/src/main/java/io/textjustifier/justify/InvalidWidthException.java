package io.textjustifier.justify;

/**
 * Raised when the requested line width is not positive.
 */
public class InvalidWidthException extends JustificationException {

    private final int width;

    public InvalidWidthException(int width) {
        super("line width must be at least 1, got " + width);
        this.width = width;
    }

    public int width() {
        return width;
    }

    static int requireValid(int width) {
        if (width < 1) {
            throw new InvalidWidthException(width);
        }
        return width;
    }
}
