package io.textjustifier.justify;

/**
 * Chooses where lines end.
 */
public interface LineBreaker {

    Partition partition(WordSequence words, int width);
}
