package io.textjustifier.justify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class WordSequenceTest {

    @Test
    void measuresRunsIncludingSeparatingSpaces() {
        WordSequence words = WordSequence.of("Hello!", "Nice", "to");

        assertThat(words.rawLength(0, 1)).isEqualTo(6);
        assertThat(words.rawLength(0, 2)).isEqualTo(11);
        assertThat(words.rawLength(0, 3)).isEqualTo(14);
        assertThat(words.rawLength(1, 1)).isZero();
        assertThat(words.join(0, 2)).isEqualTo("Hello! Nice");
    }

    @Test
    void rejectsBlankOrWhitespaceTokens() {
        assertThatThrownBy(() -> WordSequence.fromTokens(List.of("ok", "")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WordSequence.of("two words"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("whitespace");
    }

    @Test
    void spanReportsSlackAndOverflow() {
        WordSequence words = WordSequence.of("abcdefg", "hi");

        assertThat(new LineSpan(1, 2).slack(words, 5)).isEqualTo(3);
        assertThat(new LineSpan(0, 1).isOverflow(words, 5)).isTrue();
        assertThat(new LineSpan(0, 2).isOverflow(words, 5)).isFalse();
    }

    @Test
    void partitionRequiresContiguousSpans() {
        assertThatThrownBy(() -> new Partition(List.of(new LineSpan(0, 1), new LineSpan(2, 3)), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contiguous");
    }

    @Test
    void badnessSquaresSlackExceptOnFinalLine() {
        WordSequence words = WordSequence.of("ab", "cd", "ef");
        BadnessFunction badness = SquaredSlackBadness.INSTANCE;

        assertThat(badness.of(new LineSpan(0, 1), words, 6)).isEqualTo(16);
        assertThat(badness.of(new LineSpan(0, 2), words, 6)).isEqualTo(1);
        assertThat(badness.of(new LineSpan(2, 3), words, 6)).isZero();
        assertThatThrownBy(() -> badness.of(new LineSpan(0, 2), words, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
