package com.libragraph.atomizer.formats.atomizers.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceSegmenterTest {

    @Test
    void shouldNotBreakAfterAbbreviationsOrInitials() {
        String text = "Mr. J. R. Tolkien wrote e.g. books. The end.";

        assertThat(strip(text)).containsExactly("Mr. J. R. Tolkien wrote e.g. books.", "The end.");
    }

    @Test
    void shouldPartitionText() {
        String text = " A. B?  C!\n";

        List<SentenceSegmenter.Segment> segments = SentenceSegmenter.segment(text);

        assertThat(segments.get(0).start()).isZero();
        assertThat(segments.get(segments.size() - 1).end()).isEqualTo(text.length());
        for (int i = 1; i < segments.size(); i++) {
            assertThat(segments.get(i).start()).isEqualTo(segments.get(i - 1).end());
        }
    }

    @Test
    void shouldReturnNothingForEmptyText() {
        assertThat(SentenceSegmenter.segment("")).isEmpty();
    }

    private static List<String> strip(String text) {
        return SentenceSegmenter.segment(text).stream().map(s -> s.of(text).strip()).toList();
    }
}
