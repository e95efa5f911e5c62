package com.maildraft.infrastructure.ai.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input pass through")
    void null_and_empty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("invisible characters are removed")
    void invisible_chars() {
        assertThat(normalizer.normalize("write\u200B to\uFEFF HR")).isEqualTo("write to HR");
    }

    @Test
    @DisplayName("control characters are removed")
    void control_chars() {
        assertThat(normalizer.normalize("ask\u0001 my\u0007 manager")).isEqualTo("ask my manager");
    }

    @Test
    @DisplayName("CRLF and CR become LF")
    void line_endings() {
        assertThat(normalizer.normalize("first\r\nsecond\rthird")).isEqualTo("first\nsecond\nthird");
    }

    @Test
    @DisplayName("tabs and repeated spaces collapse to one space")
    void horizontal_whitespace() {
        assertThat(normalizer.normalize("ask   the\t\tdean  about fees")).isEqualTo("ask the dean about fees");
    }

    @Test
    @DisplayName("more than one blank line is reduced")
    void excessive_newlines() {
        assertThat(normalizer.normalize("first\n\n\n\n\nsecond")).isEqualTo("first\n\nsecond");
    }

    @Test
    @DisplayName("leading and trailing whitespace is stripped")
    void strip() {
        assertThat(normalizer.normalize("   write to my teacher \n ")).isEqualTo("write to my teacher");
    }

    @Test
    @DisplayName("decomposed characters are composed (NFC)")
    void nfc() {
        assertThat(normalizer.normalize("cafe\u0301")).isEqualTo("caf\u00E9");
    }
}
