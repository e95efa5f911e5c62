package com.maildraft.domain.email.model;

import com.maildraft.domain.email.exception.InputRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DescriptionTest {

    @Test
    @DisplayName("content is trimmed")
    void trimmed() {
        assertThat(Description.of("  write to my manager  ").content()).isEqualTo("write to my manager");
    }

    @Test
    @DisplayName("bounds are inclusive: 10 and 500 characters are accepted")
    void inclusive_bounds() {
        assertThat(Description.of("a".repeat(10)).length()).isEqualTo(10);
        assertThat(Description.of("a".repeat(500)).length()).isEqualTo(500);
    }

    @Test
    @DisplayName("9 and 501 characters are rejected")
    void out_of_bounds() {
        assertThatThrownBy(() -> Description.of("a".repeat(9)))
                .isInstanceOf(InputRejectedException.class)
                .satisfies(e -> assertThat(((InputRejectedException) e).getReasonCode()).isEqualTo("DESCRIPTION_TOO_SHORT"));
        assertThatThrownBy(() -> Description.of("a".repeat(501)))
                .isInstanceOf(InputRejectedException.class)
                .satisfies(e -> assertThat(((InputRejectedException) e).getReasonCode()).isEqualTo("DESCRIPTION_TOO_LONG"));
    }

    @Test
    @DisplayName("null is rejected")
    void missing() {
        assertThatThrownBy(() -> Description.of(null))
                .isInstanceOf(InputRejectedException.class)
                .satisfies(e -> assertThat(((InputRejectedException) e).getKind()).isEqualTo(FailureKind.INPUT_REJECTED));
    }
}
