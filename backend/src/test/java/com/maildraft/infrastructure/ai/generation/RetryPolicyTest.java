package com.maildraft.infrastructure.ai.generation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("backoff is base * 2^n")
    void backoff() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(500));

        assertThat(policy.backoff(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.totalBackoff()).isEqualTo(Duration.ofMillis(3500));
    }

    @Test
    @DisplayName("negative settings are rejected")
    void invalid() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
