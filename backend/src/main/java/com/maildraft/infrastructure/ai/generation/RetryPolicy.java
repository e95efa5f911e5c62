package com.maildraft.infrastructure.ai.generation;

import java.time.Duration;

/**
 * Retry budget of the generation client.
 *
 * @param maxRetries retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param baseDelay  backoff before retry {@code n} (0-based) is {@code baseDelay * 2^n}
 */
public record RetryPolicy(int maxRetries, Duration baseDelay) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
    }

    public Duration backoff(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }

    /**
     * Worst-case time spent sleeping when every attempt fails.
     */
    public Duration totalBackoff() {
        Duration total = Duration.ZERO;
        for (int n = 0; n < maxRetries; n++) {
            total = total.plus(backoff(n));
        }
        return total;
    }
}
