package com.maildraft.infrastructure.ai.generation;

import java.time.Duration;

/**
 * Backoff wait between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
