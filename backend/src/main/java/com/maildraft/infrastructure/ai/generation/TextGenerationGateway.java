package com.maildraft.infrastructure.ai.generation;

import java.time.Duration;

/**
 * One call to the external text-generation service. Implementations throw on any failure;
 * {@link GenerationFailureClassifier} decides whether the failure is worth retrying.
 * The call must not outlive {@code remaining}, the time left before the request deadline.
 */
public interface TextGenerationGateway {

    String complete(String instruction, Duration remaining);
}
