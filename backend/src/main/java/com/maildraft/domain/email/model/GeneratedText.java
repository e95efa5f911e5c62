package com.maildraft.domain.email.model;

import java.time.Duration;

/**
 * Raw text returned by the generation service, or the rendered fallback template.
 *
 * @param content  text to extract the email record from
 * @param source   whether the text came from the service or from a fallback template
 * @param latency  wall time spent in the generation client, backoff included
 * @param attempts number of calls made to the service
 */
public record GeneratedText(String content, GenerationSource source, Duration latency, int attempts) {

    public boolean isFallback() {
        return source == GenerationSource.FALLBACK;
    }
}
