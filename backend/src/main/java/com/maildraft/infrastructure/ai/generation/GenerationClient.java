package com.maildraft.infrastructure.ai.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maildraft.domain.email.exception.GenerationUnavailableException;
import com.maildraft.domain.email.model.GeneratedText;
import com.maildraft.domain.email.model.GenerationSource;
import com.maildraft.infrastructure.ai.generation.fallback.FallbackTemplate;
import com.maildraft.infrastructure.ai.generation.fallback.FallbackTemplateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Calls the generation service under a bounded retry budget and a per-request deadline.
 * <p>
 * States: {@code ATTEMPT(n)} → {@code DONE} on success; a transient failure moves to
 * {@code ATTEMPT(n+1)} after {@code base * 2^n}, or to {@code FALLBACK} once the budget is spent or the
 * next wait would cross the deadline; a permanent failure ends in {@code FAILED} after one attempt.
 * {@code FALLBACK} renders the domain template as JSON so it flows through extraction and validation
 * like generated text. Each attempt is given only the time left before the deadline.
 * </p>
 * The instruction text is never logged.
 */
@Slf4j
@Component
public class GenerationClient {

    private enum State { ATTEMPT, BACKOFF, DONE, FALLBACK, FAILED }

    private final TextGenerationGateway gateway;
    private final RetryPolicy retryPolicy;
    private final FallbackTemplateRegistry fallbackTemplates;
    private final ObjectMapper objectMapper;
    private final boolean fallbackEnabled;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public GenerationClient(TextGenerationGateway gateway,
                            RetryPolicy retryPolicy,
                            FallbackTemplateRegistry fallbackTemplates,
                            ObjectMapper objectMapper,
                            @Value("${generation.fallback-enabled:true}") boolean fallbackEnabled) {
        this(gateway, retryPolicy, fallbackTemplates, objectMapper, fallbackEnabled, Clock.systemUTC(), Sleeper.THREAD);
    }

    GenerationClient(TextGenerationGateway gateway,
                     RetryPolicy retryPolicy,
                     FallbackTemplateRegistry fallbackTemplates,
                     ObjectMapper objectMapper,
                     boolean fallbackEnabled,
                     Clock clock,
                     Sleeper sleeper) {
        this.gateway = gateway;
        this.retryPolicy = retryPolicy;
        this.fallbackTemplates = fallbackTemplates;
        this.objectMapper = objectMapper;
        this.fallbackEnabled = fallbackEnabled;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public GeneratedText generate(String instruction, String domain, Instant deadline) {
        long startTime = clock.millis();
        State state = State.ATTEMPT;
        int attempt = 0;
        int calls = 0;
        String content = null;
        GenerationFailure lastFailure = null;

        while (true) {
            switch (state) {
                case ATTEMPT -> {
                    Duration remaining = Duration.between(clock.instant(), deadline);
                    if (remaining.isNegative() || remaining.isZero()) {
                        log.warn("[Generation] Deadline reached before attempt {}", attempt + 1);
                        state = State.FALLBACK;
                        break;
                    }
                    long attemptStart = clock.millis();
                    calls++;
                    try {
                        content = gateway.complete(instruction, remaining);
                        log.info("[Generation] Attempt {} succeeded in {}ms", attempt + 1, clock.millis() - attemptStart);
                        state = State.DONE;
                    } catch (RuntimeException e) {
                        lastFailure = GenerationFailureClassifier.classify(e);
                        log.warn("[Generation] Attempt {} failed in {}ms: code={}, status={}, transient={}, msg={}",
                                attempt + 1, clock.millis() - attemptStart, lastFailure.code(),
                                lastFailure.statusCode(), lastFailure.transientFailure(), lastFailure.shortMessage());
                        if (!lastFailure.transientFailure()) {
                            state = State.FAILED;
                        } else if (attempt >= retryPolicy.maxRetries()) {
                            state = State.FALLBACK;
                        } else {
                            state = State.BACKOFF;
                        }
                    }
                }
                case BACKOFF -> {
                    Duration delay = retryPolicy.backoff(attempt);
                    if (!clock.instant().plus(delay).isBefore(deadline)) {
                        log.warn("[Generation] Backoff of {}ms would pass the deadline, stopping after {} attempts",
                                delay.toMillis(), calls);
                        state = State.FALLBACK;
                        break;
                    }
                    try {
                        sleeper.sleep(delay);
                        attempt++;
                        state = State.ATTEMPT;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("[Generation] Interrupted during backoff, stopping after {} attempts", calls);
                        state = State.FALLBACK;
                    }
                }
                case DONE -> {
                    Duration latency = Duration.ofMillis(clock.millis() - startTime);
                    log.info("[Generation] Completed: outcome=GENERATED, attempts={}, latency={}ms", calls, latency.toMillis());
                    return new GeneratedText(content, GenerationSource.GENERATED, latency, calls);
                }
                case FALLBACK -> {
                    return fallback(domain, calls, startTime, lastFailure);
                }
                case FAILED -> {
                    log.error("[Generation] Completed: outcome=FAILED, attempts={}, code={}, status={}",
                            calls, lastFailure.code(), lastFailure.statusCode());
                    throw new GenerationUnavailableException("GENERATION_" + lastFailure.code(),
                            "Text generation service rejected the request: " + lastFailure.shortMessage());
                }
            }
        }
    }

    private GeneratedText fallback(String domain, int calls, long startTime, GenerationFailure lastFailure) {
        String cause = lastFailure == null ? "DEADLINE" : lastFailure.code();
        if (!fallbackEnabled) {
            log.error("[Generation] Completed: outcome=FAILED, attempts={}, cause={}, fallback disabled", calls, cause);
            throw new GenerationUnavailableException("FALLBACK_DISABLED",
                    "Text generation service unavailable and fallback is disabled");
        }
        FallbackTemplate template = fallbackTemplates.find(domain)
                .orElseThrow(() -> {
                    log.error("[Generation] Completed: outcome=FAILED, attempts={}, cause={}, no fallback template for domain={}",
                            calls, cause, domain);
                    return new GenerationUnavailableException("FALLBACK_UNAVAILABLE",
                            "Text generation service unavailable and no fallback template exists");
                });

        String rendered;
        try {
            rendered = objectMapper.writeValueAsString(template.toDraft());
        } catch (JsonProcessingException e) {
            throw new GenerationUnavailableException("FALLBACK_UNAVAILABLE", "Fallback template could not be rendered", e);
        }

        Duration latency = Duration.ofMillis(clock.millis() - startTime);
        log.warn("[Generation] Completed: outcome=FALLBACK, attempts={}, cause={}, domain={}, template={}, latency={}ms",
                calls, cause, domain, template.domain(), latency.toMillis());
        return new GeneratedText(rendered, GenerationSource.FALLBACK, latency, calls);
    }
}
