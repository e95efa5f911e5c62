package com.maildraft.infrastructure.ai.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one audit event per stage transition to the {@code maildraft.audit} logger.
 * Events carry identifiers and outcomes only, never user text or generated content.
 */
@Slf4j(topic = "maildraft.audit")
@Component
public class PipelineEventPublisher {

    public void publish(String correlationId, String stage, String outcome, long latencyMs) {
        log.info("event=stage correlationId={} stage={} outcome={} latencyMs={}",
                correlationId, stage, outcome, latencyMs);
    }
}
