package com.maildraft.interfaces.api.dto;

import com.maildraft.domain.email.model.DraftMetadata;
import com.maildraft.domain.email.model.PipelineOutcome;

import java.util.List;

public record EmailResponse(
        String subject,
        String greeting,
        String body,
        String closing,
        Metadata metadata
) {
    public record Metadata(
            String intent,
            double confidence,
            String tier,
            boolean fallbackUsed,
            boolean warningsSuppressed,
            List<String> warnings,
            int attempts,
            boolean reprompted,
            String correlationId
    ) {}

    public static EmailResponse from(PipelineOutcome.Success success) {
        DraftMetadata m = success.metadata();
        return new EmailResponse(
                success.draft().subject(),
                success.draft().greeting(),
                success.draft().body(),
                success.draft().closing(),
                new Metadata(m.intent(), m.confidence(), m.tier().name(), m.fallbackUsed(),
                        m.warningsSuppressed(), m.suppressedWarnings(), m.attempts(), m.reprompted(),
                        success.correlationId()));
    }
}
