package com.maildraft.domain.email.service;

import com.maildraft.domain.email.model.PipelineOutcome;

public interface EmailDraftService {

    /**
     * Runs the full pipeline for one description. Never throws; every failure is returned as a
     * typed {@link PipelineOutcome.Failure}.
     */
    PipelineOutcome process(String description, String correlationId);
}
