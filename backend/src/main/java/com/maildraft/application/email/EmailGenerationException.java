package com.maildraft.application.email;

import com.maildraft.domain.email.model.PipelineOutcome;

/**
 * Carries a failed pipeline outcome to the HTTP layer.
 */
public class EmailGenerationException extends RuntimeException {

    private final PipelineOutcome.Failure failure;

    public EmailGenerationException(PipelineOutcome.Failure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public PipelineOutcome.Failure getFailure() {
        return failure;
    }
}
