package com.maildraft.domain.email.exception;

import com.maildraft.domain.email.model.FailureKind;

/**
 * Base of the typed failures a pipeline stage may raise. The orchestrator turns each one into a
 * {@link com.maildraft.domain.email.model.PipelineOutcome.Failure}.
 */
public abstract class EmailPipelineException extends RuntimeException {

    private final String reasonCode;

    protected EmailPipelineException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    protected EmailPipelineException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public abstract FailureKind getKind();
}
