package com.maildraft.domain.email.exception;

import com.maildraft.domain.email.model.FailureKind;

public class GenerationUnavailableException extends EmailPipelineException {

    public GenerationUnavailableException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public GenerationUnavailableException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.GENERATION_UNAVAILABLE;
    }
}
