package com.maildraft.domain.email.exception;

import com.maildraft.domain.email.model.FailureKind;

public class InputRejectedException extends EmailPipelineException {

    public InputRejectedException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public InputRejectedException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.INPUT_REJECTED;
    }
}
