package com.maildraft.domain.email.exception;

import com.maildraft.domain.email.model.FailureKind;

public class MalformedOutputException extends EmailPipelineException {

    public MalformedOutputException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public MalformedOutputException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.MALFORMED_OUTPUT;
    }
}
