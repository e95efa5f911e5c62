package com.maildraft.domain.email.model;

public enum FailureKind {
    INPUT_REJECTED,
    GENERATION_UNAVAILABLE,
    MALFORMED_OUTPUT,
    OUTPUT_REJECTED;

    /**
     * Only rejected input can be fixed by the caller re-submitting.
     */
    public boolean isClientCorrectable() {
        return this == INPUT_REJECTED;
    }
}
