package com.maildraft.domain.email.model;

import java.util.Objects;

/**
 * Result of one pipeline run: an accepted draft or a typed failure with a stable reason code.
 */
public sealed interface PipelineOutcome permits PipelineOutcome.Success, PipelineOutcome.Failure {

    String correlationId();

    boolean isSuccess();

    record Success(String correlationId, EmailDraft draft, DraftMetadata metadata) implements PipelineOutcome {
        public Success {
            Objects.requireNonNull(draft, "draft");
            Objects.requireNonNull(metadata, "metadata");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(String correlationId, FailureKind kind, String reasonCode, String message) implements PipelineOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reasonCode, "reasonCode");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
