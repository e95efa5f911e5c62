package com.maildraft.domain.email.model;

import java.util.Objects;

/**
 * Resolved generation parameters for one request. Every field is mandatory so that prompt
 * branches and validation rules never read an unset value.
 *
 * @param senderRole    who writes the email
 * @param recipientRole who receives it
 * @param tone          register the email must use
 * @param lengthTarget  target body length
 * @param domain        domain tag, also the key of the fallback template
 * @param intent        classifier label the record was resolved from
 * @param tier          HIGH iff {@code confidence} exceeds the configured threshold
 * @param confidence    raw classifier probability, kept for logging
 */
public record ControlRecord(
        String senderRole,
        String recipientRole,
        Tone tone,
        LengthTarget lengthTarget,
        String domain,
        String intent,
        ConfidenceTier tier,
        double confidence
) {
    public ControlRecord {
        Objects.requireNonNull(senderRole, "senderRole");
        Objects.requireNonNull(recipientRole, "recipientRole");
        Objects.requireNonNull(tone, "tone");
        Objects.requireNonNull(lengthTarget, "lengthTarget");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(tier, "tier");
    }

    public boolean isHighConfidence() {
        return tier == ConfidenceTier.HIGH;
    }
}
