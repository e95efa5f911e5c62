package com.maildraft.domain.email.model;

import java.util.List;

/**
 * Metadata returned alongside an accepted draft.
 *
 * @param intent             classifier label the controls were resolved from
 * @param confidence         classifier probability
 * @param tier               confidence tier used for prompting and validation
 * @param fallbackUsed       true when the draft came from a fallback template
 * @param attempts           generation service calls made, re-prompt included
 * @param reprompted         true when the single malformed-output re-prompt was used
 * @param suppressedWarnings validation warnings that did not reject the draft
 */
public record DraftMetadata(
        String intent,
        double confidence,
        ConfidenceTier tier,
        boolean fallbackUsed,
        int attempts,
        boolean reprompted,
        List<String> suppressedWarnings
) {
    public boolean warningsSuppressed() {
        return !suppressedWarnings.isEmpty();
    }
}
