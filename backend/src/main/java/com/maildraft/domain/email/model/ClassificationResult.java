package com.maildraft.domain.email.model;

import java.util.Objects;

/**
 * Intent label with the model's probability for that label.
 *
 * @param label        member of the classifier's label set, never null
 * @param confidence   probability of {@code label}, in [0, 1]
 * @param modelVersion version of the artifact that produced the result ("none" when degraded)
 */
public record ClassificationResult(String label, double confidence, String modelVersion) {

    public static final String DEFAULT_LABEL = "general";
    public static final String NO_MODEL = "none";

    public ClassificationResult {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(modelVersion, "modelVersion");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static ClassificationResult fallback() {
        return new ClassificationResult(DEFAULT_LABEL, 0.0, NO_MODEL);
    }
}
