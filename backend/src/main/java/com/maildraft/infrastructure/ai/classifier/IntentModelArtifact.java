package com.maildraft.infrastructure.ai.classifier;

import java.util.List;

/**
 * Serialized form of a trained intent model (JSON via Jackson).
 *
 * @param version    artifact version, reported with every classification
 * @param labels     label set, index-aligned with {@code weights} and {@code bias}
 * @param vocabulary feature terms, index-aligned with {@code idf} and the weight columns
 * @param idf        smoothed inverse document frequency per term
 * @param weights    one weight row per label
 * @param bias       one intercept per label
 */
public record IntentModelArtifact(
        String version,
        List<String> labels,
        List<String> vocabulary,
        double[] idf,
        double[][] weights,
        double[] bias
) {}
