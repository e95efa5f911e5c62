package com.maildraft.infrastructure.ai.classifier;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable TF-IDF + multinomial logistic-regression model. Safe for concurrent readers.
 */
public final class IntentModel {

    private final String version;
    private final List<String> labels;
    private final List<String> vocabulary;
    private final Map<String, Integer> termIndex;
    private final double[] idf;
    private final double[][] weights;
    private final double[] bias;

    private IntentModel(String version, List<String> labels, List<String> vocabulary,
                        double[] idf, double[][] weights, double[] bias) {
        this.version = version;
        this.labels = List.copyOf(labels);
        this.vocabulary = List.copyOf(vocabulary);
        this.idf = idf.clone();
        this.bias = bias.clone();
        this.weights = new double[weights.length][];
        for (int k = 0; k < weights.length; k++) {
            this.weights[k] = weights[k].clone();
        }
        Map<String, Integer> index = new HashMap<>();
        for (int j = 0; j < vocabulary.size(); j++) {
            index.put(vocabulary.get(j), j);
        }
        this.termIndex = Collections.unmodifiableMap(index);
    }

    public static IntentModel fromArtifact(IntentModelArtifact artifact) {
        if (artifact == null || artifact.version() == null || artifact.labels() == null
                || artifact.vocabulary() == null || artifact.idf() == null
                || artifact.weights() == null || artifact.bias() == null) {
            throw new IllegalArgumentException("Intent model artifact is incomplete");
        }
        int labelCount = artifact.labels().size();
        int featureCount = artifact.vocabulary().size();
        if (labelCount < 2) {
            throw new IllegalArgumentException("Intent model needs at least two labels");
        }
        if (artifact.idf().length != featureCount) {
            throw new IllegalArgumentException("idf length " + artifact.idf().length
                    + " does not match vocabulary size " + featureCount);
        }
        if (artifact.weights().length != labelCount || artifact.bias().length != labelCount) {
            throw new IllegalArgumentException("weights/bias do not match label count " + labelCount);
        }
        for (double[] row : artifact.weights()) {
            if (row == null || row.length != featureCount) {
                throw new IllegalArgumentException("weight row does not match vocabulary size " + featureCount);
            }
        }
        return new IntentModel(artifact.version(), artifact.labels(), artifact.vocabulary(),
                artifact.idf(), artifact.weights(), artifact.bias());
    }

    public IntentModelArtifact toArtifact() {
        double[][] rows = new double[weights.length][];
        for (int k = 0; k < weights.length; k++) {
            rows[k] = weights[k].clone();
        }
        return new IntentModelArtifact(version, labels, vocabulary, idf.clone(), rows, bias.clone());
    }

    public String version() {
        return version;
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * Probability per label (index-aligned with {@link #labels()}); sums to 1.
     */
    public double[] predictProba(String text) {
        Map<Integer, Double> features = vectorize(termIndex, idf, text);
        double[] logits = new double[labels.size()];
        for (int k = 0; k < logits.length; k++) {
            double z = bias[k];
            for (Map.Entry<Integer, Double> feature : features.entrySet()) {
                z += weights[k][feature.getKey()] * feature.getValue();
            }
            logits[k] = z;
        }
        return softmax(logits);
    }

    /**
     * Sparse L2-normalized TF-IDF vector. Terms outside the vocabulary are ignored.
     */
    static Map<Integer, Double> vectorize(Map<String, Integer> termIndex, double[] idf, String text) {
        Map<Integer, Double> counts = new TreeMap<>();
        for (String term : TermExtractor.terms(text)) {
            Integer j = termIndex.get(term);
            if (j != null) {
                counts.merge(j, 1.0, Double::sum);
            }
        }
        double norm = 0.0;
        for (Map.Entry<Integer, Double> entry : counts.entrySet()) {
            double v = entry.getValue() * idf[entry.getKey()];
            entry.setValue(v);
            norm += v * v;
        }
        if (norm > 0) {
            double scale = 1.0 / Math.sqrt(norm);
            counts.replaceAll((j, v) -> v * scale);
        }
        return counts;
    }

    static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : logits) {
            if (v > max) max = v;
        }
        double[] exp = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            exp[i] = Math.exp(logits[i] - max);
            sum += exp[i];
        }
        for (int i = 0; i < exp.length; i++) {
            exp[i] /= sum;
        }
        return exp;
    }
}
