package com.maildraft.infrastructure.ai.classifier;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Trains an {@link IntentModel}: word uni/bi-gram TF-IDF (smooth idf, L2 norm) followed by
 * multinomial logistic regression fitted with full-batch gradient descent and L2 penalty.
 * <p>
 * Training is deterministic: labels and vocabulary are sorted, weights start at zero and examples
 * are visited in dataset order.
 * </p>
 */
@Slf4j
public class IntentModelTrainer {

    public static final int DEFAULT_EPOCHS = 800;
    public static final double DEFAULT_LEARNING_RATE = 1.5;
    public static final double DEFAULT_L2 = 1e-4;

    private final int epochs;
    private final double learningRate;
    private final double l2;

    public IntentModelTrainer() {
        this(DEFAULT_EPOCHS, DEFAULT_LEARNING_RATE, DEFAULT_L2);
    }

    public IntentModelTrainer(int epochs, double learningRate, double l2) {
        if (epochs <= 0 || learningRate <= 0 || l2 < 0) {
            throw new IllegalArgumentException("Invalid training hyper-parameters");
        }
        this.epochs = epochs;
        this.learningRate = learningRate;
        this.l2 = l2;
    }

    public IntentModel train(TrainingDataset dataset) {
        if (dataset == null || dataset.examples() == null || dataset.examples().isEmpty()) {
            throw new IllegalArgumentException("Training dataset is empty");
        }
        List<TrainingExample> examples = dataset.examples();
        String version = dataset.version() == null || dataset.version().isBlank() ? "unversioned" : dataset.version();

        List<String> labels = new ArrayList<>(new TreeSet<>(examples.stream().map(TrainingExample::label).toList()));
        if (labels.size() < 2) {
            throw new IllegalArgumentException("Training dataset needs at least two labels");
        }
        Map<String, Integer> labelIndex = indexOf(labels);

        // Vocabulary + document frequency
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (TrainingExample example : examples) {
            Set<String> seen = new HashSet<>(TermExtractor.terms(example.text()));
            for (String term : seen) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }
        List<String> vocabulary = new ArrayList<>(new TreeSet<>(documentFrequency.keySet()));
        Map<String, Integer> termIndex = indexOf(vocabulary);

        int n = examples.size();
        double[] idf = new double[vocabulary.size()];
        for (int j = 0; j < idf.length; j++) {
            idf[j] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(vocabulary.get(j)))) + 1.0;
        }

        List<Map<Integer, Double>> features = new ArrayList<>(n);
        int[] targets = new int[n];
        for (int i = 0; i < n; i++) {
            features.add(IntentModel.vectorize(termIndex, idf, examples.get(i).text()));
            targets[i] = labelIndex.get(examples.get(i).label());
        }

        int labelCount = labels.size();
        int featureCount = vocabulary.size();
        double[][] weights = new double[labelCount][featureCount];
        double[] bias = new double[labelCount];

        for (int epoch = 0; epoch < epochs; epoch++) {
            double[][] gradW = new double[labelCount][featureCount];
            double[] gradB = new double[labelCount];

            for (int i = 0; i < n; i++) {
                Map<Integer, Double> x = features.get(i);
                double[] logits = new double[labelCount];
                for (int k = 0; k < labelCount; k++) {
                    double z = bias[k];
                    for (Map.Entry<Integer, Double> f : x.entrySet()) {
                        z += weights[k][f.getKey()] * f.getValue();
                    }
                    logits[k] = z;
                }
                double[] p = IntentModel.softmax(logits);
                for (int k = 0; k < labelCount; k++) {
                    double diff = p[k] - (targets[i] == k ? 1.0 : 0.0);
                    gradB[k] += diff;
                    for (Map.Entry<Integer, Double> f : x.entrySet()) {
                        gradW[k][f.getKey()] += diff * f.getValue();
                    }
                }
            }

            for (int k = 0; k < labelCount; k++) {
                for (int j = 0; j < featureCount; j++) {
                    weights[k][j] -= learningRate * (gradW[k][j] / n + l2 * weights[k][j]);
                }
                bias[k] -= learningRate * gradB[k] / n;
            }
        }

        log.info("Trained intent model {}: {} examples, {} labels, {} features, {} epochs",
                version, n, labelCount, featureCount, epochs);

        return IntentModel.fromArtifact(new IntentModelArtifact(
                version, labels, vocabulary, idf, weights, bias));
    }

    private static Map<String, Integer> indexOf(List<String> values) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < values.size(); i++) {
            index.put(values.get(i), i);
        }
        return index;
    }
}
