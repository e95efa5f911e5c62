package com.maildraft.infrastructure.ai.classifier;

import com.maildraft.domain.email.model.ClassificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies a description into an intent label with a probability.
 * <p>
 * The model is loaded on first use. Concurrent first callers wait for a single load; the loaded
 * model (or the load failure) is then shared by every request. Classification never throws:
 * any failure degrades to {@link ClassificationResult#fallback()}.
 * </p>
 */
@Slf4j
@Component
public class IntentClassifier {

    private final IntentModelSource modelSource;
    private final Object loadLock = new Object();

    private volatile LoadedModel loaded;

    public IntentClassifier(IntentModelSource modelSource) {
        this.modelSource = modelSource;
    }

    public ClassificationResult classify(String text) {
        try {
            IntentModel model = model();
            if (model == null) {
                return ClassificationResult.fallback();
            }

            double[] probabilities = model.predictProba(text);
            int best = 0;
            for (int k = 1; k < probabilities.length; k++) {
                if (probabilities[k] > probabilities[best]) {
                    best = k;
                }
            }
            double confidence = probabilities[best];
            if (Double.isNaN(confidence)) {
                log.warn("Intent model {} produced NaN probabilities, using default label", model.version());
                return ClassificationResult.fallback();
            }

            return new ClassificationResult(model.labels().get(best), Math.min(1.0, confidence), model.version());
        } catch (RuntimeException e) {
            log.warn("Intent classification failed, using default label: {}", e.toString());
            return ClassificationResult.fallback();
        }
    }

    /**
     * Loaded model, or null when loading failed.
     */
    IntentModel model() {
        LoadedModel current = loaded;
        if (current == null) {
            synchronized (loadLock) {
                current = loaded;
                if (current == null) {
                    current = load();
                    loaded = current;
                }
            }
        }
        return current.model();
    }

    private LoadedModel load() {
        long start = System.currentTimeMillis();
        try {
            IntentModel model = modelSource.load();
            log.info("Intent model {} loaded from {} in {} ms ({} labels)",
                    model.version(), modelSource.describe(), System.currentTimeMillis() - start, model.labels().size());
            return new LoadedModel(model);
        } catch (Exception e) {
            log.error("Failed to load intent model from {}; classification will use the default label",
                    modelSource.describe(), e);
            return new LoadedModel(null);
        }
    }

    private record LoadedModel(IntentModel model) {}
}
