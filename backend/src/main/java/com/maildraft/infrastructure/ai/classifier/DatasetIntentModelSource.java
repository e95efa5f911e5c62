package com.maildraft.infrastructure.ai.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Trains the model from a labelled JSON dataset when first needed.
 */
public class DatasetIntentModelSource implements IntentModelSource {

    private final Resource dataset;
    private final ObjectMapper objectMapper;
    private final IntentModelTrainer trainer;

    public DatasetIntentModelSource(Resource dataset, ObjectMapper objectMapper, IntentModelTrainer trainer) {
        this.dataset = dataset;
        this.objectMapper = objectMapper;
        this.trainer = trainer;
    }

    @Override
    public IntentModel load() throws IOException {
        return trainer.train(readDataset());
    }

    public TrainingDataset readDataset() throws IOException {
        if (!dataset.exists()) {
            throw new FileNotFoundException("Intent dataset not found: " + dataset.getDescription());
        }
        try (InputStream in = dataset.getInputStream()) {
            return objectMapper.readValue(in, TrainingDataset.class);
        }
    }

    @Override
    public String describe() {
        return "dataset " + dataset.getDescription();
    }
}
