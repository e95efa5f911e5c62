package com.maildraft.infrastructure.ai.classifier;

import java.util.List;

/**
 * Labelled examples the intent model is trained on (JSON via Jackson).
 */
public record TrainingDataset(String version, List<TrainingExample> examples) {}
