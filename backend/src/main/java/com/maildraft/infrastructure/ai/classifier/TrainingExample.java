package com.maildraft.infrastructure.ai.classifier;

public record TrainingExample(String text, String label) {}
