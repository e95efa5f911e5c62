package com.maildraft.infrastructure.ai.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Offline training job: trains the intent model from the configured dataset and writes the JSON
 * artifact that {@code classifier.source=artifact} reads. Runs only under the
 * {@code train-intent-model} profile.
 */
@Slf4j
@Component
@Profile("train-intent-model")
@RequiredArgsConstructor
public class IntentModelExportRunner implements ApplicationRunner {

    private final DatasetIntentModelSource datasetSource;
    private final IntentModelTrainer trainer;
    private final ObjectMapper objectMapper;

    @Value("${classifier.export-path:./models/intent-model.json}")
    private String exportPath;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        IntentModel model = trainer.train(datasetSource.readDataset());
        Path target = Path.of(exportPath);
        export(model, target);
        log.info("Intent model {} written to {}", model.version(), target.toAbsolutePath());
    }

    void export(IntentModel model, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), model.toArtifact());
    }
}
