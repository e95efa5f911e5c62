package com.maildraft.infrastructure.ai.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;

@Slf4j
@Configuration
public class ClassifierConfig {

    @Value("${classifier.source:dataset}")
    private String source;

    @Value("${classifier.artifact-location:file:./models/intent-model.json}")
    private String artifactLocation;

    @Value("${classifier.dataset-location:classpath:ml/intent-dataset.json}")
    private String datasetLocation;

    @Bean
    public IntentModelTrainer intentModelTrainer() {
        return new IntentModelTrainer();
    }

    @Bean
    public DatasetIntentModelSource datasetIntentModelSource(ResourceLoader resourceLoader,
                                                             ObjectMapper objectMapper,
                                                             IntentModelTrainer trainer) {
        return new DatasetIntentModelSource(resourceLoader.getResource(datasetLocation), objectMapper, trainer);
    }

    @Bean
    @Primary
    public IntentModelSource intentModelSource(ResourceLoader resourceLoader,
                                               ObjectMapper objectMapper,
                                               DatasetIntentModelSource datasetSource) {
        if ("artifact".equalsIgnoreCase(source)) {
            log.info("Intent classifier will read artifact {}", artifactLocation);
            return new ArtifactIntentModelSource(resourceLoader.getResource(artifactLocation), objectMapper);
        }
        log.info("Intent classifier will train from dataset {}", datasetLocation);
        return datasetSource;
    }
}
