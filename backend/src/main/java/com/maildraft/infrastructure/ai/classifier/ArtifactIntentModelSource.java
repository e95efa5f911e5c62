package com.maildraft.infrastructure.ai.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a pre-trained JSON artifact from a file or classpath resource.
 */
public class ArtifactIntentModelSource implements IntentModelSource {

    private final Resource artifact;
    private final ObjectMapper objectMapper;

    public ArtifactIntentModelSource(Resource artifact, ObjectMapper objectMapper) {
        this.artifact = artifact;
        this.objectMapper = objectMapper;
    }

    @Override
    public IntentModel load() throws IOException {
        if (!artifact.exists()) {
            throw new FileNotFoundException("Intent model artifact not found: " + artifact.getDescription());
        }
        try (InputStream in = artifact.getInputStream()) {
            return IntentModel.fromArtifact(objectMapper.readValue(in, IntentModelArtifact.class));
        }
    }

    @Override
    public String describe() {
        return "artifact " + artifact.getDescription();
    }
}
