package com.maildraft.infrastructure.ai.classifier;

import java.io.IOException;

/**
 * Where the intent model comes from. Called at most once per classifier instance.
 */
public interface IntentModelSource {

    IntentModel load() throws IOException;

    /**
     * Location description for logs.
     */
    String describe();
}
