package com.maildraft.infrastructure.ai.pipeline;

import com.maildraft.domain.email.model.ClassificationResult;
import com.maildraft.domain.email.model.ControlRecord;
import com.maildraft.domain.email.model.Description;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.GeneratedText;
import com.maildraft.domain.email.model.ValidationResult;
import lombok.Data;

import java.time.Instant;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class EmailPipelineContext {

    // --- Input ---
    private String correlationId;
    private Instant deadline;
    private Description description;

    // --- Classification / controls ---
    private ClassificationResult classification;
    private ControlRecord control;

    // --- Generation ---
    private String instruction;
    private GeneratedText generated;
    private int attempts;
    private boolean reprompted;

    // --- Extraction / validation ---
    private EmailDraft draft;
    private ValidationResult validationResult;
}
