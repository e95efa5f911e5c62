package com.maildraft.infrastructure.ai.pipeline;

import com.maildraft.domain.email.exception.EmailPipelineException;
import com.maildraft.domain.email.exception.GenerationUnavailableException;
import com.maildraft.domain.email.exception.InputRejectedException;
import com.maildraft.domain.email.exception.MalformedOutputException;
import com.maildraft.domain.email.model.ClassificationResult;
import com.maildraft.domain.email.model.ControlRecord;
import com.maildraft.domain.email.model.Description;
import com.maildraft.domain.email.model.DraftMetadata;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.FailureKind;
import com.maildraft.domain.email.model.GeneratedText;
import com.maildraft.domain.email.model.PipelineOutcome;
import com.maildraft.domain.email.model.ValidationIssue;
import com.maildraft.domain.email.model.ValidationResult;
import com.maildraft.domain.email.service.EmailDraftService;
import com.maildraft.infrastructure.ai.PromptBuilder;
import com.maildraft.infrastructure.ai.classifier.IntentClassifier;
import com.maildraft.infrastructure.ai.control.ControlResolver;
import com.maildraft.infrastructure.ai.extraction.StructuredExtractor;
import com.maildraft.infrastructure.ai.generation.GenerationClient;
import com.maildraft.infrastructure.ai.preprocessing.TextNormalizer;
import com.maildraft.infrastructure.ai.validation.OutputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Orchestrates the email drafting pipeline:
 * <p>
 * normalize → description bounds → classify → resolve controls → prompt → generate →
 * extract (one re-prompt on malformed generated output) → validate → done
 * </p>
 * Every stage either returns a typed value or throws an {@link EmailPipelineException}; anything
 * else is converted at the stage boundary. {@link #process} never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailPipeline implements EmailDraftService {

    static final String MDC_KEY = "correlationId";

    private final TextNormalizer textNormalizer;
    private final IntentClassifier intentClassifier;
    private final ControlResolver controlResolver;
    private final PromptBuilder promptBuilder;
    private final GenerationClient generationClient;
    private final StructuredExtractor structuredExtractor;
    private final OutputValidator outputValidator;
    private final PipelineEventPublisher events;

    @Value("${pipeline.request-budget:25s}")
    private Duration requestBudget = Duration.ofSeconds(25);

    @Override
    public PipelineOutcome process(String rawDescription, String correlationId) {
        String id = correlationId == null || correlationId.isBlank() ? UUID.randomUUID().toString() : correlationId;

        String previousId = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, id);
        try {
            long startTime = System.currentTimeMillis();
            EmailPipelineContext ctx = new EmailPipelineContext();
            ctx.setCorrelationId(id);
            ctx.setDeadline(Instant.now().plus(requestBudget));

            PipelineOutcome outcome;
            try {
                outcome = execute(ctx, rawDescription);
            } catch (EmailPipelineException e) {
                outcome = failure(ctx, e);
            } catch (RuntimeException e) {
                log.error("Unexpected pipeline fault", e);
                outcome = new PipelineOutcome.Failure(id, FailureKind.GENERATION_UNAVAILABLE,
                        "INTERNAL_FAULT", "Email could not be generated");
            }

            long totalMs = System.currentTimeMillis() - startTime;
            String result = outcome instanceof PipelineOutcome.Failure f ? f.kind().name() : "SUCCESS";
            events.publish(id, "pipeline", result, totalMs);
            log.info("Pipeline finished in {}ms: success={}", totalMs, outcome.isSuccess());
            return outcome;
        } finally {
            if (previousId == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previousId);
            }
        }
    }

    private PipelineOutcome execute(EmailPipelineContext ctx, String rawDescription) {
        // 1. Input
        Description description = stage(ctx, "input",
                () -> Description.of(textNormalizer.normalize(rawDescription)),
                e -> new InputRejectedException("DESCRIPTION_UNREADABLE", "Description could not be read"));
        ctx.setDescription(description);

        // 2. Classify (never throws, degrades to general)
        ClassificationResult classification = stage(ctx, "classify",
                () -> intentClassifier.classify(description.content()),
                e -> new GenerationUnavailableException("CLASSIFICATION_FAULT", "Request could not be classified", e));
        ctx.setClassification(classification);

        // 3. Resolve controls
        ControlRecord control = stage(ctx, "resolve",
                () -> controlResolver.resolve(classification),
                e -> new GenerationUnavailableException("CONTROL_FAULT", "Generation controls could not be resolved", e));
        ctx.setControl(control);
        log.info("Controls resolved: intent={}, confidence={}, tier={}, domain={}, tone={}, length={}",
                control.intent(), String.format("%.3f", control.confidence()), control.tier(),
                control.domain(), control.tone(), control.lengthTarget());

        // 4. Prompt
        String instruction = stage(ctx, "prompt",
                () -> promptBuilder.build(control, description),
                e -> new GenerationUnavailableException("PROMPT_FAULT", "Instruction could not be built", e));
        ctx.setInstruction(instruction);

        // 5. Generate + 6. Extract
        generate(ctx, instruction);
        EmailDraft draft = extractWithReprompt(ctx);
        ctx.setDraft(draft);

        // 7. Validate
        ValidationResult validation = stage(ctx, "validate",
                () -> outputValidator.validate(draft, control),
                e -> new MalformedOutputException("VALIDATION_FAULT", "Generated email could not be checked", e));
        ctx.setValidationResult(validation);

        if (!validation.passed()) {
            ValidationIssue rejection = validation.rejection().orElseThrow();
            String reasonCode = rejection.layer().name() + "." + rejection.type().name();
            log.warn("Draft rejected: reason={}, field={}, fallback={}",
                    reasonCode, rejection.field(), ctx.getGenerated().isFallback());
            return new PipelineOutcome.Failure(ctx.getCorrelationId(), FailureKind.OUTPUT_REJECTED,
                    reasonCode, rejection.message());
        }

        if (ctx.getGenerated().isFallback()) {
            log.warn("Returning fallback draft for domain={}", control.domain());
        }

        DraftMetadata metadata = new DraftMetadata(
                control.intent(),
                control.confidence(),
                control.tier(),
                ctx.getGenerated().isFallback(),
                ctx.getAttempts(),
                ctx.isReprompted(),
                validation.warnings().stream().map(ValidationIssue::message).toList());

        return new PipelineOutcome.Success(ctx.getCorrelationId(), draft, metadata);
    }

    private void generate(EmailPipelineContext ctx, String instruction) {
        GeneratedText generated = stage(ctx, "generate",
                () -> generationClient.generate(instruction, ctx.getControl().domain(), ctx.getDeadline()),
                e -> new GenerationUnavailableException("GENERATION_FAULT", "Text generation failed", e));
        ctx.setGenerated(generated);
        ctx.setAttempts(ctx.getAttempts() + generated.attempts());
    }

    private EmailDraft extractWithReprompt(EmailPipelineContext ctx) {
        try {
            return extract(ctx);
        } catch (MalformedOutputException e) {
            if (ctx.getGenerated().isFallback() || ctx.isReprompted()) {
                throw e;
            }
            log.warn("Generated output malformed ({}), re-prompting once", e.getReasonCode());
            ctx.setReprompted(true);
            String retryInstruction = stage(ctx, "reprompt",
                    () -> promptBuilder.buildRetry(ctx.getControl(), ctx.getDescription(), e.getReasonCode()),
                    ex -> new GenerationUnavailableException("PROMPT_FAULT", "Instruction could not be built", ex));
            generate(ctx, retryInstruction);
            return extract(ctx);
        }
    }

    private EmailDraft extract(EmailPipelineContext ctx) {
        return stage(ctx, "extract",
                () -> structuredExtractor.extract(ctx.getGenerated()),
                e -> new MalformedOutputException("EXTRACTION_FAULT", "Generated output could not be parsed", e));
    }

    /**
     * Runs one stage, publishes its audit event and converts unexpected faults with {@code convert}.
     */
    private <T> T stage(EmailPipelineContext ctx, String name, Supplier<T> body,
                        Function<RuntimeException, EmailPipelineException> convert) {
        long start = System.currentTimeMillis();
        try {
            T result = body.get();
            events.publish(ctx.getCorrelationId(), name, "OK", System.currentTimeMillis() - start);
            return result;
        } catch (EmailPipelineException e) {
            events.publish(ctx.getCorrelationId(), name, e.getKind().name(), System.currentTimeMillis() - start);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected fault in stage {}", name, e);
            EmailPipelineException converted = convert.apply(e);
            events.publish(ctx.getCorrelationId(), name, converted.getKind().name(), System.currentTimeMillis() - start);
            throw converted;
        }
    }

    private PipelineOutcome failure(EmailPipelineContext ctx, EmailPipelineException e) {
        switch (e.getKind()) {
            case INPUT_REJECTED -> log.info("Input rejected: {}", e.getReasonCode());
            case GENERATION_UNAVAILABLE -> log.error("Generation unavailable: {} - {}", e.getReasonCode(), e.getMessage());
            default -> log.warn("Pipeline failed: kind={}, reason={}", e.getKind(), e.getReasonCode());
        }
        return new PipelineOutcome.Failure(ctx.getCorrelationId(), e.getKind(), e.getReasonCode(), e.getMessage());
    }
}
