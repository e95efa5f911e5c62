package com.maildraft.infrastructure.ai.generation;

import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Chat-completions call against an OpenAI-compatible endpoint (Groq by default).
 * The instruction goes out as a single user message; SDK retries are disabled in
 * {@link GenerationConfig} so that {@link GenerationClient} owns the retry budget.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiGenerationGateway implements TextGenerationGateway {

    private final OpenAIClient openAIClient;

    @Value("${generation.model}")
    private String model;

    @Value("${generation.temperature:0.2}")
    private double temperature;

    @Value("${generation.max-tokens:600}")
    private int maxTokens;

    @Value("${generation.json-mode:true}")
    private boolean jsonMode;

    @Value("${generation.timeout:7s}")
    private Duration timeout;

    @Override
    public String complete(String instruction, Duration remaining) {
        var builder = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addUserMessage(instruction);

        if (jsonMode) {
            builder.responseFormat(ResponseFormatJsonObject.builder().build());
        }

        Duration callTimeout = remaining.compareTo(timeout) < 0 ? remaining : timeout;
        ChatCompletion completion = openAIClient.chat().completions().create(builder.build(),
                RequestOptions.builder().timeout(callTimeout).build());

        completion.usage().ifPresent(usage ->
                log.debug("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        model, usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .filter(content -> !content.isBlank())
                .orElseThrow(() -> new EmptyCompletionException("Generation response has no content"));
    }
}
