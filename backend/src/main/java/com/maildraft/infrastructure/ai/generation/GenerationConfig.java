package com.maildraft.infrastructure.ai.generation;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class GenerationConfig {

    @Value("${generation.api-key:}")
    private String apiKey;

    @Value("${generation.base-url:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${generation.timeout:7s}")
    private Duration timeout;

    @Value("${generation.max-retries:2}")
    private int maxRetries;

    @Value("${generation.base-delay:500ms}")
    private Duration baseDelay;

    @Bean
    public OpenAIClient openAIClient() {
        // retries belong to GenerationClient
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, baseDelay);
    }
}
