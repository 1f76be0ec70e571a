package com.scholary.insight.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the OpenAI-compatible chat endpoint.
 *
 * <p>{@code baseUrl} points at the API root (for example {@code https://openrouter.ai/api/v1});
 * {@code /chat/completions} is appended.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record ChatProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @PositiveOrZero double temperature) {}
