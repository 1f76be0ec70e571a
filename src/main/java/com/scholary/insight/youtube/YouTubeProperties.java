package com.scholary.insight.youtube;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the YouTube caption client.
 *
 * <p>{@code preferredLanguage} is the caption language code tried first; the first available track
 * is used when it is missing.
 */
@ConfigurationProperties(prefix = "youtube")
@Validated
public record YouTubeProperties(
    @NotBlank String baseUrl,
    @NotBlank String preferredLanguage,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
