package com.scholary.insight.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript chunking, session caching and answer streaming.
 *
 * <p>Controls chunk budgets, session lifetimes, history window and resource allocation.
 */
@ConfigurationProperties(prefix = "insight")
@Validated
public record InsightProperties(
    @Valid ChunkingProperties chunking,
    @Valid SessionProperties session,
    @Valid ConversationProperties conversation,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive long streamTimeoutSeconds) {

  public record ChunkingProperties(
      @Positive int chunkSizeTokens,
      @PositiveOrZero int chunkOverlapTokens,
      @Positive int charsPerToken) {}

  public record SessionProperties(
      @Positive int absoluteExpirationHours, @Positive int slidingExpirationHours) {}

  public record ConversationProperties(@Positive int maxHistoryMessages) {}
}
