package com.scholary.insight.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.insight.chunking.ChunkingConfig;
import com.scholary.insight.session.CaffeineSessionStore;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for chunking and session beans.
 *
 * <p>Enables the InsightProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(InsightProperties.class)
public class InsightConfig {

  @Bean
  public ChunkingConfig chunkingConfig(InsightProperties properties) {
    InsightProperties.ChunkingProperties chunking = properties.chunking();
    return ChunkingConfig.fromTokens(
        chunking.chunkSizeTokens(), chunking.chunkOverlapTokens(), chunking.charsPerToken());
  }

  @Bean
  public Ticker sessionTicker() {
    return Ticker.systemTicker();
  }

  @Bean(destroyMethod = "close")
  public CaffeineSessionStore sessionStore(InsightProperties properties, Ticker sessionTicker) {
    InsightProperties.SessionProperties session = properties.session();
    return new CaffeineSessionStore(
        Duration.ofHours(session.absoluteExpirationHours()),
        Duration.ofHours(session.slidingExpirationHours()),
        sessionTicker);
  }
}
