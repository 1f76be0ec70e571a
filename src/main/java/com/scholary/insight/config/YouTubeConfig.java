package com.scholary.insight.config;

import com.scholary.insight.youtube.YouTubeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the YouTube caption client.
 *
 * <p>Enables the YouTubeProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(YouTubeProperties.class)
public class YouTubeConfig {}
