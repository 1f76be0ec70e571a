package com.scholary.insight.config;

import com.scholary.insight.llm.ChatProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the chat client.
 *
 * <p>Enables the ChatProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ChatProperties.class)
public class ChatConfig {}
