package com.scholary.insight.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for OpenAI-compatible {@code /chat/completions} endpoints.
 *
 * <p>Streaming responses are server-sent events. Each {@code data:} line carries a JSON chunk whose
 * {@code choices[].delta.content} is the next fragment; {@code data: [DONE]} ends the stream:
 *
 * <pre>
 * data: {"choices":[{"delta":{"content":"Hel"}}]}
 *
 * data: {"choices":[{"delta":{"content":"lo"}}]}
 *
 * data: [DONE]
 * </pre>
 */
@Component
public class OpenAiChatClient implements ChatClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiChatClient.class);

  static final String DONE_MARKER = "[DONE]";

  private final HttpClient httpClient;
  private final ChatProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiChatClient(ChatProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized chat client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public String complete(List<ChatMessage> messages) {
    HttpRequest request = buildRequest(messages, false);
    LOGGER.debug("Sending completion request to {}", request.uri());

    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new ChatException(
            String.format(
                "Chat API returned status %d: %s", response.statusCode(), response.body()));
      }
      return parseCompletion(response.body());
    } catch (IOException e) {
      throw new ChatException("Chat completion failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChatException("Chat completion interrupted", e);
    }
  }

  @Override
  public Stream<String> completeStreaming(List<ChatMessage> messages) {
    HttpRequest request = buildRequest(messages, true);
    LOGGER.debug("Sending streaming completion request to {}", request.uri());

    HttpResponse<Stream<String>> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
    } catch (IOException e) {
      throw new ChatException("Streaming completion failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChatException("Streaming completion interrupted", e);
    }

    if (response.statusCode() != 200) {
      String body;
      try (Stream<String> lines = response.body()) {
        body = lines.collect(Collectors.joining("\n"));
      }
      throw new ChatException(
          String.format("Chat API returned status %d: %s", response.statusCode(), body));
    }

    return parseSseLines(response.body());
  }

  /**
   * Turn raw SSE lines into content fragments.
   *
   * <p>Stops at {@code [DONE]}. Lines that are not {@code data:} lines and chunks without content
   * are skipped. Closing the returned stream closes {@code lines}.
   */
  Stream<String> parseSseLines(Stream<String> lines) {
    return lines
        .map(OpenAiChatClient::ssePayload)
        .filter(Objects::nonNull)
        .takeWhile(payload -> !DONE_MARKER.equals(payload))
        .map(this::parseDeltaContent)
        .filter(content -> content != null && !content.isEmpty());
  }

  /** Payload of a {@code data:} line, or null for any other line. */
  static String ssePayload(String line) {
    if (line == null || !line.startsWith("data:")) {
      return null;
    }
    String payload = line.substring(5).trim();
    return payload.isEmpty() ? null : payload;
  }

  String parseDeltaContent(String payload) {
    try {
      JsonNode event = objectMapper.readTree(payload);
      JsonNode error = event.path("error");
      if (!error.isMissingNode() && !error.isNull()) {
        throw new ChatException(
            "Chat stream error: " + error.path("message").asText(error.toString()));
      }
      StringBuilder content = new StringBuilder();
      for (JsonNode choice : event.path("choices")) {
        JsonNode delta = choice.path("delta").path("content");
        if (!delta.isMissingNode() && !delta.isNull()) {
          content.append(delta.asText(""));
        }
      }
      return content.toString();
    } catch (JsonProcessingException e) {
      throw new ChatException("Malformed chat stream chunk: " + payload, e);
    }
  }

  String parseCompletion(String body) throws IOException {
    JsonNode root = objectMapper.readTree(body);
    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (content.isMissingNode() || content.isNull()) {
      throw new ChatException("Chat API response has no message content");
    }
    return content.asText();
  }

  private HttpRequest buildRequest(List<ChatMessage> messages, boolean stream) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("model", properties.model());
    payload.put("temperature", properties.temperature());
    payload.put("stream", stream);
    ArrayNode wireMessages = payload.putArray("messages");
    for (ChatMessage message : messages) {
      wireMessages.addObject().put("role", message.role()).put("content", message.content());
    }

    String body;
    try {
      body = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new ChatException("Failed to serialize chat request", e);
    }

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(completionsUrl()))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", stream ? "text/event-stream" : "application/json")
            .POST(BodyPublishers.ofString(body));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    return builder.build();
  }

  private String completionsUrl() {
    String base = properties.baseUrl();
    return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base)
        + "/chat/completions";
  }
}
