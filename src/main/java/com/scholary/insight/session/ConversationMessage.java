package com.scholary.insight.session;

import java.time.Instant;
import java.util.Objects;

/** One turn of the question/answer conversation about a video. */
public record ConversationMessage(MessageRole role, String content, Instant timestamp) {

  public ConversationMessage {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static ConversationMessage user(String content) {
    return new ConversationMessage(MessageRole.USER, content, Instant.now());
  }

  public static ConversationMessage assistant(String content) {
    return new ConversationMessage(MessageRole.ASSISTANT, content, Instant.now());
  }
}
