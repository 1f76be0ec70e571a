package com.scholary.insight.api;

import com.scholary.insight.session.ConversationMessage;
import java.time.Instant;

/** One history entry; {@code role} is "user" or "assistant". */
public record ConversationMessageResponse(String role, String content, Instant timestamp) {

  public static ConversationMessageResponse from(ConversationMessage message) {
    return new ConversationMessageResponse(
        message.role().promptName(), message.content(), message.timestamp());
  }
}
