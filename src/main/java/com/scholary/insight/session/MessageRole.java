package com.scholary.insight.session;

import java.util.Locale;

/** Author of a conversation message. */
public enum MessageRole {
  USER,
  ASSISTANT;

  /** Lowercase name as used in chat prompts ("user", "assistant"). */
  public String promptName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
