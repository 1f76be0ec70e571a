package com.scholary.insight.llm;

/**
 * Exception thrown when chat completion calls fail.
 *
 * <p>This could be due to network issues, an error status from the provider, or a response that
 * cannot be parsed.
 */
public class ChatException extends RuntimeException {

  public ChatException(String message) {
    super(message);
  }

  public ChatException(String message, Throwable cause) {
    super(message, cause);
  }
}
