package com.scholary.insight.llm;

import java.util.List;
import java.util.stream.Stream;

/**
 * Interface for chat completion.
 *
 * <p>Abstracts the LLM provider so orchestration can be tested with mocks.
 */
public interface ChatClient {

  /**
   * Run a completion and return the whole reply.
   *
   * @throws ChatException if the call fails
   */
  String complete(List<ChatMessage> messages);

  /**
   * Run a completion and return the reply as it is generated.
   *
   * <p>The stream is lazy, finite and single use. Closing it aborts the underlying response.
   *
   * @throws ChatException if the call fails before streaming starts; failures while reading
   *     surface from the stream's terminal operation
   */
  Stream<String> completeStreaming(List<ChatMessage> messages);
}
