package com.scholary.insight.chunking;

import java.time.Duration;

/**
 * A bounded span of caption text sized for an LLM context window.
 *
 * <p>Consecutive chunks share some captions at their boundary, so {@code startTime} of chunk
 * {@code i+1} is usually before {@code endTime} of chunk {@code i}.
 */
public record TranscriptChunk(String text, Duration startTime, Duration endTime, int index) {

  public Duration duration() {
    return endTime.minus(startTime);
  }
}
