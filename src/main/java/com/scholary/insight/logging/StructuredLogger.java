package com.scholary.insight.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts its event fields into the MDC for exactly one log call, so they show up as
 * queryable fields in the log output without leaking into later lines.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log transcript chunking for a video. */
  public void logChunkingCompleted(String videoId, int captionCount, int chunkCount) {
    try {
      MDC.put("event_type", "chunking_completed");
      MDC.put("captionCount", String.valueOf(captionCount));
      MDC.put("chunkCount", String.valueOf(chunkCount));

      logger.info(
          "Chunking completed: videoId={}, captions={}, chunks={}",
          videoId,
          captionCount,
          chunkCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a session being stored or replaced. */
  public void logSessionCached(String videoId, int chunkCount) {
    try {
      MDC.put("event_type", "session_cached");
      MDC.put("chunkCount", String.valueOf(chunkCount));

      logger.info("Session cached: videoId={}, chunks={}", videoId, chunkCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a serialized session update. */
  public void logSessionUpdated(String videoId, String field, int historySize) {
    try {
      MDC.put("event_type", "session_updated");
      MDC.put("field", field);
      MDC.put("historySize", String.valueOf(historySize));

      logger.debug(
          "Session updated: videoId={}, field={}, history={}", videoId, field, historySize);
    } finally {
      clearEventFields();
    }
  }

  /** Log a generated summary. */
  public void logSummaryGenerated(String videoId, int summaryChars, long durationMs) {
    try {
      MDC.put("event_type", "summary_generated");
      MDC.put("summaryChars", String.valueOf(summaryChars));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Summary generated: videoId={}, chars={}, duration={}ms",
          videoId,
          summaryChars,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a fully streamed answer. */
  public void logAnswerStreamed(String videoId, int fragments, int answerChars, long durationMs) {
    try {
      MDC.put("event_type", "answer_streamed");
      MDC.put("fragments", String.valueOf(fragments));
      MDC.put("answerChars", String.valueOf(answerChars));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Answer streamed: videoId={}, fragments={}, chars={}, duration={}ms",
          videoId,
          fragments,
          answerChars,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log an answer stream cancelled by the consumer. */
  public void logAnswerCancelled(String videoId, int fragments) {
    try {
      MDC.put("event_type", "answer_cancelled");
      MDC.put("fragments", String.valueOf(fragments));

      logger.info("Answer cancelled: videoId={}, fragmentsForwarded={}", videoId, fragments);
    } finally {
      clearEventFields();
    }
  }

  /** Log an answer stream that ended with an error fragment. */
  public void logAnswerFailed(String videoId, String errorType, String message) {
    try {
      MDC.put("event_type", "answer_failed");
      MDC.put("errorType", errorType);

      logger.error("Answer failed: videoId={}, error={}, message={}", videoId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String correlationId, String videoId) {
    MDC.put("correlationId", correlationId);
    if (videoId != null) {
      MDC.put("videoId", videoId);
    }
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("correlationId");
    MDC.remove("videoId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("captionCount");
    MDC.remove("chunkCount");
    MDC.remove("field");
    MDC.remove("historySize");
    MDC.remove("summaryChars");
    MDC.remove("durationMs");
    MDC.remove("fragments");
    MDC.remove("answerChars");
    MDC.remove("errorType");
  }
}
