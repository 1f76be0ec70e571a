package com.scholary.insight.session;

import com.scholary.insight.chunking.TranscriptChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cached state for one analyzed video.
 *
 * <p>Immutable. Changes are made by copying through {@link #withSummary} and {@link #withMessage},
 * which only the {@link SessionStore} calls while holding the per-video lock. Chunks and video id
 * never change after creation and the conversation history only grows.
 */
public final class VideoSession {

  private final String videoId;
  private final VideoMetadata metadata;
  private final List<TranscriptChunk> chunks;
  private final String summary;
  private final List<ConversationMessage> conversationHistory;

  public VideoSession(String videoId, VideoMetadata metadata, List<TranscriptChunk> chunks) {
    this(videoId, metadata, chunks, null, List.of());
  }

  private VideoSession(
      String videoId,
      VideoMetadata metadata,
      List<TranscriptChunk> chunks,
      String summary,
      List<ConversationMessage> conversationHistory) {
    this.videoId = Objects.requireNonNull(videoId, "videoId");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.chunks = List.copyOf(chunks);
    this.summary = summary;
    this.conversationHistory = List.copyOf(conversationHistory);
  }

  public String videoId() {
    return videoId;
  }

  public VideoMetadata metadata() {
    return metadata;
  }

  public List<TranscriptChunk> chunks() {
    return chunks;
  }

  public Optional<String> summary() {
    return Optional.ofNullable(summary);
  }

  public List<ConversationMessage> conversationHistory() {
    return conversationHistory;
  }

  /** Chunk texts joined by single spaces. Overlapping captions appear once per chunk. */
  public String transcriptText() {
    StringBuilder sb = new StringBuilder();
    for (TranscriptChunk chunk : chunks) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(chunk.text());
    }
    return sb.toString();
  }

  /** Last {@code count} history messages in insertion order. */
  public List<ConversationMessage> recentHistory(int count) {
    int from = Math.max(0, conversationHistory.size() - count);
    return conversationHistory.subList(from, conversationHistory.size());
  }

  VideoSession withSummary(String newSummary) {
    return new VideoSession(videoId, metadata, chunks, newSummary, conversationHistory);
  }

  VideoSession withMessage(ConversationMessage message) {
    List<ConversationMessage> history = new ArrayList<>(conversationHistory.size() + 1);
    history.addAll(conversationHistory);
    history.add(Objects.requireNonNull(message, "message"));
    return new VideoSession(videoId, metadata, chunks, summary, history);
  }

  @Override
  public String toString() {
    return String.format(
        "VideoSession[videoId=%s, chunks=%d, hasSummary=%s, messages=%d]",
        videoId, chunks.size(), summary != null, conversationHistory.size());
  }
}
