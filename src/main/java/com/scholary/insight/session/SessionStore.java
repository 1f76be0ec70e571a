package com.scholary.insight.session;

import java.util.Optional;

/**
 * Expiring, concurrency-safe store of per-video sessions.
 *
 * <p>Reads never block. Updates to the same video are applied one at a time, each seeing the result
 * of the previous one; updates to different videos do not wait on each other.
 */
public interface SessionStore {

  /**
   * Look up a live session. A hit refreshes the sliding expiry.
   *
   * @param videoId the video identifier
   * @return the session, or empty if absent or expired
   */
  Optional<VideoSession> get(String videoId);

  /** Whether a live session exists. Counts as an access for sliding expiry. */
  boolean exists(String videoId);

  /** Insert or fully replace a session. Resets both expiry clocks. */
  void put(VideoSession session);

  /**
   * Set the summary of an existing session.
   *
   * @return the stored session
   * @throws SessionNotFoundException if no live session exists; nothing is stored
   */
  VideoSession updateSummary(String videoId, String summary);

  /**
   * Append a message to the conversation history of an existing session.
   *
   * @return the stored session
   * @throws SessionNotFoundException if no live session exists; nothing is stored
   */
  VideoSession addConversationMessage(String videoId, ConversationMessage message);
}
