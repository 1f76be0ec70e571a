package com.scholary.insight.session;

/** Thrown when an update targets a video that has no live session. */
public class SessionNotFoundException extends RuntimeException {

  private final String videoId;

  public SessionNotFoundException(String videoId) {
    super("No session found for video: " + videoId);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
