package com.scholary.insight.youtube;

/** The video is private, deleted, age-restricted, region-locked or otherwise unplayable. */
public class VideoUnavailableException extends CaptionSourceException {

  public static final String USER_MESSAGE =
      "❌ Video is unavailable. It may be private, deleted, age-restricted, or region-locked.";

  private final String reason;

  public VideoUnavailableException(String reason) {
    super(USER_MESSAGE);
    this.reason = reason;
  }

  /** Reason reported by YouTube, for logs. */
  public String getReason() {
    return reason;
  }
}
