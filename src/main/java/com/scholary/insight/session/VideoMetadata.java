package com.scholary.insight.session;

import java.time.Duration;

/** Descriptive data about a video as reported by the caption source. */
public record VideoMetadata(String title, String channel, Duration duration) {

  public VideoMetadata {
    title = title == null ? "" : title;
    channel = channel == null ? "" : channel;
    duration = duration == null ? Duration.ZERO : duration;
  }
}
