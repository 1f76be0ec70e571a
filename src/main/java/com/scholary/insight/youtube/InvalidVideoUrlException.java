package com.scholary.insight.youtube;

/** Thrown when a string cannot be interpreted as a YouTube video reference. */
public class InvalidVideoUrlException extends IllegalArgumentException {

  public static final String USER_MESSAGE =
      "❌ Invalid YouTube URL. Please provide a valid YouTube video link.";

  private final String videoUrl;

  public InvalidVideoUrlException(String videoUrl) {
    super(USER_MESSAGE);
    this.videoUrl = videoUrl;
  }

  public String getVideoUrl() {
    return videoUrl;
  }
}
