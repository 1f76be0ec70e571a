package com.scholary.insight.youtube;

/**
 * Exception thrown when captions cannot be retrieved for a video.
 *
 * <p>Subclasses carry a message that is safe to show to the user.
 */
public class CaptionSourceException extends RuntimeException {

  public CaptionSourceException(String message) {
    super(message);
  }

  public CaptionSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
