package com.scholary.insight.youtube;

/** The video exists but has no caption track. */
public class NoCaptionsException extends CaptionSourceException {

  public static final String USER_MESSAGE =
      "❌ No captions available for this video. The video creator has not enabled captions.";

  public NoCaptionsException() {
    super(USER_MESSAGE);
  }
}
