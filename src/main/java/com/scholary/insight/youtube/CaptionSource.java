package com.scholary.insight.youtube;

/**
 * Interface for caption retrieval.
 *
 * <p>Abstracts the caption provider so the orchestration can be tested without network access.
 */
public interface CaptionSource {

  /**
   * Fetch ordered captions and metadata for a video.
   *
   * @param videoId the video to fetch
   * @return captions ordered by start offset, plus metadata
   * @throws VideoUnavailableException if the video cannot be played
   * @throws NoCaptionsException if the video has no caption track
   * @throws CaptionSourceException on any other retrieval failure
   */
  CaptionFetchResult fetchCaptions(VideoId videoId);
}
