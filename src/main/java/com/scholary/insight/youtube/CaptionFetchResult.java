package com.scholary.insight.youtube;

import com.scholary.insight.session.VideoMetadata;
import java.util.List;

/** Captions and metadata of one video. */
public record CaptionFetchResult(
    VideoId videoId, VideoMetadata metadata, List<CaptionCue> captions) {

  public CaptionFetchResult {
    captions = List.copyOf(captions);
  }
}
