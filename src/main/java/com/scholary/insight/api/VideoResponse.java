package com.scholary.insight.api;

import com.scholary.insight.service.AnalysisResult;

/** Analysis result returned by the analyze endpoint. */
public record VideoResponse(String videoId, MetadataResponse metadata, String summary) {

  public record MetadataResponse(String title, String channel, long durationSeconds) {}

  public static VideoResponse from(AnalysisResult result) {
    return new VideoResponse(
        result.videoId(),
        new MetadataResponse(
            result.metadata().title(),
            result.metadata().channel(),
            result.metadata().duration().getSeconds()),
        result.summary());
  }
}
