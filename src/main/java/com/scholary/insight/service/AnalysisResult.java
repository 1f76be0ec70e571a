package com.scholary.insight.service;

import com.scholary.insight.session.VideoMetadata;

/** Outcome of analyzing a video: its id, metadata and summary. */
public record AnalysisResult(String videoId, VideoMetadata metadata, String summary) {}
