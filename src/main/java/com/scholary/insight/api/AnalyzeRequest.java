package com.scholary.insight.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/** Request to analyze a YouTube video. */
public record AnalyzeRequest(
    @NotBlank
        @Schema(
            description = "YouTube URL or bare video id",
            example = "https://www.youtube.com/watch?v=dQw4w9WgXcQ")
        String videoUrl) {}
