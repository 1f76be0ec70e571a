package com.scholary.insight.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/** Question about a previously analyzed video. */
public record AskQuestionRequest(
    @NotBlank @Schema(description = "Id returned by /analyze", example = "dQw4w9WgXcQ")
        String videoId,
    @NotBlank @Schema(description = "Question about the video content") String question) {}
