package com.scholary.insight.api;

import java.time.Instant;

/** Error body returned by every endpoint. */
public record ErrorResponse(String code, String message, Instant timestamp, String path) {

  public static ErrorResponse of(String code, String message, String path) {
    return new ErrorResponse(code, message, Instant.now(), path);
  }
}
