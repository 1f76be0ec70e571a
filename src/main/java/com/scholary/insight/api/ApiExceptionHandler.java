package com.scholary.insight.api;

import com.scholary.insight.llm.ChatException;
import com.scholary.insight.session.SessionNotFoundException;
import com.scholary.insight.youtube.CaptionSourceException;
import com.scholary.insight.youtube.InvalidVideoUrlException;
import com.scholary.insight.youtube.NoCaptionsException;
import com.scholary.insight.youtube.VideoUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 *
 * <p>Caption problems the user can act on (bad URL, unavailable video, no captions) are 400 with a
 * user-facing message. Upstream failures are 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidVideoUrlException.class)
  public ResponseEntity<ErrorResponse> handleInvalidVideoUrl(
      InvalidVideoUrlException ex, HttpServletRequest request) {
    LOGGER.warn("Invalid video URL at {}: {}", request.getRequestURI(), ex.getVideoUrl());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_VIDEO_URL", ex.getMessage(), request);
  }

  @ExceptionHandler(VideoUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleVideoUnavailable(
      VideoUnavailableException ex, HttpServletRequest request) {
    LOGGER.warn("Video unavailable at {}: reason={}", request.getRequestURI(), ex.getReason());
    return respond(HttpStatus.BAD_REQUEST, "VIDEO_UNAVAILABLE", ex.getMessage(), request);
  }

  @ExceptionHandler(NoCaptionsException.class)
  public ResponseEntity<ErrorResponse> handleNoCaptions(
      NoCaptionsException ex, HttpServletRequest request) {
    LOGGER.warn("No captions at {}", request.getRequestURI());
    return respond(HttpStatus.BAD_REQUEST, "NO_CAPTIONS", ex.getMessage(), request);
  }

  @ExceptionHandler(CaptionSourceException.class)
  public ResponseEntity<ErrorResponse> handleCaptionSource(
      CaptionSourceException ex, HttpServletRequest request) {
    LOGGER.error("Caption source failure at {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, "CAPTION_SOURCE_ERROR", ex.getMessage(), request);
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {
    LOGGER.warn("Session not found at {}: videoId={}", request.getRequestURI(), ex.getVideoId());
    return respond(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage(), request);
  }

  @ExceptionHandler(ChatException.class)
  public ResponseEntity<ErrorResponse> handleChat(ChatException ex, HttpServletRequest request) {
    LOGGER.error("Chat failure at {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, "LLM_ERROR", ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed at {}: {}", request.getRequestURI(), message);
    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    LOGGER.warn("Malformed request at {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        "MALFORMED_REQUEST",
        "Request body is missing or malformed",
        request);
  }

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<ErrorResponse> handleRejected(
      RejectedExecutionException ex, HttpServletRequest request) {
    LOGGER.warn("Answer stream rejected at {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        "BUSY",
        "Too many concurrent questions, retry later",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
    LOGGER.error("Unhandled exception at {}", request.getRequestURI(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "INTERNAL_ERROR",
        "An unexpected error occurred",
        request);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(ErrorResponse.of(code, message, request.getRequestURI()));
  }
}
