package com.scholary.insight.api;

import com.scholary.insight.service.AnalysisResult;
import com.scholary.insight.service.AnswerStream;
import com.scholary.insight.service.VideoInsightOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for YouTube video analysis and Q&amp;A.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Analysis (transcript extraction plus summary)
 *   <li>Streaming answers over server-sent events
 *   <li>Conversation history
 * </ul>
 */
@RestController
@RequestMapping("/api/youtube")
@Tag(name = "YouTube", description = "Video summaries and transcript-grounded Q&A")
public class YouTubeController {

  private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeController.class);

  static final String DONE_MARKER = "[DONE]";

  private final VideoInsightOrchestrator orchestrator;
  private final Executor taskExecutor;
  private final long streamTimeoutMillis;

  public YouTubeController(
      VideoInsightOrchestrator orchestrator,
      @Qualifier("taskExecutor") Executor taskExecutor,
      @Value("${insight.streamTimeoutSeconds}") long streamTimeoutSeconds) {
    this.orchestrator = orchestrator;
    this.taskExecutor = taskExecutor;
    this.streamTimeoutMillis = streamTimeoutSeconds * 1000;
  }

  @PostMapping("/analyze")
  @Operation(
      summary = "Analyze a YouTube video",
      description =
          "Fetches captions, chunks the transcript, caches the session and returns a summary. "
              + "A video analyzed before returns its cached summary.")
  public ResponseEntity<VideoResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
    LOGGER.info("Analyze request: videoUrl={}", request.videoUrl());
    AnalysisResult result = orchestrator.analyze(request.videoUrl());
    return ResponseEntity.ok(VideoResponse.from(result));
  }

  /**
   * Stream an answer as server-sent events.
   *
   * <p>Each fragment is one {@code data:} event, followed by a final {@code data: [DONE]}. Errors
   * arrive as a fragment starting with {@code "Error:"}. A client disconnect or timeout cancels
   * the answer and nothing is added to the history for it.
   */
  @PostMapping(value = "/ask", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Ask a question about an analyzed video",
      description = "Streams the answer as server-sent events terminated by [DONE].")
  public SseEmitter ask(@Valid @RequestBody AskQuestionRequest request) {
    LOGGER.info("Ask request: videoId={}", request.videoId());

    SseEmitter emitter = new SseEmitter(streamTimeoutMillis);
    AtomicReference<AnswerStream> current = new AtomicReference<>();
    AtomicBoolean aborted = new AtomicBoolean();

    Runnable cancel =
        () -> {
          aborted.set(true);
          AnswerStream answer = current.get();
          if (answer != null) {
            answer.cancel();
          }
        };
    emitter.onTimeout(
        () -> {
          LOGGER.warn("Answer stream timed out: videoId={}", request.videoId());
          cancel.run();
          emitter.complete();
        });
    emitter.onError(error -> cancel.run());
    emitter.onCompletion(cancel);

    taskExecutor.execute(() -> streamAnswer(request, emitter, current, aborted));
    return emitter;
  }

  @GetMapping("/{videoId}/history")
  @Operation(
      summary = "Get conversation history",
      description = "Questions and answers recorded for an analyzed video, oldest first.")
  public List<ConversationMessageResponse> history(@PathVariable String videoId) {
    return orchestrator.getConversationHistory(videoId).stream()
        .map(ConversationMessageResponse::from)
        .toList();
  }

  private void streamAnswer(
      AskQuestionRequest request,
      SseEmitter emitter,
      AtomicReference<AnswerStream> current,
      AtomicBoolean aborted) {
    try (AnswerStream answer = orchestrator.askQuestion(request.videoId(), request.question())) {
      current.set(answer);
      if (aborted.get()) {
        answer.cancel();
        return;
      }
      while (answer.hasNext()) {
        emitter.send(SseEmitter.event().data(answer.next()));
      }
      if (!answer.isCancelled()) {
        emitter.send(SseEmitter.event().data(DONE_MARKER));
        emitter.complete();
      }
    } catch (IOException | IllegalStateException e) {
      // client went away or the emitter already completed
      LOGGER.info(
          "Answer stream closed early: videoId={}, reason={}", request.videoId(), e.getMessage());
    }
  }
}
