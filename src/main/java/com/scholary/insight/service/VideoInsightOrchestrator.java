package com.scholary.insight.service;

import com.scholary.insight.chunking.TranscriptChunk;
import com.scholary.insight.chunking.TranscriptChunker;
import com.scholary.insight.llm.ChatClient;
import com.scholary.insight.llm.ChatMessage;
import com.scholary.insight.logging.StructuredLogger;
import com.scholary.insight.session.ConversationMessage;
import com.scholary.insight.session.SessionNotFoundException;
import com.scholary.insight.session.SessionStore;
import com.scholary.insight.session.VideoSession;
import com.scholary.insight.youtube.CaptionFetchResult;
import com.scholary.insight.youtube.CaptionSource;
import com.scholary.insight.youtube.VideoId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates video analysis and question answering.
 *
 * <p>Analysis flow:
 *
 * <ol>
 *   <li>Parse the URL into a video id (no side effects on failure)
 *   <li>Return the cached session if it already has a summary
 *   <li>Otherwise fetch captions, chunk them and cache a new session
 *   <li>Generate the summary and store it on the session
 * </ol>
 *
 * <p>Questions are answered as an {@link AnswerStream}. The question is recorded in the history
 * before streaming starts; the answer is recorded only if the stream runs to completion.
 */
@Service
public class VideoInsightOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoInsightOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String NOT_ANALYZED_MESSAGE =
      "Error: Video must be analyzed before asking questions. VideoId: ";
  static final String SAVE_QUESTION_FAILED_MESSAGE = "Error: Failed to save question - ";

  private final CaptionSource captionSource;
  private final TranscriptChunker chunker;
  private final SessionStore sessionStore;
  private final ChatClient chatClient;
  private final PromptBuilder promptBuilder;

  public VideoInsightOrchestrator(
      CaptionSource captionSource,
      TranscriptChunker chunker,
      SessionStore sessionStore,
      ChatClient chatClient,
      PromptBuilder promptBuilder) {
    this.captionSource = captionSource;
    this.chunker = chunker;
    this.sessionStore = sessionStore;
    this.chatClient = chatClient;
    this.promptBuilder = promptBuilder;
  }

  /**
   * Analyze a video, reusing the cached summary when there is one.
   *
   * @param videoUrl a YouTube URL or bare video id
   * @return video id, metadata and summary
   * @throws com.scholary.insight.youtube.InvalidVideoUrlException if the URL is not a YouTube
   *     video reference
   * @throws com.scholary.insight.youtube.CaptionSourceException if captions cannot be fetched
   * @throws com.scholary.insight.llm.ChatException if summary generation fails
   */
  public AnalysisResult analyze(String videoUrl) {
    VideoId videoId = VideoId.parse(videoUrl);

    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setRequestContext(correlationId, videoId.value());
    try {
      Optional<VideoSession> cached = sessionStore.get(videoId.value());
      if (cached.isPresent() && cached.get().summary().isPresent()) {
        LOGGER.info("Returning cached analysis: videoId={}", videoId);
        return toResult(cached.get());
      }

      VideoSession session;
      if (cached.isPresent()) {
        LOGGER.info("Session cached without summary, regenerating: videoId={}", videoId);
        session = cached.get();
      } else {
        session = extractAndCache(videoId);
      }

      long start = System.currentTimeMillis();
      String summary = chatClient.complete(promptBuilder.summaryPrompt(session));
      VideoSession updated = sessionStore.updateSummary(videoId.value(), summary);
      structuredLogger.logSummaryGenerated(
          videoId.value(), summary.length(), System.currentTimeMillis() - start);

      return toResult(updated);
    } catch (RuntimeException e) {
      LOGGER.error("Analysis failed: videoId={}, error={}", videoId, e.getMessage(), e);
      throw e;
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Answer a question about an analyzed video.
   *
   * <p>Never throws. Failures surface as a single {@code "Error: ..."} fragment.
   *
   * @param videoId id of a previously analyzed video
   * @param question the user's question
   * @return the answer fragments; the caller must drain or cancel it
   */
  public AnswerStream askQuestion(String videoId, String question) {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setRequestContext(correlationId, videoId);
    try {
      Optional<VideoSession> session = sessionStore.get(videoId);
      if (session.isEmpty()) {
        LOGGER.warn("Question for unknown video: videoId={}", videoId);
        return AnswerStream.ofError(NOT_ANALYZED_MESSAGE + videoId);
      }

      List<ChatMessage> prompt = promptBuilder.questionPrompt(session.get(), question);

      try {
        sessionStore.addConversationMessage(videoId, ConversationMessage.user(question));
      } catch (SessionNotFoundException e) {
        LOGGER.warn("Session expired before question was saved: videoId={}", videoId);
        return AnswerStream.ofError(SAVE_QUESTION_FAILED_MESSAGE + e.getMessage());
      }

      LOGGER.info("Answering question: videoId={}, questionChars={}", videoId, question.length());
      Stream<String> upstream = chatClient.completeStreaming(prompt);
      return new AnswerStream(upstream, new AnswerRecorder(videoId));
    } catch (RuntimeException e) {
      structuredLogger.logAnswerFailed(videoId, e.getClass().getSimpleName(), e.getMessage());
      return AnswerStream.ofError("Error: " + e.getMessage());
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Conversation history of a cached video.
   *
   * @throws SessionNotFoundException if the video has no live session
   */
  public List<ConversationMessage> getConversationHistory(String videoId) {
    return sessionStore
        .get(videoId)
        .map(VideoSession::conversationHistory)
        .orElseThrow(() -> new SessionNotFoundException(videoId));
  }

  private VideoSession extractAndCache(VideoId videoId) {
    CaptionFetchResult fetched = captionSource.fetchCaptions(videoId);
    List<TranscriptChunk> chunks = chunker.chunk(fetched.captions());
    structuredLogger.logChunkingCompleted(
        videoId.value(), fetched.captions().size(), chunks.size());

    VideoSession session = new VideoSession(videoId.value(), fetched.metadata(), chunks);
    sessionStore.put(session);
    return session;
  }

  private static AnalysisResult toResult(VideoSession session) {
    return new AnalysisResult(session.videoId(), session.metadata(), session.summary().orElse(""));
  }

  /** Persists completed answers and logs how each stream ended. */
  private final class AnswerRecorder implements AnswerStream.Listener {

    private final String videoId;
    private final long startMillis = System.currentTimeMillis();

    AnswerRecorder(String videoId) {
      this.videoId = videoId;
    }

    @Override
    public void onCompleted(String answer, int fragments) {
      try {
        sessionStore.addConversationMessage(videoId, ConversationMessage.assistant(answer));
      } catch (RuntimeException e) {
        // the answer has already been delivered
        LOGGER.error("Failed to save answer: videoId={}, error={}", videoId, e.getMessage(), e);
      }
      structuredLogger.logAnswerStreamed(
          videoId, fragments, answer.length(), System.currentTimeMillis() - startMillis);
    }

    @Override
    public void onFailed(RuntimeException error, int fragments) {
      structuredLogger.logAnswerFailed(
          videoId, error.getClass().getSimpleName(), error.getMessage());
    }

    @Override
    public void onCancelled(int fragments) {
      structuredLogger.logAnswerCancelled(videoId, fragments);
    }
  }
}
