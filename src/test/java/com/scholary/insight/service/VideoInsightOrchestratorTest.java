package com.scholary.insight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.insight.chunking.ChunkingConfig;
import com.scholary.insight.chunking.TranscriptChunker;
import com.scholary.insight.llm.ChatClient;
import com.scholary.insight.llm.ChatException;
import com.scholary.insight.llm.ChatMessage;
import com.scholary.insight.session.CaffeineSessionStore;
import com.scholary.insight.session.ConversationMessage;
import com.scholary.insight.session.MessageRole;
import com.scholary.insight.session.SessionNotFoundException;
import com.scholary.insight.session.VideoMetadata;
import com.scholary.insight.session.VideoSession;
import com.scholary.insight.youtube.CaptionCue;
import com.scholary.insight.youtube.CaptionFetchResult;
import com.scholary.insight.youtube.CaptionSource;
import com.scholary.insight.youtube.InvalidVideoUrlException;
import com.scholary.insight.youtube.NoCaptionsException;
import com.scholary.insight.youtube.VideoId;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VideoInsightOrchestratorTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";
  private static final String VIDEO_URL = "https://www.youtube.com/watch?v=" + VIDEO_ID;

  @Mock private CaptionSource captionSource;
  @Mock private ChatClient chatClient;
  @Captor private ArgumentCaptor<List<ChatMessage>> promptCaptor;

  private CaffeineSessionStore sessionStore;
  private VideoInsightOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    sessionStore =
        new CaffeineSessionStore(Duration.ofHours(24), Duration.ofHours(4), Ticker.systemTicker());
    orchestrator =
        new VideoInsightOrchestrator(
            captionSource,
            new TranscriptChunker(ChunkingConfig.defaults()),
            sessionStore,
            chatClient,
            new PromptBuilder(10));
  }

  @AfterEach
  void tearDown() {
    sessionStore.close();
  }

  @Test
  void analyze_shouldFetchChunkCacheAndSummarize() {
    when(captionSource.fetchCaptions(new VideoId(VIDEO_ID))).thenReturn(captions());
    when(chatClient.complete(any())).thenReturn("A video about Java.");

    AnalysisResult result = orchestrator.analyze(VIDEO_URL);

    assertThat(result.videoId()).isEqualTo(VIDEO_ID);
    assertThat(result.metadata().title()).isEqualTo("Learning Java");
    assertThat(result.summary()).isEqualTo("A video about Java.");

    VideoSession cached = sessionStore.get(VIDEO_ID).orElseThrow();
    assertThat(cached.summary()).contains("A video about Java.");
    assertThat(cached.chunks()).hasSize(1);
    assertThat(cached.conversationHistory()).isEmpty();

    verify(chatClient).complete(promptCaptor.capture());
    String prompt = promptCaptor.getValue().get(0).content();
    assertThat(prompt)
        .contains("comprehensive summary")
        .contains("The video title is: \"Learning Java\"")
        .contains("The channel is: \"Code Channel\"")
        .contains("Welcome to the course. Today we cover records.");
  }

  @Test
  void analyze_shouldReuseCachedSummary() {
    when(captionSource.fetchCaptions(new VideoId(VIDEO_ID))).thenReturn(captions());
    when(chatClient.complete(any())).thenReturn("Summary");

    orchestrator.analyze(VIDEO_URL);
    AnalysisResult second = orchestrator.analyze("https://youtu.be/" + VIDEO_ID);

    assertThat(second.summary()).isEqualTo("Summary");
    verify(captionSource, times(1)).fetchCaptions(any());
    verify(chatClient, times(1)).complete(any());
  }

  @Test
  void analyze_shouldRegenerateSummaryForCachedSessionWithoutOne() {
    sessionStore.put(session());
    when(chatClient.complete(any())).thenReturn("Fresh summary");

    AnalysisResult result = orchestrator.analyze(VIDEO_URL);

    assertThat(result.summary()).isEqualTo("Fresh summary");
    verifyNoInteractions(captionSource);
  }

  @Test
  void analyze_shouldRejectInvalidUrlWithoutSideEffects() {
    assertThatThrownBy(() -> orchestrator.analyze("https://vimeo.com/123"))
        .isInstanceOf(InvalidVideoUrlException.class);

    verifyNoInteractions(captionSource, chatClient);
  }

  @Test
  void analyze_shouldNotCreateSessionWhenCaptionsAreMissing() {
    when(captionSource.fetchCaptions(any())).thenThrow(new NoCaptionsException());

    assertThatThrownBy(() -> orchestrator.analyze(VIDEO_URL))
        .isInstanceOf(NoCaptionsException.class);

    assertThat(sessionStore.exists(VIDEO_ID)).isFalse();
    verifyNoInteractions(chatClient);
  }

  @Test
  void analyze_shouldKeepSessionWithoutSummaryWhenSummaryFails() {
    when(captionSource.fetchCaptions(any())).thenReturn(captions());
    when(chatClient.complete(any())).thenThrow(new ChatException("Chat API returned status 503"));

    assertThatThrownBy(() -> orchestrator.analyze(VIDEO_URL)).isInstanceOf(ChatException.class);

    VideoSession cached = sessionStore.get(VIDEO_ID).orElseThrow();
    assertThat(cached.summary()).isEmpty();
  }

  @Test
  void askQuestion_shouldFailFastForUnknownVideo() {
    List<String> fragments = drain(orchestrator.askQuestion("unknown", "Anything?"));

    assertThat(fragments)
        .containsExactly(
            "Error: Video must be analyzed before asking questions. VideoId: unknown");
    verifyNoInteractions(chatClient);
    assertThat(sessionStore.exists("unknown")).isFalse();
  }

  @Test
  void askQuestion_shouldStreamAnswerAndRecordHistory() {
    sessionStore.put(session());
    sessionStore.updateSummary(VIDEO_ID, "Records and sealed types.");
    when(chatClient.completeStreaming(any())).thenReturn(Stream.of("It is ", "about ", "records."));

    List<String> fragments = drain(orchestrator.askQuestion(VIDEO_ID, "What is it about?"));

    assertThat(fragments).containsExactly("It is ", "about ", "records.");
    List<ConversationMessage> history =
        sessionStore.get(VIDEO_ID).orElseThrow().conversationHistory();
    assertThat(history)
        .extracting(ConversationMessage::role, ConversationMessage::content)
        .containsExactly(
            tuple(MessageRole.USER, "What is it about?"),
            tuple(MessageRole.ASSISTANT, "It is about records."));

    verify(chatClient).completeStreaming(promptCaptor.capture());
    String prompt = promptCaptor.getValue().get(0).content();
    assertThat(prompt)
        .contains("Title: \"Learning Java\"")
        .contains("Duration: 0:10:00")
        .contains("Video Summary: Records and sealed types.")
        .contains("User Question: What is it about?")
        .doesNotContain("Previous conversation:");
  }

  @Test
  void askQuestion_shouldIncludePreviousTurnsInPrompt() {
    sessionStore.put(session());
    when(chatClient.completeStreaming(any()))
        .thenReturn(Stream.of("First answer."))
        .thenReturn(Stream.of("Second answer."));

    drain(orchestrator.askQuestion(VIDEO_ID, "First question?"));
    drain(orchestrator.askQuestion(VIDEO_ID, "Second question?"));

    verify(chatClient, times(2)).completeStreaming(promptCaptor.capture());
    String secondPrompt = promptCaptor.getAllValues().get(1).get(0).content();
    assertThat(secondPrompt)
        .contains("Previous conversation:\nuser: First question?\nassistant: First answer.\n")
        .doesNotContain("Video Summary:");
    assertThat(sessionStore.get(VIDEO_ID).orElseThrow().conversationHistory()).hasSize(4);
  }

  @Test
  void askQuestion_shouldDiscardPartialAnswerWhenCancelled() {
    sessionStore.put(session());
    when(chatClient.completeStreaming(any())).thenReturn(Stream.of("Partial ", "answer ", "here"));

    AnswerStream stream = orchestrator.askQuestion(VIDEO_ID, "Question?");
    assertThat(stream.next()).isEqualTo("Partial ");
    stream.cancel();

    assertThat(stream.hasNext()).isFalse();
    assertThat(sessionStore.get(VIDEO_ID).orElseThrow().conversationHistory())
        .extracting(ConversationMessage::role)
        .containsExactly(MessageRole.USER);
  }

  @Test
  void askQuestion_shouldReturnErrorFragmentWhenStreamingCannotStart() {
    sessionStore.put(session());
    when(chatClient.completeStreaming(any()))
        .thenThrow(new ChatException("Chat API returned status 500: oops"));

    List<String> fragments = drain(orchestrator.askQuestion(VIDEO_ID, "Question?"));

    assertThat(fragments).containsExactly("Error: Chat API returned status 500: oops");
    assertThat(sessionStore.get(VIDEO_ID).orElseThrow().conversationHistory()).hasSize(1);
  }

  @Test
  void askQuestion_shouldEndWithErrorFragmentWhenStreamFailsMidway() {
    sessionStore.put(session());
    Stream<String> failing =
        Stream.of("Good start", "broken")
            .map(
                fragment -> {
                  if (fragment.equals("broken")) {
                    throw new ChatException("Malformed chat stream chunk");
                  }
                  return fragment;
                });
    when(chatClient.completeStreaming(any())).thenReturn(failing);

    List<String> fragments = drain(orchestrator.askQuestion(VIDEO_ID, "Question?"));

    assertThat(fragments).containsExactly("Good start", "Error: Malformed chat stream chunk");
    assertThat(sessionStore.get(VIDEO_ID).orElseThrow().conversationHistory()).hasSize(1);
  }

  @Test
  void getConversationHistory_shouldThrowForUnknownVideo() {
    assertThatThrownBy(() -> orchestrator.getConversationHistory("missing"))
        .isInstanceOf(SessionNotFoundException.class);
  }

  private static List<String> drain(AnswerStream stream) {
    List<String> fragments = new ArrayList<>();
    while (stream.hasNext()) {
      fragments.add(stream.next());
    }
    return fragments;
  }

  private static CaptionFetchResult captions() {
    return new CaptionFetchResult(
        new VideoId(VIDEO_ID),
        metadata(),
        List.of(
            new CaptionCue("Welcome to the course.", Duration.ZERO, Duration.ofSeconds(3)),
            new CaptionCue(
                "Today we cover records.", Duration.ofSeconds(3), Duration.ofSeconds(3))));
  }

  private static VideoSession session() {
    return new VideoSession(
        VIDEO_ID,
        metadata(),
        new TranscriptChunker(ChunkingConfig.defaults()).chunk(captions().captions()));
  }

  private static VideoMetadata metadata() {
    return new VideoMetadata("Learning Java", "Code Channel", Duration.ofMinutes(10));
  }
}
