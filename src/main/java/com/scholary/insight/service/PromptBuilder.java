package com.scholary.insight.service;

import com.scholary.insight.llm.ChatMessage;
import com.scholary.insight.session.ConversationMessage;
import com.scholary.insight.session.VideoMetadata;
import com.scholary.insight.session.VideoSession;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the chat prompts for summaries and questions.
 *
 * <p>Both prompts carry the full transcript. The question prompt also carries the summary (when
 * there is one) and the last {@code maxHistoryMessages} conversation turns.
 */
@Component
public class PromptBuilder {

  private final int maxHistoryMessages;

  public PromptBuilder(
      @Value("${insight.conversation.maxHistoryMessages:10}") int maxHistoryMessages) {
    this.maxHistoryMessages = maxHistoryMessages;
  }

  public List<ChatMessage> summaryPrompt(VideoSession session) {
    VideoMetadata metadata = session.metadata();
    String prompt =
        "Please provide a comprehensive summary of the following YouTube video transcript.\n"
            + "The video title is: \""
            + metadata.title()
            + "\"\n"
            + "The channel is: \""
            + metadata.channel()
            + "\"\n\n"
            + "Transcript:\n"
            + session.transcriptText()
            + "\n\n"
            + "Please provide a well-structured summary that captures the main points, key"
            + " insights, and overall message of the video.";
    return List.of(ChatMessage.user(prompt));
  }

  /**
   * Prompt for a question about an analyzed video.
   *
   * @param session session as it was before the question was recorded
   * @param question the user's question
   */
  public List<ChatMessage> questionPrompt(VideoSession session, String question) {
    VideoMetadata metadata = session.metadata();
    StringBuilder prompt = new StringBuilder();
    prompt.append("You are an AI assistant helping answer questions about a YouTube video.\n\n");
    prompt.append("Video Information:\n");
    prompt.append("Title: \"").append(metadata.title()).append("\"\n");
    prompt.append("Channel: \"").append(metadata.channel()).append("\"\n");
    prompt.append("Duration: ").append(formatDuration(metadata.duration())).append("\n\n");

    session
        .summary()
        .ifPresent(summary -> prompt.append("Video Summary: ").append(summary).append("\n\n"));

    List<ConversationMessage> history = session.recentHistory(maxHistoryMessages);
    if (!history.isEmpty()) {
      prompt.append("Previous conversation:\n");
      for (ConversationMessage message : history) {
        prompt
            .append(message.role().promptName())
            .append(": ")
            .append(message.content())
            .append('\n');
      }
      prompt.append('\n');
    }

    prompt.append("Video Transcript:\n").append(session.transcriptText()).append("\n\n");
    prompt.append("User Question: ").append(question).append("\n\n");
    prompt.append(
        "Please provide a helpful and accurate answer based on the video content. If the"
            + " information is not available in the transcript, please indicate that clearly.");
    return List.of(ChatMessage.user(prompt.toString()));
  }

  // H:MM:SS
  static String formatDuration(Duration duration) {
    long seconds = duration.getSeconds();
    return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }
}
