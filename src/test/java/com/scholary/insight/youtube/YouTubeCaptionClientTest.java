package com.scholary.insight.youtube;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.insight.youtube.YouTubeCaptionClient.PlayerInfo;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class YouTubeCaptionClientTest {

  private YouTubeCaptionClient client;

  @BeforeEach
  void setUp() {
    client =
        new YouTubeCaptionClient(
            new YouTubeProperties("https://www.youtube.com", "en", 5, 5), new ObjectMapper());
  }

  @Test
  void parsePlayerResponse_shouldReadMetadataAndPreferredTrack() throws Exception {
    String json =
        """
        {
          "playabilityStatus": {"status": "OK"},
          "videoDetails": {
            "videoId": "dQw4w9WgXcQ",
            "title": "Never Gonna Give You Up",
            "author": "Rick Astley",
            "lengthSeconds": "213"
          },
          "captions": {
            "playerCaptionsTracklistRenderer": {
              "captionTracks": [
                {"baseUrl": "https://www.youtube.com/api/timedtext?lang=de", "languageCode": "de"},
                {"baseUrl": "https://www.youtube.com/api/timedtext?lang=en", "languageCode": "en"}
              ]
            }
          }
        }
        """;

    PlayerInfo info = client.parsePlayerResponse(json);

    assertThat(info.metadata().title()).isEqualTo("Never Gonna Give You Up");
    assertThat(info.metadata().channel()).isEqualTo("Rick Astley");
    assertThat(info.metadata().duration()).isEqualTo(Duration.ofSeconds(213));
    assertThat(info.trackUrl()).isEqualTo("https://www.youtube.com/api/timedtext?lang=en");
  }

  @Test
  void parsePlayerResponse_shouldFallBackToFirstTrack() throws Exception {
    String json =
        """
        {
          "playabilityStatus": {"status": "OK"},
          "videoDetails": {"title": "Video", "author": "Channel", "lengthSeconds": "60"},
          "captions": {
            "playerCaptionsTracklistRenderer": {
              "captionTracks": [
                {"baseUrl": "https://example.test/fr", "languageCode": "fr", "kind": "asr"},
                {"baseUrl": "https://example.test/es", "languageCode": "es"}
              ]
            }
          }
        }
        """;

    assertThat(client.parsePlayerResponse(json).trackUrl()).isEqualTo("https://example.test/fr");
  }

  @Test
  void parsePlayerResponse_shouldRejectUnplayableVideo() {
    String json =
        """
        {"playabilityStatus": {"status": "LOGIN_REQUIRED", "reason": "Sign in to confirm your age"}}
        """;

    assertThatThrownBy(() -> client.parsePlayerResponse(json))
        .isInstanceOf(VideoUnavailableException.class)
        .hasMessage(VideoUnavailableException.USER_MESSAGE)
        .satisfies(
            e ->
                assertThat(((VideoUnavailableException) e).getReason())
                    .isEqualTo("Sign in to confirm your age"));
  }

  @Test
  void parsePlayerResponse_shouldRejectVideoWithoutCaptions() {
    String json =
        """
        {
          "playabilityStatus": {"status": "OK"},
          "videoDetails": {"title": "Silent film", "author": "Channel", "lengthSeconds": "60"}
        }
        """;

    assertThatThrownBy(() -> client.parsePlayerResponse(json))
        .isInstanceOf(NoCaptionsException.class)
        .isInstanceOf(CaptionSourceException.class);
  }

  @Test
  void parseJson3_shouldMapEventsToCues() throws Exception {
    String json =
        """
        {
          "wireMagic": "pb3",
          "events": [
            {"tStartMs": 0, "dDurationMs": 5000, "id": 1, "wpWinPosId": 1},
            {"tStartMs": 0, "dDurationMs": 2000, "segs": [{"utf8": "Hello"}, {"utf8": " there"}]},
            {"tStartMs": 2000, "dDurationMs": 2500, "segs": [{"utf8": "second\\nline"}]},
            {"tStartMs": 4500, "dDurationMs": 100, "segs": [{"utf8": "\\n"}]},
            {"tStartMs": 4600, "dDurationMs": 1400, "segs": [{"utf8": "[Music]"}]}
          ]
        }
        """;

    List<CaptionCue> cues = client.parseJson3(json);

    assertThat(cues)
        .extracting(CaptionCue::text)
        .containsExactly("Hello there", "second line", "[Music]");
    assertThat(cues.get(1).startOffset()).isEqualTo(Duration.ofMillis(2000));
    assertThat(cues.get(1).duration()).isEqualTo(Duration.ofMillis(2500));
    assertThat(cues.get(2).end()).isEqualTo(Duration.ofSeconds(6));
  }

  @Test
  void parseJson3_shouldReturnEmptyListWhenNoEvents() throws Exception {
    assertThat(client.parseJson3("{}")).isEmpty();
  }

  @Test
  void withJson3Format_shouldAppendFormatParameter() {
    assertThat(YouTubeCaptionClient.withJson3Format("https://x.test/timedtext?v=1&lang=en"))
        .isEqualTo("https://x.test/timedtext?v=1&lang=en&fmt=json3");
    assertThat(YouTubeCaptionClient.withJson3Format("https://x.test/timedtext"))
        .isEqualTo("https://x.test/timedtext?fmt=json3");
  }
}
