package com.scholary.insight.youtube;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.insight.session.VideoMetadata;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for YouTube captions.
 *
 * <p>Two requests per video:
 *
 * <ol>
 *   <li>POST {@code /youtubei/v1/player} returns playability, video details and the list of caption
 *       tracks.
 *   <li>GET the chosen track's {@code baseUrl} with {@code fmt=json3} returns timed caption events.
 * </ol>
 *
 * <p>The preferred language track wins; otherwise the first listed track is used. No retries: a
 * failed request surfaces as a {@link CaptionSourceException}.
 */
@Component
public class YouTubeCaptionClient implements CaptionSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeCaptionClient.class);

  private static final String CLIENT_NAME = "WEB";
  private static final String CLIENT_VERSION = "2.20240726.00.00";

  private final HttpClient httpClient;
  private final YouTubeProperties properties;
  private final ObjectMapper objectMapper;

  public YouTubeCaptionClient(YouTubeProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    LOGGER.info(
        "Initialized YouTube caption client: baseUrl={}, preferredLanguage={}",
        properties.baseUrl(),
        properties.preferredLanguage());
  }

  @Override
  public CaptionFetchResult fetchCaptions(VideoId videoId) {
    LOGGER.info("Fetching captions: videoId={}", videoId);
    try {
      PlayerInfo player = parsePlayerResponse(fetchPlayerResponse(videoId));
      List<CaptionCue> captions = parseJson3(fetchTrack(player.trackUrl()));

      LOGGER.info(
          "Fetched captions: videoId={}, title={}, captions={}",
          videoId,
          player.metadata().title(),
          captions.size());

      return new CaptionFetchResult(videoId, player.metadata(), captions);
    } catch (IOException e) {
      throw new CaptionSourceException("Failed to fetch captions for video " + videoId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CaptionSourceException("Caption fetch interrupted for video " + videoId, e);
    }
  }

  private String fetchPlayerResponse(VideoId videoId) throws IOException, InterruptedException {
    ObjectNode body = objectMapper.createObjectNode();
    ObjectNode client = body.putObject("context").putObject("client");
    client.put("clientName", CLIENT_NAME);
    client.put("clientVersion", CLIENT_VERSION);
    client.put("hl", properties.preferredLanguage());
    body.put("videoId", videoId.value());

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/youtubei/v1/player?prettyPrint=false"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
            .build();

    LOGGER.debug("Sending player request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format("YouTube player API returned status %d", response.statusCode()));
    }
    return response.body();
  }

  private String fetchTrack(String trackUrl) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(withJson3Format(trackUrl)))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format("Caption track request returned status %d", response.statusCode()));
    }
    return response.body();
  }

  /**
   * Read playability, metadata and the caption track URL out of a player response.
   *
   * @throws VideoUnavailableException if playability is anything but OK
   * @throws NoCaptionsException if no caption track is listed
   */
  PlayerInfo parsePlayerResponse(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);

    JsonNode playability = root.path("playabilityStatus");
    String status = playability.path("status").asText("");
    if (!"OK".equals(status)) {
      String reason = playability.path("reason").asText(status);
      LOGGER.warn("Video not playable: status={}, reason={}", status, reason);
      throw new VideoUnavailableException(reason);
    }

    JsonNode details = root.path("videoDetails");
    VideoMetadata metadata =
        new VideoMetadata(
            details.path("title").asText(""),
            details.path("author").asText(""),
            Duration.ofSeconds(details.path("lengthSeconds").asLong(0)));

    JsonNode tracks =
        root.path("captions").path("playerCaptionsTracklistRenderer").path("captionTracks");
    if (!tracks.isArray() || tracks.isEmpty()) {
      throw new NoCaptionsException();
    }

    JsonNode chosen = tracks.get(0);
    for (JsonNode track : tracks) {
      if (properties.preferredLanguage().equals(track.path("languageCode").asText())) {
        chosen = track;
        break;
      }
    }

    String trackUrl = chosen.path("baseUrl").asText("");
    if (trackUrl.isEmpty()) {
      throw new NoCaptionsException();
    }

    LOGGER.debug(
        "Selected caption track: language={}, kind={}, available={}",
        chosen.path("languageCode").asText(),
        chosen.path("kind").asText("manual"),
        tracks.size());

    return new PlayerInfo(metadata, trackUrl);
  }

  /**
   * Map json3 caption events to cues.
   *
   * <p>Events without {@code segs} (window and style events) are skipped. Newlines inside a cue
   * become spaces.
   */
  List<CaptionCue> parseJson3(String json) throws IOException {
    JsonNode events = objectMapper.readTree(json).path("events");
    List<CaptionCue> captions = new ArrayList<>();
    for (JsonNode event : events) {
      JsonNode segs = event.path("segs");
      if (!segs.isArray() || segs.isEmpty()) {
        continue;
      }
      StringBuilder text = new StringBuilder();
      for (JsonNode seg : segs) {
        text.append(seg.path("utf8").asText(""));
      }
      String cleaned = text.toString().replace('\n', ' ').trim();
      if (cleaned.isEmpty()) {
        continue;
      }
      captions.add(
          new CaptionCue(
              cleaned,
              Duration.ofMillis(event.path("tStartMs").asLong(0)),
              Duration.ofMillis(event.path("dDurationMs").asLong(0))));
    }
    return captions;
  }

  static String withJson3Format(String trackUrl) {
    String separator = trackUrl.contains("?") ? "&" : "?";
    return trackUrl + separator + "fmt=json3";
  }

  /** Parsed player response. */
  record PlayerInfo(VideoMetadata metadata, String trackUrl) {}
}
