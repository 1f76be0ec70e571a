package com.scholary.insight.youtube;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * An 11-character YouTube video identifier.
 *
 * <p>Accepted inputs:
 *
 * <ul>
 *   <li>{@code https://www.youtube.com/watch?v=ID} (any extra query parameters)
 *   <li>{@code https://youtu.be/ID}
 *   <li>{@code https://www.youtube.com/embed/ID}, {@code /shorts/ID}, {@code /live/ID}, {@code
 *       /v/ID}
 *   <li>a bare {@code ID}
 * </ul>
 */
public record VideoId(String value) {

  private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{11}");

  private static final Set<String> YOUTUBE_HOSTS =
      Set.of(
          "youtube.com",
          "www.youtube.com",
          "m.youtube.com",
          "music.youtube.com",
          "youtube-nocookie.com",
          "www.youtube-nocookie.com");

  private static final Set<String> PATH_PREFIXES = Set.of("embed", "shorts", "live", "v");

  public VideoId {
    if (value == null || !ID_PATTERN.matcher(value).matches()) {
      throw new InvalidVideoUrlException(value);
    }
  }

  /**
   * Extract the video id from a URL or bare id.
   *
   * @throws InvalidVideoUrlException if no id can be found
   */
  public static VideoId parse(String videoUrl) {
    if (videoUrl == null || videoUrl.isBlank()) {
      throw new InvalidVideoUrlException(videoUrl);
    }
    String trimmed = videoUrl.trim();
    if (ID_PATTERN.matcher(trimmed).matches()) {
      return new VideoId(trimmed);
    }

    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      throw new InvalidVideoUrlException(videoUrl);
    }
    String host = uri.getHost();
    if (host == null || uri.getScheme() == null) {
      throw new InvalidVideoUrlException(videoUrl);
    }
    host = host.toLowerCase(Locale.ROOT);

    String candidate = null;
    if (host.equals("youtu.be")) {
      candidate = firstPathSegment(uri.getPath());
    } else if (YOUTUBE_HOSTS.contains(host)) {
      candidate = queryParameter(uri.getRawQuery(), "v");
      if (candidate == null) {
        candidate = prefixedPathSegment(uri.getPath());
      }
    }

    if (candidate == null || !ID_PATTERN.matcher(candidate).matches()) {
      throw new InvalidVideoUrlException(videoUrl);
    }
    return new VideoId(candidate);
  }

  /** Canonical watch URL for this video. */
  public String watchUrl() {
    return "https://www.youtube.com/watch?v=" + value;
  }

  @Override
  public String toString() {
    return value;
  }

  private static String firstPathSegment(String path) {
    if (path == null) {
      return null;
    }
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        return segment;
      }
    }
    return null;
  }

  // "/embed/ID", "/shorts/ID", ...
  private static String prefixedPathSegment(String path) {
    if (path == null) {
      return null;
    }
    String[] parts = path.split("/");
    for (int i = 0; i < parts.length - 1; i++) {
      if (PATH_PREFIXES.contains(parts[i])) {
        return parts[i + 1];
      }
    }
    return null;
  }

  private static String queryParameter(String rawQuery, String name) {
    if (rawQuery == null) {
      return null;
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).equals(name)) {
        String value = pair.substring(eq + 1);
        return value.isEmpty() ? null : value;
      }
    }
    return null;
  }
}
