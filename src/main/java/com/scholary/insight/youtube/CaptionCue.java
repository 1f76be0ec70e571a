package com.scholary.insight.youtube;

import java.time.Duration;
import java.util.Objects;

/**
 * A single timestamped caption as returned by the caption source.
 *
 * <p>One cue per spoken utterance. Cues arrive ordered by start offset.
 */
public record CaptionCue(String text, Duration startOffset, Duration duration) {

  public CaptionCue {
    text = text == null ? "" : text;
    Objects.requireNonNull(startOffset, "startOffset");
    Objects.requireNonNull(duration, "duration");
  }

  /** End of this cue (start offset plus duration). */
  public Duration end() {
    return startOffset.plus(duration);
  }
}
