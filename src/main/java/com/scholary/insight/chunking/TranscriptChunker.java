package com.scholary.insight.chunking;

import com.scholary.insight.youtube.CaptionCue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits an ordered caption stream into overlapping, character-bounded chunks.
 *
 * <p>Chunk boundaries always fall between captions. When the next caption would push the current
 * chunk over {@code chunkSizeChars}, the chunk is emitted and the next one is seeded with the
 * trailing captions of the emitted chunk (about {@code chunkOverlapChars} worth) so context that
 * spans a boundary appears in both chunks.
 *
 * <p>Example with a 100-char budget and 30 chars of overlap:
 *
 * <pre>
 * captions: [c0 c1 c2 c3 c4 c5 c6]
 * chunk 0:  c0 c1 c2 c3
 * chunk 1:        c2 c3 c4 c5
 * chunk 2:              c4 c5 c6
 * </pre>
 *
 * <p>The size budget is a soft limit: a caption longer than the budget is kept whole.
 */
@Component
public class TranscriptChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptChunker.class);

  private final ChunkingConfig defaultConfig;

  public TranscriptChunker(ChunkingConfig defaultConfig) {
    this.defaultConfig = defaultConfig;
  }

  /** Chunk captions with the configured budgets. */
  public List<TranscriptChunk> chunk(List<CaptionCue> captions) {
    return chunk(captions, defaultConfig);
  }

  /**
   * Chunk captions with explicit budgets.
   *
   * @param captions captions ordered by start offset
   * @param config character budgets
   * @return chunks indexed 0..n-1 in emission order; empty if there are no captions
   */
  public List<TranscriptChunk> chunk(List<CaptionCue> captions, ChunkingConfig config) {
    if (captions.isEmpty()) {
      return List.of();
    }

    List<TranscriptChunk> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int currentChars = 0;
    int chunkStartIndex = 0;
    Duration chunkStartTime = captions.get(0).startOffset();

    for (int i = 0; i < captions.size(); i++) {
      CaptionCue caption = captions.get(i);
      int captionLength = separatedLength(caption);

      if (currentChars + captionLength > config.chunkSizeChars() && currentChars > 0) {
        chunks.add(
            new TranscriptChunk(
                current.toString().trim(), chunkStartTime, caption.startOffset(), chunks.size()));

        int overlapStartIndex =
            overlapStart(captions, chunkStartIndex, i, config.chunkOverlapChars());

        LOGGER.debug(
            "Chunk {} emitted: captions=[{}-{}], overlapFrom={}",
            chunks.size() - 1,
            chunkStartIndex,
            i - 1,
            overlapStartIndex);

        current.setLength(0);
        currentChars = 0;
        chunkStartIndex = overlapStartIndex;
        chunkStartTime = captions.get(overlapStartIndex).startOffset();

        for (int j = overlapStartIndex; j <= i; j++) {
          CaptionCue overlapped = captions.get(j);
          current.append(overlapped.text()).append(' ');
          currentChars += separatedLength(overlapped);
        }
      } else {
        current.append(caption.text()).append(' ');
        currentChars += captionLength;
      }
    }

    if (currentChars > 0) {
      CaptionCue last = captions.get(captions.size() - 1);
      chunks.add(
          new TranscriptChunk(
              current.toString().trim(), chunkStartTime, last.end(), chunks.size()));
    }

    LOGGER.info(
        "Chunked {} captions into {} chunks (avg {} chars per chunk)",
        captions.size(),
        chunks.size(),
        chunks.stream().mapToInt(c -> c.text().length()).sum() / chunks.size());

    return chunks;
  }

  /**
   * Find the first caption of the overlap window for the chunk that ends before {@code
   * currentIndex}.
   *
   * <p>Walks backward from {@code currentIndex - 1} until the overlap budget is reached, but never
   * past the first caption of the emitted chunk.
   */
  static int overlapStart(
      List<CaptionCue> captions, int chunkStartIndex, int currentIndex, int overlapChars) {
    int accumulated = 0;
    int start = currentIndex;
    while (start > chunkStartIndex && accumulated < overlapChars) {
      start--;
      accumulated += separatedLength(captions.get(start));
    }
    return start;
  }

  // Caption text plus the joining space.
  private static int separatedLength(CaptionCue caption) {
    return caption.text().length() + 1;
  }
}
