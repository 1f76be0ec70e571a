package com.scholary.insight.chunking;

/**
 * Character budgets for transcript chunking.
 *
 * <p>Budgets are expressed in characters but configured in tokens; one token is roughly four
 * characters of English text.
 */
public record ChunkingConfig(int chunkSizeChars, int chunkOverlapChars) {

  public static final int DEFAULT_CHUNK_SIZE_TOKENS = 2000;
  public static final int DEFAULT_CHUNK_OVERLAP_TOKENS = 200;
  public static final int DEFAULT_CHARS_PER_TOKEN = 4;

  public ChunkingConfig {
    if (chunkSizeChars <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    if (chunkOverlapChars < 0) {
      throw new IllegalArgumentException("Chunk overlap cannot be negative");
    }
  }

  /** Create config from a token budget. */
  public static ChunkingConfig fromTokens(
      int chunkSizeTokens, int chunkOverlapTokens, int charsPerToken) {
    return new ChunkingConfig(chunkSizeTokens * charsPerToken, chunkOverlapTokens * charsPerToken);
  }

  /** 2000 tokens per chunk with 200 tokens of overlap. */
  public static ChunkingConfig defaults() {
    return fromTokens(
        DEFAULT_CHUNK_SIZE_TOKENS, DEFAULT_CHUNK_OVERLAP_TOKENS, DEFAULT_CHARS_PER_TOKEN);
  }
}
