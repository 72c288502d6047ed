package com.flamingo.ai.lifedigest.service.search.chunking;

import com.flamingo.ai.lifedigest.config.DigestConfig;

/**
 * Parameters for {@link TextChunker}.
 *
 * @param targetTokens estimated tokens per chunk
 * @param overlapPercent fraction of {@code targetTokens} repeated at the start of the next chunk
 * @param boundaryWindowChars characters searched on each side of the candidate split point
 */
public record ChunkingOptions(int targetTokens, double overlapPercent, int boundaryWindowChars) {

  public static final int DEFAULT_TARGET_TOKENS = 900;
  public static final double DEFAULT_OVERLAP_PERCENT = 0.15;
  public static final int DEFAULT_BOUNDARY_WINDOW_CHARS = 200;

  public ChunkingOptions {
    if (targetTokens <= 0) {
      throw new IllegalArgumentException("targetTokens must be positive: " + targetTokens);
    }
    if (overlapPercent < 0 || overlapPercent >= 1) {
      throw new IllegalArgumentException("overlapPercent must be in [0, 1): " + overlapPercent);
    }
    if (boundaryWindowChars < 0) {
      throw new IllegalArgumentException(
          "boundaryWindowChars must not be negative: " + boundaryWindowChars);
    }
  }

  public static ChunkingOptions defaults() {
    return new ChunkingOptions(
        DEFAULT_TARGET_TOKENS, DEFAULT_OVERLAP_PERCENT, DEFAULT_BOUNDARY_WINDOW_CHARS);
  }

  public static ChunkingOptions from(DigestConfig.Chunking chunking) {
    return new ChunkingOptions(
        chunking.getTargetTokens(),
        chunking.getOverlapPercent(),
        chunking.getBoundaryWindowChars());
  }

  public int targetChars() {
    return targetTokens * TextChunker.CHARS_PER_TOKEN;
  }

  public int overlapTokens() {
    return (int) (targetTokens * overlapPercent);
  }

  public int overlapChars() {
    return overlapTokens() * TextChunker.CHARS_PER_TOKEN;
  }
}
