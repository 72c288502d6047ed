package com.flamingo.ai.lifedigest.service.search.chunking;

/**
 * A bounded text segment prepared for vector indexing.
 *
 * @param chunkIndex 0-based position of this chunk
 * @param chunkCount total number of chunks produced from the same text
 * @param text the chunk text, {@code source.substring(spanStart, spanEnd)}
 * @param spanStart inclusive start offset in the source text
 * @param spanEnd exclusive end offset in the source text
 * @param overlapTokens tokens shared with the previous chunk (0 for the first chunk)
 * @param wordCount whitespace-delimited words in the chunk
 * @param tokenCount estimated tokens in the chunk
 * @param contentHash SHA-256 hex digest of the chunk text
 */
public record TextChunk(
    int chunkIndex,
    int chunkCount,
    String text,
    int spanStart,
    int spanEnd,
    int overlapTokens,
    int wordCount,
    int tokenCount,
    String contentHash) {

  /** Stable vector-store identity for this chunk. */
  public String documentId(String filePath, String sourceType) {
    return documentId(filePath, sourceType, chunkIndex);
  }

  public static String documentId(String filePath, String sourceType, int chunkIndex) {
    return filePath + ":" + sourceType + ":" + chunkIndex;
  }
}
