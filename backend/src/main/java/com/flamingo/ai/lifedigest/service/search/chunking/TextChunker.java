package com.flamingo.ai.lifedigest.service.search.chunking;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping, token-bounded chunks with content-addressed identities.
 *
 * <p>Tokens are estimated as {@code ceil(chars / 4)}. Split points prefer, in order: a Markdown
 * heading line start, a paragraph break, the end of a sentence, any whitespace. A candidate
 * boundary is accepted only past the first half-window of the search slice; otherwise the next
 * pattern is tried, and a hard split is used when none qualifies.
 */
@Component
@Slf4j
public class TextChunker {

  static final int CHARS_PER_TOKEN = 4;

  private static final List<BoundaryPattern> BOUNDARY_PATTERNS =
      List.of(
          new BoundaryPattern(Pattern.compile("\n#{1,6}\\s+"), 1),
          new BoundaryPattern(Pattern.compile("\n\n+"), 2),
          new BoundaryPattern(Pattern.compile("[.!?]\\s+"), 2),
          new BoundaryPattern(Pattern.compile("\\s+"), 1));

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Chunks text with the given options.
   *
   * @param text the text to split, may be empty
   * @param options target size, overlap and boundary window
   * @return chunks in order; empty when the text is empty
   */
  public List<TextChunk> chunk(String text, ChunkingOptions options) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    int length = text.length();
    int targetChars = options.targetChars();

    if (length <= targetChars) {
      return List.of(toChunk(text, 0, 1, 0, length, 0));
    }

    int overlapChars = options.overlapChars();
    List<int[]> spans = new ArrayList<>();
    int position = 0;

    while (position < length) {
      boolean isLast = position + targetChars >= length;
      int end =
          isLast
              ? length
              : findBoundary(text, position + targetChars, options.boundaryWindowChars());
      if (end <= position) {
        end = Math.min(length, position + targetChars);
      }
      spans.add(new int[] {position, end});
      if (end >= length) {
        break;
      }

      int next = end - overlapChars;
      if (next <= position) {
        next = position + 1;
      }
      position = next;
    }

    int chunkCount = spans.size();
    List<TextChunk> chunks = new ArrayList<>(chunkCount);
    for (int i = 0; i < chunkCount; i++) {
      int[] span = spans.get(i);
      int overlapTokens = i == 0 ? 0 : options.overlapTokens();
      chunks.add(toChunk(text, i, chunkCount, span[0], span[1], overlapTokens));
    }
    log.debug(
        "Chunked {} chars into {} chunks (targetTokens={}, overlapTokens={})",
        length,
        chunkCount,
        options.targetTokens(),
        options.overlapTokens());
    return chunks;
  }

  /** Chunks text with default options (900 tokens, 15% overlap). */
  public List<TextChunk> chunk(String text) {
    return chunk(text, ChunkingOptions.defaults());
  }

  /**
   * Finds the preferred split offset near {@code target}.
   *
   * @return an offset in {@code [target - window, target + window]}, or {@code target} when no
   *     pattern matches past the first half-window
   */
  @VisibleForTesting
  static int findBoundary(String text, int target, int window) {
    int start = Math.max(0, target - window);
    int end = Math.min(text.length(), target + window);
    if (start >= end) {
      return target;
    }
    String searchText = text.substring(start, end);
    int minIndex = window / 2;

    for (BoundaryPattern boundary : BOUNDARY_PATTERNS) {
      int lastIndex = lastMatchIndex(boundary.pattern(), searchText);
      if (lastIndex > minIndex) {
        return start + lastIndex + boundary.offset();
      }
    }
    return target;
  }

  private static int lastMatchIndex(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int last = -1;
    while (matcher.find()) {
      last = matcher.start();
    }
    return last;
  }

  private static TextChunk toChunk(
      String source, int index, int count, int spanStart, int spanEnd, int overlapTokens) {
    String chunkText = source.substring(spanStart, spanEnd);
    return new TextChunk(
        index,
        count,
        chunkText,
        spanStart,
        spanEnd,
        overlapTokens,
        countWords(chunkText),
        estimateTokens(chunkText),
        hash(chunkText));
  }

  public static int estimateTokens(String text) {
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  public static int countWords(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    return WHITESPACE.split(trimmed).length;
  }

  public static String hash(String text) {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }

  private record BoundaryPattern(Pattern pattern, int offset) {}
}
