package com.flamingo.ai.lifedigest.service.search.fusion;

import java.util.Set;

/**
 * A fused search result with per-source contributions.
 *
 * @param id cross-source document identity
 * @param filePath file the result belongs to
 * @param snippet text taken from the first source that reported the document
 * @param score combined RRF score
 * @param keywordScore RRF contribution of the keyword list, {@code null} if absent there
 * @param semanticScore RRF contribution of the vector list, {@code null} if absent there
 * @param sources retrievers that returned the document
 */
public record FusedResult(
    String id,
    String filePath,
    String snippet,
    double score,
    Double keywordScore,
    Double semanticScore,
    Set<SearchSource> sources) {

  public boolean fromKeyword() {
    return sources.contains(SearchSource.KEYWORD);
  }

  public boolean fromSemantic() {
    return sources.contains(SearchSource.SEMANTIC);
  }
}
