package com.flamingo.ai.lifedigest.service.search;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordDocument;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordIndexService;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkDocument;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkIndexService;
import com.flamingo.ai.lifedigest.service.search.embedding.EmbeddingService;
import com.flamingo.ai.lifedigest.service.search.fusion.FusedResult;
import com.flamingo.ai.lifedigest.service.search.fusion.FusionOptions;
import com.flamingo.ai.lifedigest.service.search.fusion.ReciprocalRankFusion;
import com.flamingo.ai.lifedigest.service.search.fusion.SearchHit;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid file search combining keyword search and vector search using Reciprocal Rank Fusion.
 *
 * <p>Results are files: vector hits are collapsed to their best chunk per file and keyed by file
 * path, the same id the keyword index uses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchService {

  private static final int SNIPPET_CHARS = 300;

  private final KeywordIndexService keywordIndexService;
  private final VectorChunkIndexService vectorChunkIndexService;
  private final EmbeddingService embeddingService;
  private final ReciprocalRankFusion reciprocalRankFusion;
  private final DigestConfig digestConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Searches both indexes and fuses the rankings.
   *
   * @param query the search query
   * @param limit maximum number of results; null for the default, capped at the maximum
   * @return fused results, best first
   */
  @Timed(value = "search.hybrid", description = "Time for hybrid search")
  public List<FusedResult> search(String query, Integer limit) {
    DigestConfig.Search config = digestConfig.getSearch();
    int requested = limit == null ? config.getDefaultLimit() : limit;
    int effectiveLimit = Math.max(1, Math.min(requested, config.getMaxLimit()));
    int candidates = effectiveLimit * config.getCandidatesMultiplier();

    List<SearchHit> keywordHits = keywordHits(query, candidates);
    List<SearchHit> semanticHits = semanticHits(query, candidates);

    FusionOptions options =
        new FusionOptions(config.getRrfK(), config.getKeywordWeight(), config.getSemanticWeight());
    List<FusedResult> results =
        reciprocalRankFusion.fuse(keywordHits, semanticHits, options, effectiveLimit);

    meterRegistry.counter("search.hybrid.success").increment();
    log.info(
        "Hybrid search '{}': keyword={} semantic={} returned={}",
        query,
        keywordHits.size(),
        semanticHits.size(),
        results.size());
    return results;
  }

  private List<SearchHit> keywordHits(String query, int candidates) {
    List<KeywordDocument> documents;
    try {
      documents = keywordIndexService.keywordSearch(Map.of(), query, candidates);
    } catch (RuntimeException e) {
      log.warn("Keyword search failed, continuing with vector results: {}", e.getMessage());
      meterRegistry.counter("search.hybrid.source_failure", "source", "keyword").increment();
      return List.of();
    }
    List<SearchHit> hits = new ArrayList<>(documents.size());
    for (KeywordDocument document : documents) {
      String text = document.getSummary() != null ? document.getSummary() : document.getContent();
      hits.add(
          new SearchHit(
              document.getFilePath(),
              document.getFilePath(),
              snippet(text),
              score(document.getRelevanceScore())));
    }
    return hits;
  }

  private List<SearchHit> semanticHits(String query, int candidates) {
    List<VectorChunkDocument> chunks;
    try {
      List<Float> embedding = embeddingService.embedQuery(query);
      if (embedding.isEmpty()) {
        log.warn("Query embedding unavailable, continuing with keyword results");
        return List.of();
      }
      chunks = vectorChunkIndexService.vectorSearch(Map.of(), embedding, candidates);
    } catch (RuntimeException e) {
      log.warn("Vector search failed, continuing with keyword results: {}", e.getMessage());
      meterRegistry.counter("search.hybrid.source_failure", "source", "semantic").increment();
      return List.of();
    }

    double threshold = digestConfig.getSearch().getScoreThreshold();
    // chunks arrive best first, so the first chunk seen per file is its best
    Map<String, SearchHit> bestPerFile = new LinkedHashMap<>();
    for (VectorChunkDocument chunk : chunks) {
      double score = score(chunk.getRelevanceScore());
      if (score < threshold) {
        continue;
      }
      String filePath = chunk.getFilePath();
      bestPerFile.putIfAbsent(
          filePath, new SearchHit(filePath, filePath, snippet(chunk.getContent()), score));
    }
    return new ArrayList<>(bestPerFile.values());
  }

  private static double score(Double relevanceScore) {
    return relevanceScore == null ? 0.0 : relevanceScore;
  }

  private static String snippet(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= SNIPPET_CHARS ? text : text.substring(0, SNIPPET_CHARS) + "...";
  }
}
