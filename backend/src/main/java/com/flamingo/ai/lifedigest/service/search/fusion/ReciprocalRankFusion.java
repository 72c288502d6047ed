package com.flamingo.ai.lifedigest.service.search.fusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges a keyword ranking and a vector ranking with Reciprocal Rank Fusion.
 *
 * <p>Each hit at 0-based rank {@code r} scores {@code weight / (k + r + 1)}. Hits are keyed by
 * {@link SearchHit#id()}; a document present in both lists gets the sum of both contributions. Both
 * id spaces must already agree, which is the caller's job. Equal scores keep first-seen order
 * (keyword list first).
 */
@Component
@Slf4j
public class ReciprocalRankFusion {

  /**
   * Fuses two ranked lists.
   *
   * @param keywordHits keyword results, best first
   * @param semanticHits vector results, best first
   * @param options k and per-source weights
   * @param limit maximum number of fused results
   * @return fused results, highest combined score first
   */
  public List<FusedResult> fuse(
      List<SearchHit> keywordHits,
      List<SearchHit> semanticHits,
      FusionOptions options,
      int limit) {
    Map<String, Accumulator> merged = new LinkedHashMap<>();

    for (int rank = 0; rank < keywordHits.size(); rank++) {
      SearchHit hit = keywordHits.get(rank);
      double score = options.keywordWeight() / (options.k() + rank + 1);
      Accumulator entry = merged.computeIfAbsent(hit.id(), id -> new Accumulator(hit));
      entry.keywordScore = entry.keywordScore == null ? score : entry.keywordScore + score;
      entry.sources.add(SearchSource.KEYWORD);
    }

    for (int rank = 0; rank < semanticHits.size(); rank++) {
      SearchHit hit = semanticHits.get(rank);
      double score = options.semanticWeight() / (options.k() + rank + 1);
      Accumulator entry = merged.computeIfAbsent(hit.id(), id -> new Accumulator(hit));
      entry.semanticScore = entry.semanticScore == null ? score : entry.semanticScore + score;
      entry.sources.add(SearchSource.SEMANTIC);
    }

    List<Accumulator> ranked = new ArrayList<>(merged.values());
    ranked.sort(Comparator.comparingDouble(Accumulator::total).reversed());

    List<FusedResult> results = new ArrayList<>(Math.min(limit, ranked.size()));
    for (Accumulator entry : ranked) {
      if (results.size() >= limit) {
        break;
      }
      results.add(entry.toResult());
    }

    log.debug(
        "[RRF] keyword={} semantic={} unique={} returned={} k={}",
        keywordHits.size(),
        semanticHits.size(),
        merged.size(),
        results.size(),
        options.k());
    return results;
  }

  private static final class Accumulator {
    private final SearchHit first;
    private final EnumSet<SearchSource> sources = EnumSet.noneOf(SearchSource.class);
    private Double keywordScore;
    private Double semanticScore;

    private Accumulator(SearchHit first) {
      this.first = first;
    }

    private double total() {
      double total = 0;
      if (keywordScore != null) {
        total += keywordScore;
      }
      if (semanticScore != null) {
        total += semanticScore;
      }
      return total;
    }

    private FusedResult toResult() {
      return new FusedResult(
          first.id(),
          first.filePath(),
          first.snippet(),
          total(),
          keywordScore,
          semanticScore,
          Collections.unmodifiableSet(EnumSet.copyOf(sources)));
    }
  }
}
