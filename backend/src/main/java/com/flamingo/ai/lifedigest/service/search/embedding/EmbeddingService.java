package com.flamingo.ai.lifedigest.service.search.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the configured embedding model. Failures surface as empty lists
 * from the circuit breaker fallbacks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; keep a margin for dense CJK text
  private static final int MAX_CHARS_PER_EMBEDDING = 6000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector, empty on failure
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query, 0));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds chunk texts in one batch request.
   *
   * @param texts the passages
   * @return one vector per passage in input order, empty on failure
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedPassages(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<List<Float>> results = new ArrayList<>(segments.size());
    for (Embedding embedding : response.content()) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return results;
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedPassagesFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    return List.of();
  }
}
