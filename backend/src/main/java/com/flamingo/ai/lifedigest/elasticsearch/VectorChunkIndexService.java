package com.flamingo.ai.lifedigest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Chunk-level index holding text spans and their embeddings.
 *
 * <p>Document ids are {@code filePath:sourceType:chunkIndex}. Search hits come back without the
 * embedding, which callers never read.
 */
@Service
@Slf4j
public class VectorChunkIndexService
    extends AbstractElasticsearchIndexService<VectorChunkDocument> {

  private static final String EMBEDDING_FIELD = "embedding";

  /** kNN candidates per shard, as a multiple of k. */
  private static final int NUM_CANDIDATES_FACTOR = 2;

  @Value("${app.elasticsearch.vector-index-name:lifedigest-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public VectorChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry, VectorChunkDocument.class);
  }

  @VisibleForTesting
  VectorChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    this(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Property integer = Property.of(p -> p.integer(i -> i));
    return Map.ofEntries(
        Map.entry("filePath", Property.of(p -> p.keyword(k -> k))),
        Map.entry("sourceType", Property.of(p -> p.keyword(k -> k))),
        Map.entry("chunkIndex", integer),
        Map.entry("chunkCount", integer),
        Map.entry("content", Property.of(p -> p.text(t -> t))),
        Map.entry("spanStart", integer),
        Map.entry("spanEnd", integer),
        Map.entry("overlapTokens", integer),
        Map.entry("wordCount", integer),
        Map.entry("tokenCount", integer),
        Map.entry("contentHash", Property.of(p -> p.keyword(k -> k))),
        Map.entry(
            EMBEDDING_FIELD,
            Property.of(
                p ->
                    p.denseVector(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
  }

  @Override
  protected Query buildTextQuery(String query) {
    return Query.of(q -> q.match(m -> m.field("content").query(query)));
  }

  /**
   * Approximate kNN search over chunk embeddings.
   *
   * @param filterCriteria exact-match filters, may be empty
   * @param queryEmbedding the query vector
   * @param topK number of chunks to return
   * @return chunks ordered by similarity, scores set, embeddings left out
   */
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<VectorChunkDocument> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field(EMBEDDING_FIELD)
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(topK * NUM_CANDIDATES_FACTOR)
                                .filter(termFilters(filterCriteria)))
                    .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                    .size(topK));
    List<VectorChunkDocument> results = search(request, "vector");
    meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
    return results;
  }

  @SuppressWarnings("unused")
  private List<VectorChunkDocument> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("Vector search on {} unavailable: {}", indexName, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_index";
  }
}
