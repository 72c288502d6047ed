package com.flamingo.ai.lifedigest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import com.flamingo.ai.lifedigest.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for the index services.
 *
 * <p>Documents are mapped to and from {@code _source} by the client's JSON mapper; subclasses only
 * declare the mapping and the full-text query. Index writes fail loudly so the digest that asked
 * for them is marked failed, while searches degrade to an empty list when the cluster is down.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T extends IndexedDocument>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;
  private final Class<T> documentType;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, Class<T> documentType) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.documentType = documentType;
  }

  /** Declared fields. The index is created with {@code dynamic: false}. */
  protected abstract Map<String, Property> defineIndexProperties();

  /** The scoring part of {@link #keywordSearch}; filters are added around it. */
  protected abstract Query buildTextQuery(String query);

  /** Prefix of this index's counters, e.g. {@code keyword_index}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    ElasticsearchIndicesClient indices = elasticsearchClient.indices();
    if (indices == null) {
      log.warn("No Elasticsearch indices client, skipping initialization of {}", getIndexName());
      return;
    }
    try {
      if (!indices.exists(e -> e.index(getIndexName())).value()) {
        indices.create(
            c ->
                c.index(getIndexName())
                    .mappings(
                        m -> m.dynamic(DynamicMapping.False).properties(defineIndexProperties())));
        log.info("Created index {}", getIndexName());
        return;
      }
      reconcileMapping(indices);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot initialize index " + getIndexName(), e);
    }
  }

  private void reconcileMapping(ElasticsearchIndicesClient indices) throws IOException {
    var mapping = indices.getMapping(g -> g.index(getIndexName())).get(getIndexName());
    if (mapping == null) {
      return;
    }
    MappingDiff diff =
        MappingDiff.between(defineIndexProperties(), mapping.mappings().properties());
    if (!diff.conflicts().isEmpty()) {
      throw new IllegalStateException(
          "Index "
              + getIndexName()
              + " has incompatible fields ("
              + String.join("; ", diff.conflicts())
              + "); delete it and restart to rebuild");
    }
    if (diff.isUpToDate()) {
      log.debug("Mapping of {} is up to date", getIndexName());
      return;
    }
    indices.putMapping(p -> p.index(getIndexName()).properties(diff.missing()));
    log.info("Added fields {} to index {}", diff.missing().keySet(), getIndexName());
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to bulk-index documents")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexDocumentsFallback")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (T document : documents) {
      bulk.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(document.getId()).document(document)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulk.build());
    } catch (IOException e) {
      throw new SearchException(getIndexName(), "Bulk request failed", e);
    }
    if (response.errors()) {
      List<String> failedIds =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(BulkResponseItem::id)
              .toList();
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new SearchException(
          getIndexName(),
          failedIds.size() + " of " + documents.size() + " documents rejected: " + failedIds,
          null);
    }
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    log.debug("Indexed {} documents into {}", documents.size(), getIndexName());
  }

  @SuppressWarnings("unused")
  private void indexDocumentsFallback(List<T> documents, Throwable t) {
    meterRegistry.counter(getMetricPrefix() + ".index.fallback").increment();
    if (t instanceof SearchException searchException) {
      throw searchException;
    }
    throw new SearchException(getIndexName(), "Indexing unavailable: " + t.getMessage(), t);
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(getIndexName())
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(termFilters(filterCriteria))
                                        .must(buildTextQuery(query))))
                    .size(topK));
    List<T> results = search(request, "keyword");
    meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
    return results;
  }

  @SuppressWarnings("unused")
  private List<T> keywordSearchFallback(
      Map<String, Object> filterCriteria, String query, int topK, Throwable t) {
    log.warn("Keyword search on {} unavailable: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    if (criteria.isEmpty()) {
      throw new IllegalArgumentException("Refusing to delete with empty criteria");
    }
    try {
      Long deleted =
          elasticsearchClient
              .deleteByQuery(
                  d ->
                      d.index(getIndexName())
                          .query(q -> q.bool(b -> b.filter(termFilters(criteria)))))
              .deleted();
      log.debug("Deleted {} documents from {} where {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      throw new SearchException(getIndexName(), "Delete where " + criteria + " failed", e);
    }
  }

  /** Runs a search and maps hits back to documents, setting id and score from hit metadata. */
  protected List<T> search(SearchRequest request, String kind) {
    SearchResponse<T> response;
    try {
      response = elasticsearchClient.search(request, documentType);
    } catch (IOException e) {
      throw new SearchException(getIndexName(), kind + " search failed", e);
    }
    List<T> documents = new ArrayList<>();
    for (Hit<T> hit : response.hits().hits()) {
      T document = hit.source();
      if (document == null) {
        continue;
      }
      document.setId(hit.id());
      document.setRelevanceScore(hit.score());
      documents.add(document);
      log.trace(
          "[{}] {} rank={} id={} score={}",
          kind,
          getIndexName(),
          documents.size(),
          hit.id(),
          hit.score());
    }
    log.debug("[{}] {} returned {} hits", kind, getIndexName(), documents.size());
    return documents;
  }

  protected static List<Query> termFilters(Map<String, Object> criteria) {
    List<Query> filters = new ArrayList<>(criteria.size());
    criteria.forEach(
        (field, value) ->
            filters.add(
                Query.of(q -> q.term(t -> t.field(field).value(FieldValue.of(value.toString()))))));
    return filters;
  }
}
