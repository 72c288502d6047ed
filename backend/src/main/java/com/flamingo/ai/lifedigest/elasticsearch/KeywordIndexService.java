package com.flamingo.ai.lifedigest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Full-text index with one document per file, fed by the search-keyword digester. */
@Service
public class KeywordIndexService extends AbstractElasticsearchIndexService<KeywordDocument> {

  // file name matches beat tag matches, which beat summary and body matches
  private static final List<String> SEARCH_FIELDS =
      List.of("fileName^2.0", "tags^1.5", "summary^1.2", "content");

  @Value("${app.elasticsearch.keyword-index-name:lifedigest-files}")
  private String indexName;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public KeywordIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry, KeywordDocument.class);
  }

  @VisibleForTesting
  KeywordIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      String textAnalyzer) {
    this(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.textAnalyzer = textAnalyzer;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    return Map.of(
        "filePath", Property.of(p -> p.keyword(k -> k)),
        "fileName", analyzedText(),
        "mimeType", Property.of(p -> p.keyword(k -> k)),
        "content", analyzedText(),
        "summary", analyzedText(),
        "tags", analyzedText(),
        "contentHash", Property.of(p -> p.keyword(k -> k)),
        "wordCount", Property.of(p -> p.integer(i -> i)));
  }

  private Property analyzedText() {
    return Property.of(p -> p.text(t -> t.analyzer(textAnalyzer)));
  }

  @Override
  protected Query buildTextQuery(String query) {
    return Query.of(
        q ->
            q.multiMatch(
                mm ->
                    mm.fields(SEARCH_FIELDS)
                        .query(query)
                        .type(TextQueryType.BestFields)
                        .tieBreaker(0.3)));
  }

  @Override
  protected String getMetricPrefix() {
    return "keyword_index";
  }
}
