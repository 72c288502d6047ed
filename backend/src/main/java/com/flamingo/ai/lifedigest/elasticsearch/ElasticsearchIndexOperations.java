package com.flamingo.ai.lifedigest.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Operations shared by the keyword index and the chunk vector index.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T extends IndexedDocument> {

  String getIndexName();

  /** Creates the index if missing, otherwise adds any newly declared fields to its mapping. */
  void initIndex();

  /**
   * Creates or replaces documents by id in one bulk request.
   *
   * @param documents the documents; each must carry its id
   */
  void indexDocuments(List<T> documents);

  /**
   * Full-text search restricted by exact-match filters.
   *
   * @param filterCriteria keyword-field filters such as {@code filePath}, may be empty
   * @param query the query text
   * @param topK maximum number of hits
   * @return hits best first, with relevance scores set
   */
  List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK);

  /**
   * Deletes every document matching all criteria.
   *
   * @param criteria keyword-field filters; must not be empty
   */
  void deleteBy(Map<String, Object> criteria);
}
