package com.flamingo.ai.lifedigest.elasticsearch;

/**
 * A document stored under a caller-chosen id. The id and the relevance score live in hit metadata,
 * not in {@code _source}.
 */
public interface IndexedDocument {

  String getId();

  void setId(String id);

  void setRelevanceScore(Double score);
}
