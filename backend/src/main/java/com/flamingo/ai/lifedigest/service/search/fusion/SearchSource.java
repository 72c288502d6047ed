package com.flamingo.ai.lifedigest.service.search.fusion;

/** Retriever that contributed a fused result. */
public enum SearchSource {
  /** Full-text (BM25) index. */
  KEYWORD,

  /** Dense vector index. */
  SEMANTIC
}
