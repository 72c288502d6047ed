package com.flamingo.ai.lifedigest.exception;

/** Failure of the keyword or vector index, or of preparing documents for them. */
public class SearchException extends RuntimeException {

  /** Index the failure belongs to, null when it happened before reaching an index. */
  private final String indexName;

  private final String userMessage;

  public SearchException(String message) {
    this(null, message, null);
  }

  public SearchException(String indexName, String message, Throwable cause) {
    super(indexName == null ? message : indexName + ": " + message, cause);
    this.indexName = indexName;
    this.userMessage = "Search index is unavailable, the file will be indexed again later";
  }

  public String getIndexName() {
    return indexName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
