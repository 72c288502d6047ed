package com.flamingo.ai.lifedigest.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One document per file in the keyword index; the id is the file path. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordDocument implements IndexedDocument {

  @JsonIgnore private String id;
  private String filePath;
  private String fileName;
  private String mimeType;

  /** Primary text assembled from all content sources. */
  private String content;

  private String summary;

  /** Comma-separated tags. */
  private String tags;

  /** SHA-256 of content, summary and tags together. */
  private String contentHash;

  private int wordCount;

  @JsonIgnore @Builder.Default private Double relevanceScore = 0.0;
}
