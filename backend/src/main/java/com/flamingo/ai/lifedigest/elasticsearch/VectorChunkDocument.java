package com.flamingo.ai.lifedigest.elasticsearch;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chunk of one content source of a file in the vector index. The id is {@code
 * filePath:sourceType:chunkIndex}, so re-ingesting a file overwrites its chunks in place.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorChunkDocument implements IndexedDocument {

  @JsonIgnore private String id;
  private String filePath;
  private String sourceType;
  private int chunkIndex;
  private int chunkCount;
  private String content;
  private int spanStart;
  private int spanEnd;
  private int overlapTokens;
  private int wordCount;
  private int tokenCount;
  private String contentHash;
  private List<Float> embedding;

  @JsonIgnore @Builder.Default private Double relevanceScore = 0.0;
}
