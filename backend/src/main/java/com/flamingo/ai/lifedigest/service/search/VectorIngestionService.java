package com.flamingo.ai.lifedigest.service.search;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkDocument;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkIndexService;
import com.flamingo.ai.lifedigest.exception.SearchException;
import com.flamingo.ai.lifedigest.service.search.chunking.ChunkingOptions;
import com.flamingo.ai.lifedigest.service.search.chunking.TextChunk;
import com.flamingo.ai.lifedigest.service.search.chunking.TextChunker;
import com.flamingo.ai.lifedigest.service.search.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Chunks, embeds and indexes one text source of a file into the vector index. */
@Service
@Slf4j
@RequiredArgsConstructor
public class VectorIngestionService {

  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorChunkIndexService vectorChunkIndexService;
  private final DigestConfig digestConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Replaces the vector documents of one source of a file.
   *
   * @param filePath the file path
   * @param sourceType the content source, part of every chunk id
   * @param text the source text
   * @return number of chunks indexed
   * @throws SearchException if embedding or indexing fails
   */
  @Timed(value = "ingest.vector", description = "Time to chunk, embed and index a source")
  public int ingest(String filePath, String sourceType, String text) {
    List<TextChunk> chunks =
        textChunker.chunk(text, ChunkingOptions.from(digestConfig.getChunking()));

    List<List<Float>> embeddings = List.of();
    if (!chunks.isEmpty()) {
      embeddings = embeddingService.embedPassages(chunks.stream().map(TextChunk::text).toList());
      if (embeddings.size() != chunks.size()) {
        throw new SearchException(
            String.format(
                "Embedding returned %d vectors for %d chunks of %s (%s)",
                embeddings.size(), chunks.size(), filePath, sourceType));
      }
    }

    // the new version may have fewer chunks than the old one
    vectorChunkIndexService.deleteBy(Map.of("filePath", filePath, "sourceType", sourceType));

    List<VectorChunkDocument> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      documents.add(
          VectorChunkDocument.builder()
              .id(chunk.documentId(filePath, sourceType))
              .filePath(filePath)
              .sourceType(sourceType)
              .chunkIndex(chunk.chunkIndex())
              .chunkCount(chunk.chunkCount())
              .content(chunk.text())
              .spanStart(chunk.spanStart())
              .spanEnd(chunk.spanEnd())
              .overlapTokens(chunk.overlapTokens())
              .wordCount(chunk.wordCount())
              .tokenCount(chunk.tokenCount())
              .contentHash(chunk.contentHash())
              .embedding(embeddings.get(i))
              .build());
    }
    vectorChunkIndexService.indexDocuments(documents);

    meterRegistry.counter("ingest.vector.chunks").increment(documents.size());
    log.debug("Ingested {} chunks for {} ({})", documents.size(), filePath, sourceType);
    return documents.size();
  }

  /** Removes every vector document of a file. */
  public void deleteFile(String filePath) {
    vectorChunkIndexService.deleteBy(Map.of("filePath", filePath));
    log.info("Deleted vector documents of {}", filePath);
  }
}
