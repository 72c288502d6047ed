package com.flamingo.ai.lifedigest.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordDocument;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordIndexService;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkDocument;
import com.flamingo.ai.lifedigest.elasticsearch.VectorChunkIndexService;
import com.flamingo.ai.lifedigest.exception.SearchException;
import com.flamingo.ai.lifedigest.service.search.embedding.EmbeddingService;
import com.flamingo.ai.lifedigest.service.search.fusion.FusedResult;
import com.flamingo.ai.lifedigest.service.search.fusion.ReciprocalRankFusion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HybridSearchServiceTest {

  private static final List<Float> EMBEDDING = List.of(0.1f, 0.2f, 0.3f);

  @Mock private KeywordIndexService keywordIndexService;
  @Mock private VectorChunkIndexService vectorChunkIndexService;
  @Mock private EmbeddingService embeddingService;

  private DigestConfig digestConfig;
  private SimpleMeterRegistry meterRegistry;
  private HybridSearchService hybridSearchService;

  @BeforeEach
  void setUp() {
    digestConfig = new DigestConfig();
    meterRegistry = new SimpleMeterRegistry();
    hybridSearchService =
        new HybridSearchService(
            keywordIndexService,
            vectorChunkIndexService,
            embeddingService,
            new ReciprocalRankFusion(),
            digestConfig,
            meterRegistry);

    when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
  }

  @Nested
  @DisplayName("search")
  class SearchTests {

    @Test
    @DisplayName("should fuse keyword files and vector chunks by file path")
    void shouldFuseByFilePath() {
      // given
      when(keywordIndexService.keywordSearch(anyMap(), eq("cats"), anyInt()))
          .thenReturn(List.of(keywordDoc("a.md", "About cats"), keywordDoc("b.md", "Dogs")));
      when(vectorChunkIndexService.vectorSearch(anyMap(), eq(EMBEDDING), anyInt()))
          .thenReturn(
              List.of(
                  chunk("b.md", "file", 0, 0.91),
                  chunk("b.md", "file", 1, 0.85),
                  chunk("c.png", "image-captioning", 0, 0.80)));

      // when
      List<FusedResult> results = hybridSearchService.search("cats", 10);

      // then
      assertThat(results).extracting(FusedResult::id).containsExactly("b.md", "a.md", "c.png");
      assertThat(results.get(0).fromKeyword()).isTrue();
      assertThat(results.get(0).fromSemantic()).isTrue();
      assertThat(results.get(2).snippet()).isEqualTo("chunk 0 of c.png");
      assertThat(meterRegistry.counter("search.hybrid.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fetch limit times the multiplier from each retriever")
    void shouldRequestCandidates() {
      // when
      hybridSearchService.search("cats", 7);

      // then
      verify(keywordIndexService).keywordSearch(anyMap(), eq("cats"), eq(14));
      verify(vectorChunkIndexService).vectorSearch(anyMap(), eq(EMBEDDING), eq(14));
    }

    @Test
    @DisplayName("should clamp the limit and use the default when none is given")
    void shouldClampLimit() {
      // when
      hybridSearchService.search("cats", null);
      hybridSearchService.search("cats", 5000);
      hybridSearchService.search("cats", 0);

      // then
      verify(keywordIndexService).keywordSearch(anyMap(), eq("cats"), eq(40));
      verify(keywordIndexService).keywordSearch(anyMap(), eq("cats"), eq(200));
      verify(keywordIndexService).keywordSearch(anyMap(), eq("cats"), eq(2));
    }

    @Test
    @DisplayName("should drop vector hits below the score threshold")
    void shouldApplyScoreThreshold() {
      // given
      digestConfig.getSearch().setScoreThreshold(0.5);
      when(vectorChunkIndexService.vectorSearch(anyMap(), eq(EMBEDDING), anyInt()))
          .thenReturn(List.of(chunk("a.md", "file", 0, 0.9), chunk("b.md", "file", 0, 0.2)));

      // when
      List<FusedResult> results = hybridSearchService.search("cats", 10);

      // then
      assertThat(results).extracting(FusedResult::id).containsExactly("a.md");
    }

    @Test
    @DisplayName("should return keyword results when vector search fails")
    void shouldDegrade_whenVectorSearchFails() {
      // given
      when(keywordIndexService.keywordSearch(anyMap(), anyString(), anyInt()))
          .thenReturn(List.of(keywordDoc("a.md", "About cats")));
      when(vectorChunkIndexService.vectorSearch(anyMap(), eq(EMBEDDING), anyInt()))
          .thenThrow(new SearchException("cluster unavailable"));

      // when
      List<FusedResult> results = hybridSearchService.search("cats", 10);

      // then
      assertThat(results).extracting(FusedResult::id).containsExactly("a.md");
      assertThat(
              meterRegistry
                  .counter("search.hybrid.source_failure", "source", "semantic")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip vector search when the query cannot be embedded")
    void shouldSkipVectorSearch_whenNoEmbedding() {
      // given
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
      when(keywordIndexService.keywordSearch(anyMap(), anyString(), anyInt()))
          .thenReturn(List.of(keywordDoc("a.md", "About cats")));

      // when
      List<FusedResult> results = hybridSearchService.search("cats", 10);

      // then
      assertThat(results).hasSize(1);
      verify(vectorChunkIndexService, never()).vectorSearch(anyMap(), eq(EMBEDDING), anyInt());
    }
  }

  private static KeywordDocument keywordDoc(String path, String content) {
    return KeywordDocument.builder()
        .id(path)
        .filePath(path)
        .fileName(path)
        .content(content)
        .relevanceScore(2.0)
        .build();
  }

  private static VectorChunkDocument chunk(
      String path, String sourceType, int index, double score) {
    return VectorChunkDocument.builder()
        .id(path + ":" + sourceType + ":" + index)
        .filePath(path)
        .sourceType(sourceType)
        .chunkIndex(index)
        .content("chunk " + index + " of " + path)
        .relevanceScore(score)
        .build();
  }
}
