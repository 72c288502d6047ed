package com.flamingo.ai.lifedigest.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.bulk.OperationType;
import com.flamingo.ai.lifedigest.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeywordIndexServiceTest {

  private static final String INDEX = "test-files";

  @Mock private ElasticsearchClient elasticsearchClient;
  @Captor private ArgumentCaptor<BulkRequest> bulkCaptor;

  private SimpleMeterRegistry meterRegistry;
  private KeywordIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new KeywordIndexService(elasticsearchClient, meterRegistry, INDEX, "standard");
  }

  @Nested
  @DisplayName("indexDocuments")
  class IndexDocuments {

    @Test
    @DisplayName("should send one index operation per document, keyed by its id")
    void shouldBulkIndexById() throws Exception {
      // given
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(false).took(3).items(List.of())));

      // when
      service.indexDocuments(List.of(document("notes/a.md"), document("notes/b.md")));

      // then
      verify(elasticsearchClient).bulk(bulkCaptor.capture());
      List<BulkOperation> operations = bulkCaptor.getValue().operations();
      assertThat(operations)
          .extracting(op -> op.index().id())
          .containsExactly("notes/a.md", "notes/b.md");
      assertThat(operations).allSatisfy(op -> assertThat(op.index().index()).isEqualTo(INDEX));
      assertThat(meterRegistry.counter("keyword_index.indexed").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should fail with the rejected ids when the bulk reports errors")
    void shouldFail_whenBulkHasErrors() throws Exception {
      // given
      BulkResponseItem rejected =
          BulkResponseItem.of(
              i ->
                  i.operationType(OperationType.Index)
                      .index(INDEX)
                      .id("notes/b.md")
                      .status(400)
                      .error(e -> e.type("document_parsing_exception").reason("bad field")));
      BulkResponseItem accepted =
          BulkResponseItem.of(
              i -> i.operationType(OperationType.Index).index(INDEX).id("notes/a.md").status(201));
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(
              BulkResponse.of(b -> b.errors(true).took(3).items(List.of(accepted, rejected))));

      // when / then
      assertThatThrownBy(
              () -> service.indexDocuments(List.of(document("notes/a.md"), document("notes/b.md"))))
          .isInstanceOfSatisfying(
              SearchException.class,
              e -> {
                assertThat(e.getIndexName()).isEqualTo(INDEX);
                assertThat(e.getMessage()).contains("1 of 2").contains("notes/b.md");
              });
    }

    @Test
    @DisplayName("should not call the cluster for an empty batch")
    void shouldSkipEmptyBatch() throws Exception {
      service.indexDocuments(List.of());

      verify(elasticsearchClient, never()).bulk(any(BulkRequest.class));
    }
  }

  @Test
  @DisplayName("should refuse to delete without criteria")
  void shouldRejectUnfilteredDelete() {
    assertThatThrownBy(() -> service.deleteBy(Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should declare path and hash as exact-match fields")
  void shouldDeclareKeywordFields() {
    assertThat(service.defineIndexProperties().get("filePath").isKeyword()).isTrue();
    assertThat(service.defineIndexProperties().get("contentHash").isKeyword()).isTrue();
    assertThat(service.defineIndexProperties().get("content").isText()).isTrue();
  }

  private static KeywordDocument document(String path) {
    return KeywordDocument.builder()
        .id(path)
        .filePath(path)
        .fileName(path.substring(path.lastIndexOf('/') + 1))
        .content("text")
        .build();
  }
}
