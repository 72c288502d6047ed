package com.flamingo.ai.lifedigest.service.digest.digesters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UrlCrawlDigesterTest {

  private static final String URL = "https://example.com/posts/1";

  @Mock private HaidClient haidClient;
  @Mock private LibraryFileReader libraryFileReader;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private UrlCrawlDigester digester;
  private FileRecord bookmark;

  @BeforeEach
  void setUp() {
    digester = new UrlCrawlDigester(haidClient, libraryFileReader, new DigestJson(objectMapper));
    bookmark =
        FileRecord.builder()
            .path("links/post.md")
            .name("post.md")
            .mimeType("text/markdown")
            .textPreview(URL)
            .build();
  }

  @Test
  @DisplayName("should apply only to Markdown files holding a URL")
  void shouldApplyToBookmarksOnly() {
    FileRecord note =
        FileRecord.builder().path("n.md").name("n.md").textPreview("# Groceries").build();

    assertThat(digester.canDigest(bookmark)).isTrue();
    assertThat(digester.canDigest(note)).isFalse();
    assertThat(digester.getOutputNames()).containsExactly(DigestNames.URL_CRAWL_CONTENT);
  }

  @Test
  @DisplayName("should store the page with reading metadata")
  void shouldStoreCrawledPage() throws Exception {
    // given
    when(libraryFileReader.readTextIfExists("links/post.md", DigestNames.URL_CRAWL))
        .thenReturn(Optional.of(URL + "\n"));
    when(haidClient.crawl(URL))
        .thenReturn(
            new HaidClient.CrawlResponse(
                URL,
                "word ".repeat(450),
                new HaidClient.CrawlResponse.Metadata("A post", null, null)));

    // when
    List<DigestInput> results = digester.digest(bookmark, List.of());

    // then
    assertThat(results).hasSize(1);
    DigestInput result = results.get(0);
    assertThat(result.digester()).isEqualTo(DigestNames.URL_CRAWL_CONTENT);
    assertThat(result.status()).isEqualTo(DigestStatus.COMPLETED);
    JsonNode content = objectMapper.readTree(result.content());
    assertThat(content.path("url").asText()).isEqualTo(URL);
    assertThat(content.path("title").asText()).isEqualTo("A post");
    assertThat(content.path("domain").asText()).isEqualTo("example.com");
    assertThat(content.path("wordCount").asInt()).isEqualTo(450);
    assertThat(content.path("readingTimeMinutes").asInt()).isEqualTo(3);
  }

  @Test
  @DisplayName("should fail when the crawl returns no markdown")
  void shouldFail_whenNoMarkdown() {
    when(libraryFileReader.readTextIfExists(anyString(), anyString()))
        .thenReturn(Optional.of(URL));
    when(haidClient.crawl(URL)).thenReturn(new HaidClient.CrawlResponse(URL, null, null));

    assertThatThrownBy(() -> digester.digest(bookmark, List.of()))
        .isInstanceOf(DigestException.class)
        .hasMessageContaining("no content");
  }

  @Test
  @DisplayName("should fail without crawling when the file no longer starts with a URL")
  void shouldFail_whenNoUrl() {
    when(libraryFileReader.readTextIfExists(anyString(), anyString()))
        .thenReturn(Optional.of("just some notes"));

    assertThatThrownBy(() -> digester.digest(bookmark, List.of()))
        .isInstanceOf(DigestException.class);
    verify(haidClient, never()).crawl(anyString());
  }

  @Test
  @DisplayName("should round reading time up to at least one minute")
  void shouldRoundReadingTimeUp() {
    assertThat(UrlCrawlDigester.readingTimeMinutes(0)).isEqualTo(1);
    assertThat(UrlCrawlDigester.readingTimeMinutes(200)).isEqualTo(1);
    assertThat(UrlCrawlDigester.readingTimeMinutes(201)).isEqualTo(2);
  }
}
