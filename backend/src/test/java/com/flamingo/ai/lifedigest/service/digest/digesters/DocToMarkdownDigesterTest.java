package com.flamingo.ai.lifedigest.service.digest.digesters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocToMarkdownDigesterTest {

  private static final String PATH = "docs/report.docx";

  @Mock private HaidClient haidClient;
  @Mock private LibraryFileReader libraryFileReader;

  private DocToMarkdownDigester digester;

  @BeforeEach
  void setUp() {
    digester = new DocToMarkdownDigester(haidClient, libraryFileReader);
  }

  @Nested
  @DisplayName("canDigest")
  class CanDigest {

    @Test
    @DisplayName("should accept office documents by mime type or extension")
    void shouldAcceptDocuments() {
      assertThat(digester.canDigest(file("a/b.bin", "application/pdf"))).isTrue();
      assertThat(digester.canDigest(file("a/b.PPTX", null))).isTrue();
    }

    @Test
    @DisplayName("should reject other files and folders")
    void shouldRejectOthers() {
      assertThat(digester.canDigest(file("a/b.txt", "text/plain"))).isFalse();
      assertThat(
              digester.canDigest(FileRecord.builder().path("reports.pdf").folder(true).build()))
          .isFalse();
    }
  }

  @Test
  @DisplayName("should store the converted markdown")
  void shouldStoreMarkdown() {
    // given
    byte[] bytes = {7, 7};
    when(libraryFileReader.readBytes(PATH, DigestNames.DOC_TO_MARKDOWN)).thenReturn(bytes);
    when(haidClient.docToMarkdown("report.docx", bytes))
        .thenReturn(new HaidClient.DocToMarkdownResponse("# Q3\nRevenue up", "markitdown"));

    // when
    List<DigestInput> results = digester.digest(file(PATH, null), List.of());

    // then
    assertThat(results)
        .containsExactly(
            DigestInput.completed(PATH, DigestNames.DOC_TO_MARKDOWN, "# Q3\nRevenue up"));
  }

  @Test
  @DisplayName("should complete empty for a blank conversion")
  void shouldCompleteEmpty_whenBlank() {
    when(libraryFileReader.readBytes(PATH, DigestNames.DOC_TO_MARKDOWN)).thenReturn(new byte[0]);
    when(haidClient.docToMarkdown("report.docx", new byte[0]))
        .thenReturn(new HaidClient.DocToMarkdownResponse("  \n", "markitdown"));

    List<DigestInput> results = digester.digest(file(PATH, null), List.of());

    assertThat(results.get(0).content()).isNull();
  }

  @Test
  @DisplayName("should fail when the converter returns no markdown")
  void shouldFail_whenNoMarkdown() {
    when(libraryFileReader.readBytes(PATH, DigestNames.DOC_TO_MARKDOWN)).thenReturn(new byte[0]);
    when(haidClient.docToMarkdown("report.docx", new byte[0]))
        .thenReturn(new HaidClient.DocToMarkdownResponse(null, "markitdown"));

    assertThatThrownBy(() -> digester.digest(file(PATH, null), List.of()))
        .isInstanceOf(DigestException.class)
        .hasMessageContaining("no markdown");
  }

  private static FileRecord file(String path, String mimeType) {
    return FileRecord.builder()
        .path(path)
        .name(path.substring(path.lastIndexOf('/') + 1))
        .mimeType(mimeType)
        .build();
  }
}
