package com.flamingo.ai.lifedigest.service.search.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TextChunker Tests")
class TextChunkerTest {

  private TextChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new TextChunker();
  }

  @Nested
  @DisplayName("chunk")
  class ChunkTests {

    @Test
    @DisplayName("should return no chunks for empty text")
    void shouldReturnNoChunks_whenTextEmpty() {
      assertThat(chunker.chunk("")).isEmpty();
      assertThat(chunker.chunk(null, ChunkingOptions.defaults())).isEmpty();
    }

    @Test
    @DisplayName("should return a single chunk when text fits the target")
    void shouldReturnSingleChunk_whenTextFits() {
      String text = "A short note about the garden.";

      List<TextChunk> chunks = chunker.chunk(text);

      assertThat(chunks).hasSize(1);
      TextChunk chunk = chunks.get(0);
      assertThat(chunk.text()).isEqualTo(text);
      assertThat(chunk.chunkIndex()).isZero();
      assertThat(chunk.chunkCount()).isEqualTo(1);
      assertThat(chunk.spanStart()).isZero();
      assertThat(chunk.spanEnd()).isEqualTo(text.length());
      assertThat(chunk.overlapTokens()).isZero();
      assertThat(chunk.wordCount()).isEqualTo(6);
      assertThat(chunk.tokenCount()).isEqualTo(8);
      assertThat(chunk.contentHash()).isEqualTo(TextChunker.hash(text));
    }

    @Test
    @DisplayName("should cover the whole text with overlapping spans")
    void shouldCoverText_withOverlappingSpans() {
      String text = "word ".repeat(100);
      ChunkingOptions options = new ChunkingOptions(25, 0.2, 20);

      List<TextChunk> chunks = chunker.chunk(text, options);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(chunks.get(0).spanStart()).isZero();
      assertThat(chunks.get(chunks.size() - 1).spanEnd()).isEqualTo(text.length());
      for (int i = 0; i < chunks.size(); i++) {
        TextChunk chunk = chunks.get(i);
        assertThat(chunk.chunkIndex()).isEqualTo(i);
        assertThat(chunk.chunkCount()).isEqualTo(chunks.size());
        assertThat(chunk.text()).isEqualTo(text.substring(chunk.spanStart(), chunk.spanEnd()));
        assertThat(chunk.tokenCount()).isEqualTo(TextChunker.estimateTokens(chunk.text()));
        if (i > 0) {
          TextChunk previous = chunks.get(i - 1);
          assertThat(chunk.spanStart()).isGreaterThan(previous.spanStart());
          assertThat(chunk.spanStart()).isLessThan(previous.spanEnd());
          assertThat(chunk.overlapTokens()).isEqualTo(5);
        } else {
          assertThat(chunk.overlapTokens()).isZero();
        }
      }
    }

    @Test
    @DisplayName("should split long unbroken text at the target size")
    void shouldHardSplit_whenNoBoundary() {
      String text = "x".repeat(250);
      ChunkingOptions options = new ChunkingOptions(25, 0.0, 20);

      List<TextChunk> chunks = chunker.chunk(text, options);

      assertThat(chunks).extracting(TextChunk::spanStart).containsExactly(0, 100, 200);
      assertThat(chunks).extracting(TextChunk::spanEnd).containsExactly(100, 200, 250);
    }

    @Test
    @DisplayName("should produce identical chunks for identical text")
    void shouldBeDeterministic() {
      String text = "Paragraph one.\n\nParagraph two is a little longer. ".repeat(40);

      List<TextChunk> first = chunker.chunk(text, new ChunkingOptions(50, 0.15, 40));
      List<TextChunk> second = chunker.chunk(text, new ChunkingOptions(50, 0.15, 40));

      assertThat(first).isEqualTo(second);
    }
  }

  @Nested
  @DisplayName("findBoundary")
  class FindBoundaryTests {

    @Test
    @DisplayName("should prefer a paragraph break over a later sentence end")
    void shouldPreferParagraphBreak() {
      String text = "a".repeat(45) + "\n\n" + "b".repeat(8) + ". " + "c".repeat(40);

      int boundary = TextChunker.findBoundary(text, 50, 20);

      assertThat(boundary).isEqualTo(47);
    }

    @Test
    @DisplayName("should split before a heading line")
    void shouldSplitBeforeHeading() {
      String text = "a".repeat(44) + "\n## Next\n" + "b".repeat(50);

      int boundary = TextChunker.findBoundary(text, 50, 20);

      assertThat(boundary).isEqualTo(45);
      assertThat(text.substring(boundary)).startsWith("## Next");
    }

    @Test
    @DisplayName("should fall back to the target when no boundary is past the half window")
    void shouldReturnTarget_whenBoundaryTooEarly() {
      String text = "a".repeat(35) + " " + "a".repeat(64);

      assertThat(TextChunker.findBoundary(text, 50, 20)).isEqualTo(50);
      assertThat(TextChunker.findBoundary("x".repeat(100), 50, 20)).isEqualTo(50);
    }
  }

  @Nested
  @DisplayName("identity")
  class IdentityTests {

    @Test
    @DisplayName("should build chunk ids from path, source and index")
    void shouldBuildDocumentId() {
      TextChunk chunk = chunker.chunk("hello world").get(0);

      assertThat(chunk.documentId("notes/a.md", "file")).isEqualTo("notes/a.md:file:0");
    }

    @Test
    @DisplayName("should count words on whitespace")
    void shouldCountWords() {
      assertThat(TextChunker.countWords("  one\ttwo\nthree  ")).isEqualTo(3);
      assertThat(TextChunker.countWords("   ")).isZero();
    }

    @Test
    @DisplayName("should reject invalid options")
    void shouldRejectInvalidOptions() {
      assertThatThrownBy(() -> new ChunkingOptions(0, 0.1, 10))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new ChunkingOptions(10, 1.0, 10))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
