package com.flamingo.ai.lifedigest.service.digest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DigesterRegistry Tests")
class DigesterRegistryTest {

  @Test
  @DisplayName("should return applicable digesters in registration order")
  void shouldReturnApplicableInOrder() {
    DigesterRegistry registry =
        new DigesterRegistry(
            List.of(
                stage("image-ocr", List.of("image-ocr"), Set.of(), true),
                stage("speech", List.of("speech"), Set.of(), false),
                stage("tags", List.of("tags"), Set.of("image-ocr"), true)));

    List<Digester> applicable = registry.getApplicable(FileRecord.builder().path("a.png").build());

    assertThat(applicable).extracting(Digester::getName).containsExactly("image-ocr", "tags");
    assertThat(registry.getAll()).hasSize(3);
    assertThat(registry.find("speech")).isPresent();
    assertThat(registry.find("missing")).isEmpty();
  }

  @Test
  @DisplayName("should find outputs of every digester depending on a digest")
  void shouldFindDownstreamOutputs() {
    DigesterRegistry registry =
        new DigesterRegistry(
            List.of(
                stage("url-crawl", List.of("url-crawl-content"), Set.of(), true),
                stage("summary", List.of("summary"), Set.of("url-crawl-content"), true),
                stage("index", List.of("index"), Set.of("url-crawl-content", "summary"), true)));

    assertThat(registry.findDownstream("url-crawl-content")).containsExactly("summary", "index");
    assertThat(registry.findDownstream("summary")).containsExactly("index");
    assertThat(registry.findDownstream("index")).isEmpty();
  }

  @Test
  @DisplayName("should reject duplicate digester names")
  void shouldRejectDuplicateNames() {
    List<Digester> digesters =
        List.of(
            stage("ocr", List.of("ocr"), Set.of(), true),
            stage("ocr", List.of("ocr-2"), Set.of(), true));

    assertThatThrownBy(() -> new DigesterRegistry(digesters))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate digester name");
  }

  @Test
  @DisplayName("should reject a dependency on a later or unknown digest")
  void shouldRejectForwardDependency() {
    List<Digester> digesters =
        List.of(
            stage("tags", List.of("tags"), Set.of("ocr"), true),
            stage("ocr", List.of("ocr"), Set.of(), true));

    assertThatThrownBy(() -> new DigesterRegistry(digesters))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("'tags' depends on 'ocr'");
  }

  @Test
  @DisplayName("should reject two producers of the same digest")
  void shouldRejectSharedOutput() {
    List<Digester> digesters =
        List.of(
            stage("crawl", List.of("content"), Set.of(), true),
            stage("convert", List.of("content"), Set.of(), true));

    assertThatThrownBy(() -> new DigesterRegistry(digesters))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("more than one producer");
  }

  private static Digester stage(
      String name, List<String> outputs, Set<String> dependencies, boolean applies) {
    return new Digester() {
      @Override
      public String getName() {
        return name;
      }

      @Override
      public List<String> getOutputNames() {
        return outputs;
      }

      @Override
      public Set<String> getDependencies() {
        return dependencies;
      }

      @Override
      public boolean canDigest(FileRecord file) {
        return applies;
      }

      @Override
      public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
        return List.of();
      }
    };
  }
}
