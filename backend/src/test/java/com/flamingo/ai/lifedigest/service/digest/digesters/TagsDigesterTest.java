package com.flamingo.ai.lifedigest.service.digest.digesters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.agent.TagsAgent;
import com.flamingo.ai.lifedigest.agent.dto.TagsResult;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.service.digest.ContentSources;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TagsDigesterTest {

  private static final String PATH = "notes/recipe.md";

  @Mock private TagsAgent tagsAgent;
  @Mock private ContentSources contentSources;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private TagsDigester digester;
  private FileRecord file;

  @BeforeEach
  void setUp() {
    digester = new TagsDigester(tagsAgent, contentSources, new DigestJson(objectMapper));
    file = FileRecord.builder().path(PATH).name("recipe.md").mimeType("text/markdown").build();
  }

  @Test
  @DisplayName("should complete empty without calling the model when there is little text")
  void shouldSkipModel_whenTextTooShort() {
    when(contentSources.getPrimaryTextContent(eq(file), anyList(), anyString()))
        .thenReturn("  short  ");

    List<DigestInput> results = digester.digest(file, List.of());

    assertThat(results).containsExactly(DigestInput.completed(PATH, DigestNames.TAGS, null));
    verify(tagsAgent, never()).generateTags(anyString(), anyInt());
  }

  @Test
  @DisplayName("should store cleaned, de-duplicated tags")
  void shouldStoreCleanTags() throws Exception {
    // given
    when(contentSources.getPrimaryTextContent(eq(file), anyList(), anyString()))
        .thenReturn("Tomato soup with basil and garlic.");
    when(tagsAgent.generateTags("Tomato soup with basil and garlic.", TagsDigester.MAX_TAGS))
        .thenReturn(new TagsResult(Arrays.asList(" soup ", "", null, "cooking", "soup")));

    // when
    List<DigestInput> results = digester.digest(file, List.of());

    // then
    JsonNode tags = objectMapper.readTree(results.get(0).content()).path("tags");
    assertThat(tags).extracting(JsonNode::asText).containsExactly("soup", "cooking");
  }

  @Test
  @DisplayName("should keep at most the maximum number of tags")
  void shouldLimitTags() throws Exception {
    // given
    List<String> many = new ArrayList<>();
    IntStream.range(0, 30).forEach(i -> many.add("tag" + i));
    when(contentSources.getPrimaryTextContent(eq(file), anyList(), anyString()))
        .thenReturn("A long enough text to tag.");
    when(tagsAgent.generateTags(anyString(), anyInt())).thenReturn(new TagsResult(many));

    // when
    List<DigestInput> results = digester.digest(file, List.of());

    // then
    assertThat(objectMapper.readTree(results.get(0).content()).path("tags").size())
        .isEqualTo(TagsDigester.MAX_TAGS);
  }

  @Test
  @DisplayName("should apply to every file and depend on all text digests")
  void shouldApplyToAllFiles() {
    assertThat(digester.canDigest(FileRecord.builder().path("d").folder(true).build())).isTrue();
    assertThat(digester.getDependencies()).isEqualTo(DigestNames.TEXT_SOURCES);
  }
}
