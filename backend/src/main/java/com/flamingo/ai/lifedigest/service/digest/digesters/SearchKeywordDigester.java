package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordDocument;
import com.flamingo.ai.lifedigest.elasticsearch.KeywordIndexService;
import com.flamingo.ai.lifedigest.service.digest.ContentSource;
import com.flamingo.ai.lifedigest.service.digest.ContentSources;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.search.chunking.TextChunker;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the file's keyword document. The digest content is indexing metadata, not the indexed
 * text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchKeywordDigester implements Digester {

  private final KeywordIndexService keywordIndexService;
  private final ContentSources contentSources;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.SEARCH_KEYWORD;
  }

  @Override
  public Set<String> getDependencies() {
    return searchInputs();
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return true;
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    List<ContentSource> sources =
        contentSources.getContentSources(file, existingDigests, getName());
    String content = sources.stream().map(ContentSource::text).collect(Collectors.joining("\n\n"));
    String summary = contentSources.getSummary(existingDigests).orElse(null);
    String tags = contentSources.getTags(existingDigests).orElse(null);

    KeywordDocument document =
        KeywordDocument.builder()
            .id(filePath)
            .filePath(filePath)
            .fileName(file.getName())
            .mimeType(file.getMimeType())
            .content(content)
            .summary(summary)
            .tags(tags)
            .contentHash(
                TextChunker.hash(
                    content + "\n" + nullToEmpty(summary) + "\n" + nullToEmpty(tags)))
            .wordCount(TextChunker.countWords(content))
            .build();
    keywordIndexService.indexDocuments(List.of(document));

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("documentId", filePath);
    metadata.put("hasContent", !content.isEmpty());
    metadata.put("contentSources", sources.stream().map(ContentSource::sourceType).toList());
    metadata.put("hasSummary", summary != null);
    metadata.put("hasTags", tags != null);
    log.debug("Indexed keyword document for {} from {} sources", filePath, sources.size());

    return List.of(
        DigestInput.completed(
            filePath, getName(), digestJson.write(metadata, filePath, getName())));
  }

  static Set<String> searchInputs() {
    Set<String> inputs = new HashSet<>(DigestNames.TEXT_SOURCES);
    inputs.addAll(DigestNames.SUMMARIES);
    inputs.add(DigestNames.TAGS);
    return Set.copyOf(inputs);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
