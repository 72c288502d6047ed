package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.service.digest.ContentSource;
import com.flamingo.ai.lifedigest.service.digest.ContentSources;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.search.VectorIngestionService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the vector chunks of a file: one ingestion per content source, plus the summary and
 * the tags as sources of their own.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchSemanticDigester implements Digester {

  static final String SOURCE_SUMMARY = "summary";
  static final String SOURCE_TAGS = "tags";

  private final VectorIngestionService vectorIngestionService;
  private final ContentSources contentSources;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.SEARCH_SEMANTIC;
  }

  @Override
  public Set<String> getDependencies() {
    return SearchKeywordDigester.searchInputs();
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return true;
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    List<ContentSource> sources =
        new ArrayList<>(contentSources.getContentSources(file, existingDigests, getName()));
    contentSources
        .getSummary(existingDigests)
        .ifPresent(summary -> sources.add(new ContentSource(SOURCE_SUMMARY, summary)));
    contentSources
        .getTags(existingDigests)
        .ifPresent(tags -> sources.add(new ContentSource(SOURCE_TAGS, tags)));

    // sources that disappeared since the last run must not leave chunks behind
    vectorIngestionService.deleteFile(filePath);

    Map<String, Integer> chunksBySource = new LinkedHashMap<>();
    int totalChunks = 0;
    for (ContentSource source : sources) {
      int chunks = vectorIngestionService.ingest(filePath, source.sourceType(), source.text());
      chunksBySource.merge(source.sourceType(), chunks, Integer::sum);
      totalChunks += chunks;
    }
    log.debug("Indexed {} chunks for {} from {} sources", totalChunks, filePath, sources.size());

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("sources", chunksBySource);
    metadata.put("totalChunks", totalChunks);
    return List.of(
        DigestInput.completed(
            filePath, getName(), digestJson.write(metadata, filePath, getName())));
  }
}
