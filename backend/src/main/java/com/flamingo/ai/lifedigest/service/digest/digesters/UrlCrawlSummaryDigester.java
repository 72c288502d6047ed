package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.agent.SummaryAgent;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.ExistingDigests;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Summarizes a crawled web page. */
@Component
@Slf4j
@RequiredArgsConstructor
public class UrlCrawlSummaryDigester implements Digester {

  private final SummaryAgent summaryAgent;
  private final ObjectMapper objectMapper;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.URL_CRAWL_SUMMARY;
  }

  @Override
  public Set<String> getDependencies() {
    return Set.of(DigestNames.URL_CRAWL_CONTENT);
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return file.isUrlBookmark();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    DigestRecord crawl =
        ExistingDigests.requireCompleted(
            existingDigests, filePath, getName(), DigestNames.URL_CRAWL_CONTENT);
    if (!crawl.hasContent()) {
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    JsonNode page;
    try {
      page = objectMapper.readTree(crawl.getContent());
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, getName(), "Crawl content is not valid JSON: " + e.getOriginalMessage(), e);
    }
    String markdown = page.path("markdown").asText("");
    if (markdown.isBlank()) {
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    String source = page.path("url").asText(filePath);
    String summary =
        summaryAgent.summarize(
            source, DigestText.truncate(markdown, DigestText.MAX_SUMMARY_INPUT_CHARS));
    if (summary == null || summary.isBlank()) {
      log.warn("Empty page summary for {}", filePath);
      return List.of(DigestInput.completed(filePath, getName(), null));
    }
    return List.of(
        DigestInput.completed(
            filePath,
            getName(),
            digestJson.write(Map.of("summary", summary.strip()), filePath, getName())));
  }
}
