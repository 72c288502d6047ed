package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import com.flamingo.ai.lifedigest.service.search.chunking.TextChunker;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Crawls the page a URL bookmark points to and stores it as Markdown with reading metadata. */
@Component
@Slf4j
@RequiredArgsConstructor
public class UrlCrawlDigester implements Digester {

  static final int WORDS_PER_MINUTE = 200;

  private final HaidClient haidClient;
  private final LibraryFileReader libraryFileReader;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.URL_CRAWL;
  }

  @Override
  public List<String> getOutputNames() {
    return List.of(DigestNames.URL_CRAWL_CONTENT);
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return file.isUrlBookmark();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    String url = readUrl(file);
    log.info("Crawling {} for {}", url, filePath);

    HaidClient.CrawlResponse response = haidClient.crawl(url);
    if (response.markdown() == null || response.markdown().isBlank()) {
      throw new DigestException(filePath, getName(), "Crawl returned no content for " + url);
    }

    String markdown = response.markdown();
    int wordCount = TextChunker.countWords(markdown);
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("markdown", markdown);
    content.put("url", url);
    content.put("title", response.metadata() != null ? response.metadata().title() : null);
    content.put("domain", domain(url, response));
    content.put("wordCount", wordCount);
    content.put("readingTimeMinutes", readingTimeMinutes(wordCount));

    return List.of(
        DigestInput.completed(
            filePath,
            DigestNames.URL_CRAWL_CONTENT,
            digestJson.write(content, filePath, getName())));
  }

  static int readingTimeMinutes(int wordCount) {
    return Math.max(1, (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE);
  }

  private String readUrl(FileRecord file) {
    String text =
        libraryFileReader.readTextIfExists(file.getPath(), getName()).orElse(file.getTextPreview());
    String firstLine = text.strip().lines().findFirst().orElse("").strip();
    if (!firstLine.startsWith("http://") && !firstLine.startsWith("https://")) {
      throw new DigestException(file.getPath(), getName(), "File does not start with a URL");
    }
    return firstLine;
  }

  private static String domain(String url, HaidClient.CrawlResponse response) {
    if (response.metadata() != null && response.metadata().domain() != null) {
      return response.metadata().domain();
    }
    try {
      return URI.create(url).getHost();
    } catch (IllegalArgumentException e) {
      log.debug("Cannot parse host of {}: {}", url, e.getMessage());
      return null;
    }
  }
}
