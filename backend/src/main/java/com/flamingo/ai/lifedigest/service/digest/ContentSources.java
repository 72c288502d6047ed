package com.flamingo.ai.lifedigest.service.digest;

import static com.flamingo.ai.lifedigest.service.digest.DigestNames.DOC_TO_MARKDOWN;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.IMAGE_CAPTIONING;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.IMAGE_OBJECTS;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.IMAGE_OCR;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.SPEECH_RECOGNITION;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.SPEECH_RECOGNITION_SUMMARY;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.TAGS;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.URL_CRAWL_CONTENT;
import static com.flamingo.ai.lifedigest.service.digest.DigestNames.URL_CRAWL_SUMMARY;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Collects the text of a file from its completed digests and, for text files, the file itself.
 *
 * <p>Sources are returned in priority order: crawled page, converted document, OCR, caption,
 * detected objects, transcript, file text, folder {@code text.md}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentSources {

  public static final String SOURCE_FILE = "file";
  public static final String SOURCE_FOLDER_TEXT = "folder-text";

  private static final Set<String> TEXT_EXTENSIONS = Set.of(".md", ".txt");

  private final ObjectMapper objectMapper;
  private final LibraryFileReader libraryFileReader;

  /**
   * Returns every non-empty text source of the file.
   *
   * @param file the file
   * @param digests the file's current digests
   * @param digester the calling digester, for error reporting
   */
  public List<ContentSource> getContentSources(
      FileRecord file, List<DigestRecord> digests, String digester) {
    List<ContentSource> sources = new ArrayList<>();

    ExistingDigests.completedContent(digests, URL_CRAWL_CONTENT)
        .map(raw -> jsonField(raw, "markdown").orElse(raw))
        .ifPresent(text -> add(sources, URL_CRAWL_CONTENT, text));
    ExistingDigests.completedContent(digests, DOC_TO_MARKDOWN)
        .ifPresent(text -> add(sources, DOC_TO_MARKDOWN, text));
    ExistingDigests.completedContent(digests, IMAGE_OCR)
        .ifPresent(text -> add(sources, IMAGE_OCR, text));
    ExistingDigests.completedContent(digests, IMAGE_CAPTIONING)
        .ifPresent(text -> add(sources, IMAGE_CAPTIONING, text));
    ExistingDigests.completedContent(digests, IMAGE_OBJECTS)
        .map(this::objectLines)
        .ifPresent(text -> add(sources, IMAGE_OBJECTS, text));
    ExistingDigests.completedContent(digests, SPEECH_RECOGNITION)
        .map(this::transcriptText)
        .ifPresent(text -> add(sources, SPEECH_RECOGNITION, text));

    if (file.isFolder()) {
      libraryFileReader
          .readTextIfExists(file.getPath() + "/text.md", digester)
          .ifPresent(text -> add(sources, SOURCE_FOLDER_TEXT, text));
    } else if (TEXT_EXTENSIONS.contains(file.extension())) {
      libraryFileReader
          .readTextIfExists(file.getPath(), digester)
          .ifPresent(text -> add(sources, SOURCE_FILE, text));
    }
    return sources;
  }

  /** All text sources joined by blank lines; empty when the file has no text. */
  public String getPrimaryTextContent(
      FileRecord file, List<DigestRecord> digests, String digester) {
    return getContentSources(file, digests, digester).stream()
        .map(ContentSource::text)
        .collect(Collectors.joining("\n\n"));
  }

  /** The URL summary, else the transcript summary. */
  public Optional<String> getSummary(List<DigestRecord> digests) {
    return ExistingDigests.completedContent(digests, URL_CRAWL_SUMMARY)
        .or(() -> ExistingDigests.completedContent(digests, SPEECH_RECOGNITION_SUMMARY))
        .map(raw -> jsonField(raw, "summary").orElse(raw))
        .filter(text -> !text.isBlank());
  }

  /** Tags joined with {@code ", "}. Accepts {@code {"tags": [...]}} or a bare array. */
  public Optional<String> getTags(List<DigestRecord> digests) {
    return ExistingDigests.completedContent(digests, TAGS)
        .flatMap(this::parseTags)
        .filter(tags -> !tags.isEmpty())
        .map(tags -> String.join(", ", tags));
  }

  private Optional<List<String>> parseTags(String raw) {
    JsonNode root = readTree(raw);
    if (root == null) {
      return Optional.empty();
    }
    JsonNode array = root.isArray() ? root : root.path("tags");
    if (!array.isArray()) {
      return Optional.empty();
    }
    List<String> tags = new ArrayList<>();
    array.forEach(
        node -> {
          if (node.isTextual() && !node.asText().isBlank()) {
            tags.add(node.asText().strip());
          }
        });
    return Optional.of(tags);
  }

  private String objectLines(String raw) {
    JsonNode root = readTree(raw);
    if (root == null || !root.path("objects").isArray()) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    for (JsonNode object : root.path("objects")) {
      String title = object.path("title").asText("");
      String description = object.path("description").asText("");
      if (!title.isBlank() || !description.isBlank()) {
        lines.add(title + ": " + description);
      }
    }
    return String.join("\n", lines);
  }

  private String transcriptText(String raw) {
    JsonNode root = readTree(raw);
    if (root == null) {
      return raw;
    }
    String text = root.path("text").asText("");
    if (!text.isBlank()) {
      return text;
    }
    if (root.path("segments").isArray()) {
      List<String> parts = new ArrayList<>();
      root.path("segments").forEach(segment -> parts.add(segment.path("text").asText("").strip()));
      return String.join(" ", parts).strip();
    }
    return raw;
  }

  private Optional<String> jsonField(String raw, String field) {
    JsonNode root = readTree(raw);
    if (root == null || !root.path(field).isTextual()) {
      return Optional.empty();
    }
    return Optional.of(root.path(field).asText());
  }

  /** Parses JSON content; returns null for plain-text content. */
  private JsonNode readTree(String raw) {
    String trimmed = raw.strip();
    if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
      return null;
    }
    try {
      return objectMapper.readTree(trimmed);
    } catch (JsonProcessingException e) {
      log.debug("Digest content is not valid JSON, using it as text: {}", e.getOriginalMessage());
      return null;
    }
  }

  private static void add(List<ContentSource> sources, String sourceType, String text) {
    if (text != null && !text.isBlank()) {
      sources.add(new ContentSource(sourceType, text));
    }
  }
}
