package com.flamingo.ai.lifedigest.service.digest;

import java.util.Set;

/** Digest names shared between producers and readers. */
public final class DigestNames {

  public static final String URL_CRAWL = "url-crawl";
  public static final String URL_CRAWL_CONTENT = "url-crawl-content";
  public static final String DOC_TO_MARKDOWN = "doc-to-markdown";
  public static final String IMAGE_OCR = "image-ocr";
  public static final String IMAGE_CAPTIONING = "image-captioning";
  public static final String IMAGE_OBJECTS = "image-objects";
  public static final String SPEECH_RECOGNITION = "speech-recognition";
  public static final String SPEAKER_EMBEDDING = "speaker-embedding";
  public static final String SPEECH_RECOGNITION_CLEANUP = "speech-recognition-cleanup";
  public static final String SPEECH_RECOGNITION_SUMMARY = "speech-recognition-summary";
  public static final String URL_CRAWL_SUMMARY = "url-crawl-summary";
  public static final String TAGS = "tags";
  public static final String SEARCH_KEYWORD = "search-keyword";
  public static final String SEARCH_SEMANTIC = "search-semantic";

  /** Digests that contribute searchable text. */
  public static final Set<String> TEXT_SOURCES =
      Set.of(
          URL_CRAWL_CONTENT,
          DOC_TO_MARKDOWN,
          IMAGE_OCR,
          IMAGE_CAPTIONING,
          IMAGE_OBJECTS,
          SPEECH_RECOGNITION);

  public static final Set<String> SUMMARIES =
      Set.of(URL_CRAWL_SUMMARY, SPEECH_RECOGNITION_SUMMARY);

  private DigestNames() {}
}
