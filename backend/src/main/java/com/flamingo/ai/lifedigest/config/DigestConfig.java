package com.flamingo.ai.lifedigest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the digest pipeline. */
@Configuration
@ConfigurationProperties(prefix = "digest")
@Getter
@Setter
public class DigestConfig {

  /** Root directory that file paths are relative to. */
  private String dataRoot = "./data";

  private Worker worker = new Worker();
  private Chunking chunking = new Chunking();
  private Masks masks = new Masks();
  private Search search = new Search();
  private Haid haid = new Haid();

  @Getter
  @Setter
  public static class Worker {
    private boolean enabled = true;

    /** Delay before the first loop iteration. */
    private long startDelayMs = 3000;

    /** Sleep when there is nothing to do or the selected file is locked. */
    private long idleSleepMs = 1000;

    private long failureBaseDelayMs = 5000;
    private long failureMaxDelayMs = 60000;

    /** In-progress digests untouched for longer than this are put back to pending. */
    private long staleDigestThresholdMs = 10 * 60 * 1000L;

    private long staleSweepIntervalMs = 60 * 1000L;

    /** Locks older than this are treated as abandoned. Tuned independently of digest staleness. */
    private long staleLockThresholdMs = 30 * 60 * 1000L;

    private long lockSweepIntervalMs = 60 * 1000L;

    /** How long shutdown waits for the in-flight iteration. */
    private long shutdownGraceMs = 10000;

    /** How long clients wait for the worker to report ready. */
    private long readyTimeoutMs = 30000;

    /** Failed digests are retried automatically while their attempts stay below this. */
    private int maxAttempts = 3;

    /** Candidates checked when an unchanged file reports a change. */
    private int fileChangeLookupLimit = 100;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int targetTokens = 900;
    private double overlapPercent = 0.15;
    private int boundaryWindowChars = 200;
  }

  @Getter
  @Setter
  public static class Masks {
    private double minIou = 0.3;
    private int maxMasks = 50;
    private double confidenceThreshold = 0.5;
  }

  @Getter
  @Setter
  public static class Search {
    private int rrfK = 60;
    private double keywordWeight = 0.5;
    private double semanticWeight = 0.5;
    private int defaultLimit = 20;
    private int maxLimit = 100;

    /** Each retriever fetches {@code limit * candidatesMultiplier} hits before fusion. */
    private int candidatesMultiplier = 2;

    /** Vector hits scoring below this are dropped before fusion. */
    private double scoreThreshold = 0.0;
  }

  /** Configuration for the HAID vision/speech microservice. */
  @Getter
  @Setter
  public static class Haid {
    private String baseUrl = "http://localhost:8000";

    /** Sent as a bearer token when not blank. */
    private String apiKey = "";

    private int readTimeoutMs = 300000;
    private int maxInMemorySizeBytes = 64 * 1024 * 1024;
    private String ocrModel = "deepseek-ai/DeepSeek-OCR";
    private String captionModel = "deepseek-ai/DeepSeek-OCR";
    private String captionPrompt = "Describe this image in detail.";
    private String speechModel = "large-v3";
    private String speechLib = "whisperx";
    private boolean diarization = true;
    private String docToMarkdownLib = "microsoft/markitdown";
    private String segmentationLib = "facebookresearch/sam3";
    private int crawlPageTimeoutSeconds = 30;
  }
}
