package com.flamingo.ai.lifedigest.service.haid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.exception.VendorServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP client for the HAID vision and speech service. Encapsulates all WebClient communication;
 * binary inputs are sent base64-encoded in JSON bodies.
 *
 * <p>Failed calls are retried by the {@code haid} retry instance before they reach the digester.
 */
@Component
@Slf4j
public class HaidClient {

  static final String SERVICE = "haid";

  private final WebClient webClient;
  private final DigestConfig.Haid haid;

  public HaidClient(DigestConfig digestConfig) {
    this.haid = digestConfig.getHaid();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(haid.getBaseUrl())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(haid.getMaxInMemorySizeBytes()));
    if (haid.getApiKey() != null && !haid.getApiKey().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + haid.getApiKey());
    }
    this.webClient = builder.build();
    log.info("HAID client initialized: baseUrl={}", haid.getBaseUrl());
  }

  /** Fetches a web page and converts it to Markdown. */
  @Timed(value = "haid.crawl", description = "Time to crawl a URL")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public CrawlResponse crawl(String url) {
    var request = new CrawlRequest(url, false, haid.getCrawlPageTimeoutSeconds() * 1000);
    return post("/api/crawl", request, CrawlResponse.class);
  }

  /** Converts an office document or PDF to Markdown. */
  @Timed(value = "haid.doc_to_markdown", description = "Time to convert a document")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public DocToMarkdownResponse docToMarkdown(String filename, byte[] content) {
    var request =
        new DocToMarkdownRequest(haid.getDocToMarkdownLib(), filename, base64(content));
    return post("/api/doc-to-markdown", request, DocToMarkdownResponse.class);
  }

  @Timed(value = "haid.image_ocr", description = "Time to OCR an image")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public ImageOcrResponse imageOcr(byte[] image) {
    var request = new ImageOcrRequest(haid.getOcrModel(), "text", base64(image));
    return post("/api/image-ocr", request, ImageOcrResponse.class);
  }

  @Timed(value = "haid.image_captioning", description = "Time to caption an image")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public ImageCaptionResponse imageCaption(byte[] image) {
    var request =
        new ImageCaptionRequest(haid.getCaptionModel(), haid.getCaptionPrompt(), base64(image));
    return post("/api/image-captioning", request, ImageCaptionResponse.class);
  }

  /** Transcribes audio or video, with speaker diarization when enabled. */
  @Timed(value = "haid.speech_recognition", description = "Time to transcribe audio")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public SpeechRecognitionResponse transcribe(byte[] audio) {
    var request =
        new SpeechRecognitionRequest(
            base64(audio), haid.getSpeechModel(), haid.isDiarization(), haid.getSpeechLib(), 1, 4);
    return post(
        "/api/automatic-speech-recognition", request, SpeechRecognitionResponse.class);
  }

  /** Automatic segmentation; each mask carries its pixel-space bounding box. */
  @Timed(value = "haid.segmentation", description = "Time to segment an image")
  @CircuitBreaker(name = SERVICE)
  @Retry(name = SERVICE)
  public SegmentationResponse segment(byte[] image, double confidenceThreshold, int maxMasks) {
    var request =
        new SegmentationRequest(
            base64(image), "auto", haid.getSegmentationLib(), confidenceThreshold, maxMasks);
    return post("/api/sam", request, SegmentationResponse.class);
  }

  private <T> T post(String uri, Object body, Class<T> responseType) {
    T response;
    try {
      response =
          webClient
              .post()
              .uri(uri)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .flatMap(
                              text ->
                                  Mono.error(
                                      new VendorServiceException(
                                          SERVICE,
                                          String.format(
                                              "HAID %s error (%d): %s",
                                              uri,
                                              clientResponse.statusCode().value(),
                                              text)))))
              .bodyToMono(responseType)
              .timeout(Duration.ofMillis(haid.getReadTimeoutMs()))
              .block();
    } catch (VendorServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("HAID call {} failed: {}", uri, e.getMessage());
      throw new VendorServiceException(SERVICE, "HAID " + uri + " failed: " + e.getMessage(), e);
    }
    if (response == null) {
      throw new VendorServiceException(SERVICE, "HAID " + uri + " returned an empty body");
    }
    return response;
  }

  private static String base64(byte[] content) {
    return Base64.getEncoder().encodeToString(content);
  }

  record CrawlRequest(
      String url, boolean screenshot, @JsonProperty("page_timeout") int pageTimeoutMs) {}

  record DocToMarkdownRequest(String lib, String filename, String file) {}

  record ImageOcrRequest(
      String model, @JsonProperty("output_format") String outputFormat, String image) {}

  record ImageCaptionRequest(String model, String prompt, String image) {}

  record SpeechRecognitionRequest(
      String audio,
      String model,
      boolean diarization,
      String lib,
      @JsonProperty("min_speakers") int minSpeakers,
      @JsonProperty("max_speakers") int maxSpeakers) {}

  record SegmentationRequest(
      String image,
      String prompt,
      String lib,
      @JsonProperty("confidence_threshold") double confidenceThreshold,
      @JsonProperty("max_masks") int maxMasks) {}

  /** Crawl result; metadata fields are optional. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CrawlResponse(String url, String markdown, Metadata metadata) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(String title, String description, String domain) {}
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DocToMarkdownResponse(String markdown, String model) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ImageOcrResponse(String text, String model) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ImageCaptionResponse(String caption, String model) {}

  /** Transcript with raw segment and speaker arrays. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SpeechRecognitionResponse(
      String text, String language, String model, JsonNode segments, JsonNode speakers) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SegmentationResponse(
      @JsonProperty("image_width") int imageWidth,
      @JsonProperty("image_height") int imageHeight,
      List<Mask> masks) {

    /**
     * One mask. {@code box} is {@code [x1, y1, x2, y2]} in pixels; {@code rle} is the run-length
     * encoded pixel mask with {@code size = [height, width]}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Mask(Rle rle, double score, List<Double> box) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rle(List<Integer> size, List<Long> counts) {}
  }
}
