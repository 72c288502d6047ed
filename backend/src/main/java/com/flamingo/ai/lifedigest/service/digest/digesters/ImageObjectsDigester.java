package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import com.flamingo.ai.lifedigest.service.vision.BoundingBox;
import com.flamingo.ai.lifedigest.service.vision.MaskMatcher;
import com.flamingo.ai.lifedigest.service.vision.MatchedMask;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Detects objects in an image with a vision model and attaches the best matching segmentation
 * mask to each one.
 *
 * <p>Segmentation is best effort: if it fails, objects are stored without masks.
 */
@Component
@Slf4j
public class ImageObjectsDigester implements Digester {

  private static final String SYSTEM_PROMPT =
      """
      You identify the distinct objects visible in an image.
      For each object return a short title, a lowercase name, a broad category, a one-sentence
      description, a bounding box as [x1, y1, x2, y2] normalized to the range 0..1 with the
      origin at the top-left corner, and a certainty of "certain", "likely" or "uncertain".
      List the most prominent objects first and return at most 30 objects.
      Return ONLY valid JSON matching this structure:
      {"objects": [{"title": "", "name": "", "category": "", "description": "",
        "bbox": [0.0, 0.0, 0.0, 0.0], "certainty": "certain"}]}
      """;

  private static final String USER_PROMPT = "List the objects in this image.";

  private final ChatModel visionChatModel;
  private final HaidClient haidClient;
  private final MaskMatcher maskMatcher;
  private final LibraryFileReader libraryFileReader;
  private final ObjectMapper objectMapper;
  private final DigestJson digestJson;
  private final DigestConfig digestConfig;

  public ImageObjectsDigester(
      @Qualifier("visionChatModel") ChatModel visionChatModel,
      HaidClient haidClient,
      MaskMatcher maskMatcher,
      LibraryFileReader libraryFileReader,
      ObjectMapper objectMapper,
      DigestJson digestJson,
      DigestConfig digestConfig) {
    this.visionChatModel = visionChatModel;
    this.haidClient = haidClient;
    this.maskMatcher = maskMatcher;
    this.libraryFileReader = libraryFileReader;
    this.objectMapper = objectMapper;
    this.digestJson = digestJson;
    this.digestConfig = digestConfig;
  }

  @Override
  public String getName() {
    return DigestNames.IMAGE_OBJECTS;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return !file.isFolder() && file.isImage();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    byte[] image = libraryFileReader.readBytes(filePath, getName());

    List<DetectedObject> objects = detectObjects(file, image);
    List<Map<String, Object>> masks =
        objects.isEmpty() ? List.of() : matchMasks(filePath, image, objects);
    log.debug("Detected {} objects in {}", objects.size(), filePath);

    List<Map<String, Object>> json = new ArrayList<>(objects.size());
    for (int i = 0; i < objects.size(); i++) {
      json.add(objects.get(i).toJson(masks.get(i)));
    }
    return List.of(
        DigestInput.completed(
            filePath, getName(), digestJson.write(Map.of("objects", json), filePath, getName())));
  }

  private List<DetectedObject> detectObjects(FileRecord file, byte[] image) {
    String mimeType = file.getMimeType() != null ? file.getMimeType() : "image/jpeg";
    UserMessage userMessage =
        UserMessage.from(
            TextContent.from(USER_PROMPT),
            ImageContent.from(Base64.getEncoder().encodeToString(image), mimeType));
    String response =
        visionChatModel.chat(SystemMessage.from(SYSTEM_PROMPT), userMessage).aiMessage().text();
    return parseObjects(file.getPath(), response);
  }

  private List<DetectedObject> parseObjects(String filePath, String response) {
    if (response == null || response.isBlank()) {
      throw new DigestException(filePath, getName(), "Vision model returned no content");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(response));
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, getName(), "Vision model returned invalid JSON: " + e.getOriginalMessage(), e);
    }

    List<DetectedObject> objects = new ArrayList<>();
    for (JsonNode node : root.path("objects")) {
      objects.add(
          new DetectedObject(
              node.path("title").asText(""),
              node.path("name").asText(""),
              node.path("category").asText(""),
              node.path("description").asText(""),
              BoundingBox.fromList(parseBox(node.path("bbox"))),
              node.path("certainty").asText("uncertain")));
    }
    return objects;
  }

  /** Returns one mask per object, {@code null} where nothing matched or segmentation failed. */
  private List<Map<String, Object>> matchMasks(
      String filePath, byte[] image, List<DetectedObject> objects) {
    List<Map<String, Object>> attached = new ArrayList<>(objects.size());
    objects.forEach(object -> attached.add(null));

    DigestConfig.Masks masks = digestConfig.getMasks();
    HaidClient.SegmentationResponse segmentation;
    try {
      segmentation = haidClient.segment(image, masks.getConfidenceThreshold(), masks.getMaxMasks());
    } catch (RuntimeException e) {
      log.warn(
          "Segmentation failed for {}, storing objects without masks: {}",
          filePath,
          e.getMessage());
      return attached;
    }

    List<BoundingBox> objectBoxes = objects.stream().map(DetectedObject::bbox).toList();
    List<HaidClient.SegmentationResponse.Mask> segments =
        segmentation.masks() != null ? segmentation.masks() : List.of();
    List<BoundingBox> maskBoxes =
        segments.stream().map(mask -> BoundingBox.fromList(mask.box())).toList();

    List<MatchedMask> matches =
        maskMatcher.matchObjectsToMasks(
            objectBoxes,
            maskBoxes,
            segmentation.imageWidth(),
            segmentation.imageHeight(),
            masks.getMinIou());

    for (MatchedMask match : matches) {
      HaidClient.SegmentationResponse.Mask mask = segments.get(match.maskIndex());
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("box", mask.box());
      json.put("score", mask.score());
      json.put("rle", mask.rle());
      attached.set(match.objectIndex(), json);
    }
    return attached;
  }

  private static List<Double> parseBox(JsonNode node) {
    if (!node.isArray() || node.size() != 4) {
      return null;
    }
    List<Double> box = new ArrayList<>(4);
    for (JsonNode value : node) {
      if (!value.isNumber()) {
        return null;
      }
      box.add(value.asDouble());
    }
    return box;
  }

  private static String stripCodeFence(String response) {
    String trimmed = response.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int lastFence = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        return trimmed.substring(firstNewline + 1, lastFence).strip();
      }
    }
    return trimmed;
  }

  private record DetectedObject(
      String title,
      String name,
      String category,
      String description,
      BoundingBox bbox,
      String certainty) {

    Map<String, Object> toJson(Map<String, Object> mask) {
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("title", title);
      json.put("name", name);
      json.put("category", category);
      json.put("description", description);
      json.put("bbox", bbox != null ? bbox.toList() : null);
      json.put("certainty", certainty);
      json.put("mask", mask);
      return json;
    }
  }
}
