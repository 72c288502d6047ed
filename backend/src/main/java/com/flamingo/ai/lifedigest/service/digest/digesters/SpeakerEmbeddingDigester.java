package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.ExistingDigests;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts per-speaker voice embeddings from a diarized transcript.
 *
 * <p>HAID returns one embedding per speaker in the speech recognition response, so no extra
 * vendor call is made. Speakers heard for less than {@value #MIN_SPEAKER_SECONDS} seconds are
 * skipped as noise. Each kept speaker is stored with its embedding and the timed segments it
 * spoke.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpeakerEmbeddingDigester implements Digester {

  static final double MIN_SPEAKER_SECONDS = 2.0;

  private final ObjectMapper objectMapper;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.SPEAKER_EMBEDDING;
  }

  @Override
  public Set<String> getDependencies() {
    return Set.of(DigestNames.SPEECH_RECOGNITION);
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return !file.isFolder() && file.isAudioOrVideo();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    DigestRecord transcript =
        ExistingDigests.requireCompleted(
            existingDigests, filePath, getName(), DigestNames.SPEECH_RECOGNITION);
    if (!transcript.hasContent()) {
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    JsonNode root = readTranscript(filePath, transcript.getContent());
    JsonNode speakers = root.path("speakers");
    if (!speakers.isArray() || speakers.isEmpty()) {
      log.debug("No speakers in transcript of {}", filePath);
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    List<Map<String, Object>> kept = new ArrayList<>();
    List<Map<String, Object>> skipped = new ArrayList<>();
    for (JsonNode speaker : speakers) {
      String speakerId = speaker.path("speaker_id").asText("");
      JsonNode embedding = speaker.path("embedding");
      double duration = speaker.path("total_duration").asDouble(0);
      if (!embedding.isArray() || embedding.isEmpty()) {
        skipped.add(Map.of("speakerId", speakerId, "reason", "no_embedding"));
      } else if (duration < MIN_SPEAKER_SECONDS) {
        skipped.add(Map.of("speakerId", speakerId, "reason", "short_duration"));
      } else {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("speakerId", speakerId);
        entry.put("totalDuration", duration);
        entry.put("segmentCount", speaker.path("segment_count").asInt(0));
        entry.put("segments", segmentsOf(root.path("segments"), speakerId));
        entry.put("embedding", embedding);
        kept.add(entry);
      }
    }

    if (kept.isEmpty()) {
      log.debug("No speaker in {} long enough to embed ({} skipped)", filePath, skipped.size());
      return List.of(DigestInput.completed(filePath, getName(), null));
    }
    log.info("Extracted {} speaker embeddings from {}", kept.size(), filePath);

    Map<String, Object> content = new LinkedHashMap<>();
    content.put("speakersProcessed", kept.size());
    content.put("speakersSkipped", skipped.size());
    content.put("speakers", kept);
    content.put("skipped", skipped);
    return List.of(
        DigestInput.completed(filePath, getName(), digestJson.write(content, filePath, getName())));
  }

  private JsonNode readTranscript(String filePath, String content) {
    try {
      return objectMapper.readTree(content);
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, getName(), "Transcript is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static List<Map<String, Object>> segmentsOf(JsonNode segments, String speakerId) {
    List<Map<String, Object>> spoken = new ArrayList<>();
    for (JsonNode segment : segments) {
      if (speakerId.equals(segment.path("speaker").asText())) {
        Map<String, Object> span = new LinkedHashMap<>();
        span.put("start", segment.path("start").asDouble());
        span.put("end", segment.path("end").asDouble());
        span.put("text", segment.path("text").asText("").strip());
        spoken.add(span);
      }
    }
    return spoken;
  }
}
