package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.agent.TranscriptCleanupAgent;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.ExistingDigests;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Repairs recognition errors in a transcript with the chat model. */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpeechRecognitionCleanupDigester implements Digester {

  private final TranscriptCleanupAgent transcriptCleanupAgent;
  private final ObjectMapper objectMapper;

  @Override
  public String getName() {
    return DigestNames.SPEECH_RECOGNITION_CLEANUP;
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

    String lines = speakerLines(filePath, transcript.getContent());
    if (lines.isBlank()) {
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    String cleaned = transcriptCleanupAgent.cleanup(lines);
    log.debug(
        "Cleaned transcript for {}: {} -> {} chars",
        filePath,
        lines.length(),
        cleaned == null ? 0 : cleaned.length());
    return List.of(
        DigestInput.completed(
            filePath, getName(), cleaned == null || cleaned.isBlank() ? null : cleaned.strip()));
  }

  /** One {@code SPEAKER: text} line per segment, or the plain text without segments. */
  private String speakerLines(String filePath, String content) {
    JsonNode root;
    try {
      root = objectMapper.readTree(content);
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, getName(), "Transcript is not valid JSON: " + e.getOriginalMessage(), e);
    }

    JsonNode segments = root.path("segments");
    if (!segments.isArray() || segments.isEmpty()) {
      return root.path("text").asText("");
    }
    List<String> lines = new ArrayList<>();
    for (JsonNode segment : segments) {
      String text = segment.path("text").asText("").strip();
      if (text.isEmpty()) {
        continue;
      }
      String speaker = segment.path("speaker").asText("");
      lines.add(speaker.isBlank() ? text : speaker + ": " + text);
    }
    return String.join("\n", lines);
  }
}
