package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.fasterxml.jackson.core.JsonProcessingException;
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

/** Summarizes a transcript, preferring the cleaned-up version when there is one. */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpeechRecognitionSummaryDigester implements Digester {

  private final SummaryAgent summaryAgent;
  private final ObjectMapper objectMapper;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.SPEECH_RECOGNITION_SUMMARY;
  }

  @Override
  public Set<String> getDependencies() {
    return Set.of(DigestNames.SPEECH_RECOGNITION, DigestNames.SPEECH_RECOGNITION_CLEANUP);
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

    String text =
        ExistingDigests.completedContent(existingDigests, DigestNames.SPEECH_RECOGNITION_CLEANUP)
            .orElseGet(() -> transcriptText(filePath, transcript));
    if (text.isBlank()) {
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    String summary =
        summaryAgent.summarize(
            "transcript", DigestText.truncate(text, DigestText.MAX_SUMMARY_INPUT_CHARS));
    if (summary == null || summary.isBlank()) {
      log.warn("Empty transcript summary for {}", filePath);
      return List.of(DigestInput.completed(filePath, getName(), null));
    }
    return List.of(
        DigestInput.completed(
            filePath,
            getName(),
            digestJson.write(Map.of("summary", summary.strip()), filePath, getName())));
  }

  private String transcriptText(String filePath, DigestRecord transcript) {
    if (!transcript.hasContent()) {
      return "";
    }
    try {
      return objectMapper.readTree(transcript.getContent()).path("text").asText("");
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, getName(), "Transcript is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }
}
