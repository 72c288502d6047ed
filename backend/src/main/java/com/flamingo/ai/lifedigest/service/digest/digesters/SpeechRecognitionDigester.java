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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Transcribes audio and video files, keeping segment timings and speaker labels. */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpeechRecognitionDigester implements Digester {

  private final HaidClient haidClient;
  private final LibraryFileReader libraryFileReader;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.SPEECH_RECOGNITION;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return !file.isFolder() && file.isAudioOrVideo();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    byte[] media = libraryFileReader.readBytes(filePath, getName());
    log.info("Transcribing {} ({} bytes)", filePath, media.length);

    HaidClient.SpeechRecognitionResponse response = haidClient.transcribe(media);
    if (response.text() == null && response.segments() == null) {
      throw new DigestException(filePath, getName(), "Transcription returned no text");
    }

    Map<String, Object> content = new LinkedHashMap<>();
    content.put("text", response.text() != null ? response.text().strip() : "");
    content.put("language", response.language());
    content.put("segments", response.segments());
    content.put("speakers", response.speakers());
    return List.of(
        DigestInput.completed(filePath, getName(), digestJson.write(content, filePath, getName())));
  }
}
