package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Describes images in natural language. */
@Component
@RequiredArgsConstructor
public class ImageCaptioningDigester implements Digester {

  private final HaidClient haidClient;
  private final LibraryFileReader libraryFileReader;

  @Override
  public String getName() {
    return DigestNames.IMAGE_CAPTIONING;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return !file.isFolder() && file.isImage();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    byte[] image = libraryFileReader.readBytes(file.getPath(), getName());
    String caption = haidClient.imageCaption(image).caption();
    return List.of(
        DigestInput.completed(
            file.getPath(),
            getName(),
            caption == null || caption.isBlank() ? null : caption.strip()));
  }
}
