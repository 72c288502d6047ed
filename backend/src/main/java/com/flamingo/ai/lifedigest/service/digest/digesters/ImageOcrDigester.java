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

/** Extracts text from images. Images without text complete with empty content. */
@Component
@RequiredArgsConstructor
public class ImageOcrDigester implements Digester {

  private final HaidClient haidClient;
  private final LibraryFileReader libraryFileReader;

  @Override
  public String getName() {
    return DigestNames.IMAGE_OCR;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return !file.isFolder() && file.isImage();
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    byte[] image = libraryFileReader.readBytes(file.getPath(), getName());
    String text = haidClient.imageOcr(image).text();
    return List.of(
        DigestInput.completed(
            file.getPath(), getName(), text == null || text.isBlank() ? null : text.strip()));
  }
}
