package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.exception.DigestException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import com.flamingo.ai.lifedigest.service.digest.LibraryFileReader;
import com.flamingo.ai.lifedigest.service.haid.HaidClient;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Converts PDF and Office documents to Markdown. */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocToMarkdownDigester implements Digester {

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of(
          "application/pdf",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/vnd.ms-excel",
          "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
          "application/vnd.ms-powerpoint",
          "application/vnd.openxmlformats-officedocument.presentationml.presentation");

  private static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of(".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx");

  private final HaidClient haidClient;
  private final LibraryFileReader libraryFileReader;

  @Override
  public String getName() {
    return DigestNames.DOC_TO_MARKDOWN;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    if (file.isFolder()) {
      return false;
    }
    return SUPPORTED_MIME_TYPES.contains(file.mimeTypeOrEmpty())
        || SUPPORTED_EXTENSIONS.contains(file.extension());
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    byte[] content = libraryFileReader.readBytes(file.getPath(), getName());
    log.debug("Converting {} ({} bytes) to markdown", file.getPath(), content.length);

    HaidClient.DocToMarkdownResponse response = haidClient.docToMarkdown(file.getName(), content);
    if (response.markdown() == null) {
      throw new DigestException(file.getPath(), getName(), "Conversion returned no markdown");
    }
    String markdown = response.markdown().isBlank() ? null : response.markdown();
    return List.of(DigestInput.completed(file.getPath(), getName(), markdown));
  }
}
