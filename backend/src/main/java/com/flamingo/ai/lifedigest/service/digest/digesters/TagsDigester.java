package com.flamingo.ai.lifedigest.service.digest.digesters;

import com.flamingo.ai.lifedigest.agent.TagsAgent;
import com.flamingo.ai.lifedigest.agent.dto.TagsResult;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.service.digest.ContentSources;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestJson;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import com.flamingo.ai.lifedigest.service.digest.Digester;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Tags any file that has some text, whatever digest it came from. */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagsDigester implements Digester {

  static final int MAX_TAGS = 20;
  static final int MIN_TEXT_CHARS = 10;

  private final TagsAgent tagsAgent;
  private final ContentSources contentSources;
  private final DigestJson digestJson;

  @Override
  public String getName() {
    return DigestNames.TAGS;
  }

  @Override
  public Set<String> getDependencies() {
    return DigestNames.TEXT_SOURCES;
  }

  @Override
  public boolean canDigest(FileRecord file) {
    return true;
  }

  @Override
  public List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests) {
    String filePath = file.getPath();
    String text = contentSources.getPrimaryTextContent(file, existingDigests, getName()).strip();
    if (text.length() < MIN_TEXT_CHARS) {
      log.debug("Not enough text to tag {}", filePath);
      return List.of(DigestInput.completed(filePath, getName(), null));
    }

    TagsResult result =
        tagsAgent.generateTags(
            DigestText.truncate(text, DigestText.MAX_TAGS_INPUT_CHARS), MAX_TAGS);
    List<String> tags =
        result == null || result.tags() == null
            ? List.of()
            : result.tags().stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .limit(MAX_TAGS)
                .toList();
    log.debug("Generated {} tags for {}", tags.size(), filePath);

    return List.of(
        DigestInput.completed(
            filePath, getName(), digestJson.write(Map.of("tags", tags), filePath, getName())));
  }
}
