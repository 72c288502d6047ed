package com.flamingo.ai.lifedigest.service.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.exception.DigestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Serializes structured digest content. */
@Component
@RequiredArgsConstructor
public class DigestJson {

  private final ObjectMapper objectMapper;

  /**
   * Writes a value as JSON digest content.
   *
   * @throws DigestException if the value cannot be serialized
   */
  public String write(Object value, String filePath, String digester) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DigestException(
          filePath, digester, "Failed to serialize digest content: " + e.getOriginalMessage(), e);
    }
  }
}
