package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.exception.DigestException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Reads library files; paths are relative to the configured data root. */
@Component
public class LibraryFileReader {

  private final Path dataRoot;

  public LibraryFileReader(DigestConfig digestConfig) {
    this.dataRoot = Path.of(digestConfig.getDataRoot()).toAbsolutePath().normalize();
  }

  public Path resolve(String filePath) {
    Path resolved = dataRoot.resolve(filePath).normalize();
    if (!resolved.startsWith(dataRoot)) {
      throw new IllegalArgumentException("Path escapes the data root: " + filePath);
    }
    return resolved;
  }

  /**
   * Reads a whole file.
   *
   * @throws DigestException if the file cannot be read
   */
  public byte[] readBytes(String filePath, String digester) {
    try {
      return Files.readAllBytes(resolve(filePath));
    } catch (IOException e) {
      throw new DigestException(filePath, digester, "Failed to read file: " + e.getMessage(), e);
    }
  }

  /**
   * Reads a UTF-8 text file if it exists.
   *
   * @throws DigestException if the file exists but cannot be read
   */
  public Optional<String> readTextIfExists(String filePath, String digester) {
    Path path = resolve(filePath);
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new DigestException(filePath, digester, "Failed to read file: " + e.getMessage(), e);
    }
  }
}
