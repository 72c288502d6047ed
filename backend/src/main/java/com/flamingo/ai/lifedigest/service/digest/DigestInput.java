package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;

/** A digest state to write for one (file, digest name) pair. */
public record DigestInput(
    String filePath, String digester, DigestStatus status, String content, String error) {

  public static DigestInput completed(String filePath, String digester, String content) {
    return new DigestInput(filePath, digester, DigestStatus.COMPLETED, content, null);
  }

  public static DigestInput failed(String filePath, String digester, String error) {
    return new DigestInput(filePath, digester, DigestStatus.FAILED, null, error);
  }

  public static DigestInput inProgress(String filePath, String digester) {
    return new DigestInput(filePath, digester, DigestStatus.IN_PROGRESS, null, null);
  }

  public static DigestInput pending(String filePath, String digester) {
    return new DigestInput(filePath, digester, DigestStatus.PENDING, null, null);
  }

  public static DigestInput skipped(String filePath, String digester) {
    return new DigestInput(filePath, digester, DigestStatus.SKIPPED, null, null);
  }
}
