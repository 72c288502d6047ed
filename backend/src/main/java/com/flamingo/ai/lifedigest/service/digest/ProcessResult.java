package com.flamingo.ai.lifedigest.service.digest;

/** Outcome counts of one {@link DigestCoordinator#processFile} call, per digester. */
public record ProcessResult(int processed, int skipped, int failed) {

  public static ProcessResult empty() {
    return new ProcessResult(0, 0, 0);
  }
}
