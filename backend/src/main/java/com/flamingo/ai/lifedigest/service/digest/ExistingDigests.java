package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.exception.DependencyNotReadyException;
import java.util.List;
import java.util.Optional;

/** Lookups over the digests handed to {@link Digester#digest}. */
public final class ExistingDigests {

  private ExistingDigests() {}

  public static Optional<DigestRecord> find(List<DigestRecord> digests, String name) {
    return digests.stream().filter(d -> name.equals(d.getDigester())).findFirst();
  }

  public static Optional<DigestRecord> findCompleted(List<DigestRecord> digests, String name) {
    return find(digests, name).filter(DigestRecord::isCompleted);
  }

  /** Content of a completed digest that produced something. */
  public static Optional<String> completedContent(List<DigestRecord> digests, String name) {
    return findCompleted(digests, name)
        .filter(DigestRecord::hasContent)
        .map(DigestRecord::getContent);
  }

  /**
   * Returns the completed dependency or fails with a retryable error carrying its actual status.
   *
   * @throws DependencyNotReadyException when the dependency is missing or not completed
   */
  public static DigestRecord requireCompleted(
      List<DigestRecord> digests, String filePath, String digester, String dependency) {
    Optional<DigestRecord> record = find(digests, dependency);
    if (record.isEmpty() || !record.get().isCompleted()) {
      throw new DependencyNotReadyException(
          filePath, digester, dependency, record.map(DigestRecord::getStatus).orElse(null));
    }
    return record.get();
  }
}
