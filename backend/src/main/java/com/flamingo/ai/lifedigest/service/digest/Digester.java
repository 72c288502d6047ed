package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import java.util.List;
import java.util.Set;

/**
 * A named processing stage that derives one or more digests from a file.
 *
 * <p>Digesters run in registration order, so a digester may read the completed output of any
 * digester registered before it from {@code existingDigests}.
 */
public interface Digester {

  /** Unique name, also the default digest name. */
  String getName();

  /** Digest names this digester writes. Outputs missing from a result are stored as empty. */
  default List<String> getOutputNames() {
    return List.of(getName());
  }

  /**
   * Upstream digest names whose fresh output invalidates this digester's output. A new non-empty
   * result for any of them puts this digester back to pending.
   */
  default Set<String> getDependencies() {
    return Set.of();
  }

  /** Returns whether this digester applies to the file. Must not do I/O beyond the record. */
  boolean canDigest(FileRecord file);

  /**
   * Runs the digester.
   *
   * @param file the file being processed
   * @param existingDigests current digests of the file, including upstream results of this pass
   * @return digests to store, normally one completed input per output name
   * @throws com.flamingo.ai.lifedigest.exception.DependencyNotReadyException when a required
   *     upstream digest has not completed
   */
  List<DigestInput> digest(FileRecord file, List<DigestRecord> existingDigests);
}
