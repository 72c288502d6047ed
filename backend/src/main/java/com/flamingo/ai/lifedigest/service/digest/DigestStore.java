package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Persistence operations on digest records. Every method is its own transaction. */
public interface DigestStore {

  /**
   * Lists all digests of a file.
   *
   * @param filePath the file path
   * @return digests in creation order
   */
  List<DigestRecord> listDigestsForPath(String filePath);

  Optional<DigestRecord> getDigestByPathAndDigester(String filePath, String digester);

  /**
   * Creates or updates the record for {@code (filePath, digester)} to the given state.
   *
   * @param input the state to write
   * @return the stored record
   */
  DigestRecord upsertDigest(DigestInput input);

  /**
   * Creates a pending placeholder unless a record exists; a skipped record is put back to pending.
   *
   * @return true if a record was created or revived
   */
  boolean ensurePlaceholder(String filePath, String digester);

  /**
   * Puts in-progress digests last updated before {@code cutoff} back to pending.
   *
   * @return number of records reset
   */
  int resetStaleInProgressDigests(LocalDateTime cutoff);

  /**
   * Finds files with a pending digest or a failed digest still under the attempt cap.
   *
   * @param limit maximum number of paths
   * @return paths, longest-waiting first
   */
  List<String> findFilesNeedingDigestion(int limit);

  boolean hasFailedDigests(String filePath);

  /**
   * Resets completed or failed digests of a file to pending with a fresh attempt budget.
   *
   * @return number of records reset
   */
  int resetToPending(String filePath, Collection<String> digesters);

  /**
   * Marks pending and failed digests of a file as skipped, except the named ones.
   *
   * @param keep digest names to leave alone
   * @return number of records skipped
   */
  int skipUnfinishedExcept(String filePath, Collection<String> keep);
}
