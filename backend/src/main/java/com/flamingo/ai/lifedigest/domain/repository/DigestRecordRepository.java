package com.flamingo.ai.lifedigest.domain.repository;

import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for DigestRecord entities. */
@Repository
public interface DigestRecordRepository extends JpaRepository<DigestRecord, Long> {

  /** Finds all digests of a file in creation order. */
  List<DigestRecord> findByFilePathOrderByIdAsc(String filePath);

  Optional<DigestRecord> findByFilePathAndDigester(String filePath, String digester);

  boolean existsByFilePathAndStatus(String filePath, DigestStatus status);

  /**
   * Finds files with runnable work: a pending digest, or a failed one still under the attempt cap.
   * Files whose oldest such digest was touched longest ago come first.
   */
  @Query(
      "SELECT d.filePath FROM DigestRecord d "
          + "WHERE d.status = :pending "
          + "OR (d.status = :failed AND d.attempts < :maxAttempts) "
          + "GROUP BY d.filePath ORDER BY MIN(d.updatedAt) ASC")
  List<String> findFilePathsNeedingDigestion(
      @Param("pending") DigestStatus pending,
      @Param("failed") DigestStatus failed,
      @Param("maxAttempts") int maxAttempts,
      Pageable pageable);

  /** Puts in-progress digests not updated since {@code cutoff} back to pending. */
  @Modifying
  @Query(
      "UPDATE DigestRecord d SET d.status = :pending, d.updatedAt = :now "
          + "WHERE d.status = :inProgress AND d.updatedAt < :cutoff")
  int resetStaleInProgress(
      @Param("pending") DigestStatus pending,
      @Param("inProgress") DigestStatus inProgress,
      @Param("cutoff") LocalDateTime cutoff,
      @Param("now") LocalDateTime now);
}
