package com.flamingo.ai.lifedigest.domain.repository;

import com.flamingo.ai.lifedigest.domain.entity.ProcessingLock;
import java.time.LocalDateTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ProcessingLock entities. */
@Repository
public interface ProcessingLockRepository extends JpaRepository<ProcessingLock, String> {

  /**
   * Inserts a lock row unless one already exists for the path.
   *
   * @return 1 if the lock was taken, 0 if another owner holds it
   */
  @Modifying
  @Query(
      value =
          "INSERT OR IGNORE INTO processing_locks (file_path, owner_id, acquired_at) "
              + "VALUES (:filePath, :ownerId, :acquiredAt)",
      nativeQuery = true)
  int insertIfAbsent(
      @Param("filePath") String filePath,
      @Param("ownerId") String ownerId,
      @Param("acquiredAt") LocalDateTime acquiredAt);

  @Modifying
  @Query("DELETE FROM ProcessingLock l WHERE l.filePath = :filePath AND l.ownerId = :ownerId")
  int deleteByFilePathAndOwnerId(
      @Param("filePath") String filePath, @Param("ownerId") String ownerId);

  @Modifying
  @Query("DELETE FROM ProcessingLock l WHERE l.acquiredAt < :cutoff")
  int deleteAcquiredBefore(@Param("cutoff") LocalDateTime cutoff);

  @Modifying
  @Query("DELETE FROM ProcessingLock l WHERE l.ownerId <> :ownerId")
  int deleteHeldByOtherOwners(@Param("ownerId") String ownerId);
}
