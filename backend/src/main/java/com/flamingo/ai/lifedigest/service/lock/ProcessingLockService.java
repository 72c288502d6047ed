package com.flamingo.ai.lifedigest.service.lock;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.domain.repository.ProcessingLockRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-file processing locks stored in the database.
 *
 * <p>A lock row records the owning process; acquisition is a single insert-if-absent, so two
 * callers racing for the same path cannot both win. Locks of a crashed owner are removed at
 * start-up and by the periodic age sweep.
 */
@Service
@Slf4j
public class ProcessingLockService {

  private final ProcessingLockRepository processingLockRepository;
  private final DigestConfig digestConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final String ownerId = UUID.randomUUID().toString();

  public ProcessingLockService(
      ProcessingLockRepository processingLockRepository,
      DigestConfig digestConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.processingLockRepository = processingLockRepository;
    this.digestConfig = digestConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public String getOwnerId() {
    return ownerId;
  }

  @Transactional(readOnly = true)
  public boolean isLocked(String filePath) {
    return processingLockRepository.existsById(filePath);
  }

  /**
   * Tries to take the lock for a path without waiting.
   *
   * @return true if this process now holds the lock
   */
  @Transactional
  public boolean acquireLock(String filePath) {
    int inserted =
        processingLockRepository.insertIfAbsent(filePath, ownerId, LocalDateTime.now(clock));
    if (inserted == 1) {
      log.debug("Acquired lock for {}", filePath);
      return true;
    }
    meterRegistry.counter("digest.lock.contention").increment();
    log.debug("Lock for {} is held by another owner", filePath);
    return false;
  }

  /** Releases the lock if this process holds it. */
  @Transactional
  public void releaseLock(String filePath) {
    int deleted = processingLockRepository.deleteByFilePathAndOwnerId(filePath, ownerId);
    if (deleted == 0) {
      log.warn("Released lock for {} that was not held by this process", filePath);
    }
  }

  /**
   * Removes locks older than the stale-lock threshold, whoever holds them.
   *
   * @return number of locks removed
   */
  @Transactional
  public int cleanupStaleLocks() {
    LocalDateTime cutoff =
        LocalDateTime.now(clock)
            .minus(Duration.ofMillis(digestConfig.getWorker().getStaleLockThresholdMs()));
    int removed = processingLockRepository.deleteAcquiredBefore(cutoff);
    if (removed > 0) {
      log.warn("Removed {} stale processing locks acquired before {}", removed, cutoff);
      meterRegistry.counter("digest.lock.stale_removed").increment(removed);
    }
    return removed;
  }

  /**
   * Removes locks held by any other owner. Only one digest worker runs against a database, so at
   * start-up such locks belong to a process that is gone.
   *
   * @return number of locks removed
   */
  @Transactional
  public int releaseOrphanedLocks() {
    int removed = processingLockRepository.deleteHeldByOtherOwners(ownerId);
    if (removed > 0) {
      log.info("Released {} processing locks left by a previous run", removed);
    }
    return removed;
  }
}
