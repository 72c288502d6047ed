package com.flamingo.ai.lifedigest.service.lock;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.lifedigest.MockedModelsContextTest;
import com.flamingo.ai.lifedigest.domain.entity.ProcessingLock;
import com.flamingo.ai.lifedigest.domain.repository.ProcessingLockRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/** Lock acquisition and sweeps against the SQLite {@code processing_locks} table. */
@DisplayName("Processing Lock Integration Test")
class ProcessingLockIntegrationTest extends MockedModelsContextTest {

  @Autowired private ProcessingLockService lockService;
  @Autowired private ProcessingLockRepository processingLockRepository;
  @Autowired private Clock clock;

  @BeforeEach
  void setUp() {
    processingLockRepository.deleteAll();
  }

  @Test
  @DisplayName("should grant a path to one holder at a time")
  void shouldGrantLockOnce() {
    assertThat(lockService.acquireLock("a.md")).isTrue();
    assertThat(lockService.acquireLock("a.md")).isFalse();
    assertThat(lockService.isLocked("a.md")).isTrue();
    assertThat(lockService.acquireLock("b.md")).isTrue();

    lockService.releaseLock("a.md");

    assertThat(lockService.isLocked("a.md")).isFalse();
    assertThat(lockService.acquireLock("a.md")).isTrue();
  }

  @Test
  @DisplayName("should not take or release a lock held by another owner")
  void shouldRespectOtherOwner() {
    // given
    holdLock("a.md", "previous-run", LocalDateTime.now(clock));

    // when / then
    assertThat(lockService.acquireLock("a.md")).isFalse();
    lockService.releaseLock("a.md");
    assertThat(processingLockRepository.findById("a.md"))
        .get()
        .extracting(ProcessingLock::getOwnerId)
        .isEqualTo("previous-run");
  }

  @Test
  @DisplayName("should release locks of other owners at start-up and keep our own")
  void shouldReleaseOrphanedLocks() {
    // given
    holdLock("a.md", "previous-run", LocalDateTime.now(clock));
    lockService.acquireLock("b.md");

    // when
    int released = lockService.releaseOrphanedLocks();

    // then
    assertThat(released).isEqualTo(1);
    assertThat(lockService.isLocked("a.md")).isFalse();
    assertThat(lockService.isLocked("b.md")).isTrue();
  }

  @Test
  @DisplayName("should sweep locks older than the stale threshold")
  void shouldSweepStaleLocks() {
    // given
    holdLock("old.md", "previous-run", LocalDateTime.now(clock).minusHours(2));
    lockService.acquireLock("fresh.md");

    // when
    int removed = lockService.cleanupStaleLocks();

    // then
    assertThat(removed).isEqualTo(1);
    assertThat(lockService.isLocked("old.md")).isFalse();
    assertThat(lockService.isLocked("fresh.md")).isTrue();
  }

  private void holdLock(String filePath, String ownerId, LocalDateTime acquiredAt) {
    processingLockRepository.save(
        ProcessingLock.builder()
            .filePath(filePath)
            .ownerId(ownerId)
            .acquiredAt(acquiredAt)
            .build());
  }
}
