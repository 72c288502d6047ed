package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
import com.flamingo.ai.lifedigest.domain.repository.DigestRecordRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA implementation of the DigestStore. */
@Service
@Slf4j
@RequiredArgsConstructor
public class DigestStoreImpl implements DigestStore {

  private final DigestRecordRepository digestRecordRepository;
  private final DigestConfig digestConfig;
  private final Clock clock;

  @Override
  @Transactional(readOnly = true)
  public List<DigestRecord> listDigestsForPath(String filePath) {
    return digestRecordRepository.findByFilePathOrderByIdAsc(filePath);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<DigestRecord> getDigestByPathAndDigester(String filePath, String digester) {
    return digestRecordRepository.findByFilePathAndDigester(filePath, digester);
  }

  @Override
  @Transactional
  public DigestRecord upsertDigest(DigestInput input) {
    LocalDateTime now = now();
    DigestRecord record =
        digestRecordRepository
            .findByFilePathAndDigester(input.filePath(), input.digester())
            .orElseGet(
                () ->
                    DigestRecord.builder()
                        .filePath(input.filePath())
                        .digester(input.digester())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());

    switch (input.status()) {
      case PENDING -> record.resetToPending(now);
      case IN_PROGRESS -> record.markInProgress(now);
      case COMPLETED -> record.markCompleted(input.content(), now);
      case FAILED -> record.markFailed(input.error(), now);
      case SKIPPED -> record.markSkipped(now);
    }
    return digestRecordRepository.save(record);
  }

  @Override
  @Transactional
  public boolean ensurePlaceholder(String filePath, String digester) {
    Optional<DigestRecord> existing =
        digestRecordRepository.findByFilePathAndDigester(filePath, digester);
    if (existing.isEmpty()) {
      LocalDateTime now = now();
      digestRecordRepository.save(
          DigestRecord.builder()
              .filePath(filePath)
              .digester(digester)
              .createdAt(now)
              .updatedAt(now)
              .build());
      return true;
    }
    DigestRecord record = existing.get();
    if (record.getStatus() == DigestStatus.SKIPPED) {
      record.resetToPending(now());
      digestRecordRepository.save(record);
      return true;
    }
    return false;
  }

  @Override
  @Transactional
  public int resetStaleInProgressDigests(LocalDateTime cutoff) {
    int reset =
        digestRecordRepository.resetStaleInProgress(
            DigestStatus.PENDING, DigestStatus.IN_PROGRESS, cutoff, now());
    if (reset > 0) {
      log.warn("Reset {} stale in-progress digests (cutoff {})", reset, cutoff);
    }
    return reset;
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> findFilesNeedingDigestion(int limit) {
    return digestRecordRepository.findFilePathsNeedingDigestion(
        DigestStatus.PENDING,
        DigestStatus.FAILED,
        digestConfig.getWorker().getMaxAttempts(),
        PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasFailedDigests(String filePath) {
    return digestRecordRepository.existsByFilePathAndStatus(filePath, DigestStatus.FAILED);
  }

  @Override
  @Transactional
  public int resetToPending(String filePath, Collection<String> digesters) {
    LocalDateTime now = now();
    int reset = 0;
    for (DigestRecord record : digestRecordRepository.findByFilePathOrderByIdAsc(filePath)) {
      DigestStatus status = record.getStatus();
      if (digesters.contains(record.getDigester())
          && (status == DigestStatus.COMPLETED || status == DigestStatus.FAILED)) {
        record.resetToPending(now);
        digestRecordRepository.save(record);
        reset++;
      }
    }
    return reset;
  }

  @Override
  @Transactional
  public int skipUnfinishedExcept(String filePath, Collection<String> keep) {
    LocalDateTime now = now();
    int skipped = 0;
    for (DigestRecord record : digestRecordRepository.findByFilePathOrderByIdAsc(filePath)) {
      DigestStatus status = record.getStatus();
      if (!keep.contains(record.getDigester())
          && (status == DigestStatus.PENDING || status == DigestStatus.FAILED)) {
        record.markSkipped(now);
        digestRecordRepository.save(record);
        skipped++;
      }
    }
    return skipped;
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
