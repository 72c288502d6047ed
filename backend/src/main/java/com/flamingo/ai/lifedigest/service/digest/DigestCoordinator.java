package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
import com.flamingo.ai.lifedigest.domain.repository.FileRecordRepository;
import com.flamingo.ai.lifedigest.exception.DependencyNotReadyException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the applicable digesters of one file in registration order.
 *
 * <p>A digester failure is recorded on its digest records and never stops the remaining
 * digesters of the file, nor is it thrown to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DigestCoordinator {

  private final DigesterRegistry digesterRegistry;
  private final DigestStore digestStore;
  private final FileRecordRepository fileRecordRepository;
  private final DigestConfig digestConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Creates pending placeholders for every output of every applicable digester. Unfinished records
   * of digests that no applicable digester produces are marked skipped.
   *
   * @param filePath the file path
   */
  public void ensureAllDigesters(String filePath) {
    Optional<FileRecord> file = fileRecordRepository.findByPath(filePath);
    if (file.isEmpty()) {
      log.warn("Cannot create digest placeholders, file not found: {}", filePath);
      return;
    }
    ensureAllDigesters(file.get());
  }

  private void ensureAllDigesters(FileRecord file) {
    int created = 0;
    Set<String> applicableOutputs = new HashSet<>();
    for (Digester digester : digesterRegistry.getApplicable(file)) {
      for (String output : digester.getOutputNames()) {
        applicableOutputs.add(output);
        if (digestStore.ensurePlaceholder(file.getPath(), output)) {
          created++;
        }
      }
    }
    // covers digesters that stopped applying and names no digester produces any more
    int skipped = digestStore.skipUnfinishedExcept(file.getPath(), applicableOutputs);
    if (created > 0 || skipped > 0) {
      log.debug(
          "Digest placeholders for {}: {} created, {} skipped", file.getPath(), created, skipped);
    }
  }

  /**
   * Processes one file. The caller must hold the file's processing lock.
   *
   * @param filePath the file path
   * @param options reset and digester filter
   * @return per-digester outcome counts
   */
  @Timed(value = "digest.process_file", description = "Time to run all digesters of a file")
  public ProcessResult processFile(String filePath, ProcessOptions options) {
    Optional<FileRecord> found = fileRecordRepository.findByPath(filePath);
    if (found.isEmpty()) {
      int skipped = digestStore.skipUnfinishedExcept(filePath, Set.of());
      log.warn("File not found, skipped {} unfinished digests: {}", skipped, filePath);
      return ProcessResult.empty();
    }
    FileRecord file = found.get();
    ensureAllDigesters(file);

    int processed = 0;
    int skipped = 0;
    int failed = 0;
    for (Digester digester : digesterRegistry.getApplicable(file)) {
      // reload each time: earlier digesters and cascades change the records
      List<DigestRecord> existing = digestStore.listDigestsForPath(filePath);

      if (!shouldRun(digester, existing, options)) {
        skipped++;
        continue;
      }
      if (runDigester(file, digester, existing)) {
        processed++;
      } else {
        failed++;
      }
    }

    ProcessResult result = new ProcessResult(processed, skipped, failed);
    log.info(
        "Processed {}: {} ran, {} skipped, {} failed",
        filePath,
        result.processed(),
        result.skipped(),
        result.failed());
    return result;
  }

  private boolean shouldRun(
      Digester digester, List<DigestRecord> existing, ProcessOptions options) {
    if (options.hasDigesterFilter()) {
      boolean selected = options.digester().equals(digester.getName());
      if (!selected) {
        log.trace("Skipping {}: not selected", digester.getName());
      }
      return selected;
    }
    if (options.reset()) {
      return true;
    }

    int maxAttempts = digestConfig.getWorker().getMaxAttempts();
    boolean allDone = true;
    for (String output : digester.getOutputNames()) {
      Optional<DigestRecord> record = ExistingDigests.find(existing, output);
      DigestStatus status = record.map(DigestRecord::getStatus).orElse(DigestStatus.PENDING);
      if (status == DigestStatus.IN_PROGRESS) {
        log.debug("Skipping {}: {} is in progress", digester.getName(), output);
        return false;
      }
      if (status == DigestStatus.FAILED && record.get().getAttempts() >= maxAttempts) {
        log.debug(
            "Skipping {}: {} failed {} times", digester.getName(), output, maxAttempts);
        return false;
      }
      if (status != DigestStatus.COMPLETED && status != DigestStatus.SKIPPED) {
        allDone = false;
      }
    }
    if (allDone) {
      log.trace("Skipping {}: already complete", digester.getName());
    }
    return !allDone;
  }

  private boolean runDigester(FileRecord file, Digester digester, List<DigestRecord> existing) {
    String filePath = file.getPath();
    for (String output : digester.getOutputNames()) {
      digestStore.upsertDigest(DigestInput.inProgress(filePath, output));
    }

    try {
      List<DigestInput> results = digester.digest(file, existing);
      Set<String> written = new HashSet<>();
      for (DigestInput result : results) {
        digestStore.upsertDigest(result);
        written.add(result.digester());
      }
      for (String output : digester.getOutputNames()) {
        if (!written.contains(output)) {
          digestStore.upsertDigest(DigestInput.completed(filePath, output, null));
        }
      }
      for (DigestInput result : results) {
        if (result.status() == DigestStatus.COMPLETED && result.content() != null) {
          cascade(filePath, result.digester());
        }
      }
      meterRegistry.counter("digest.completed", "digester", digester.getName()).increment();
      log.debug("Digester {} completed for {}", digester.getName(), filePath);
      return true;
    } catch (DependencyNotReadyException e) {
      log.info("{} not ready for {}: {}", digester.getName(), filePath, e.getMessage());
      meterRegistry
          .counter("digest.dependency_not_ready", "digester", digester.getName())
          .increment();
      markFailed(filePath, digester, e.getMessage());
      return false;
    } catch (RuntimeException e) {
      log.error("Digester {} failed for {}: {}", digester.getName(), filePath, e.getMessage(), e);
      meterRegistry.counter("digest.failed", "digester", digester.getName()).increment();
      markFailed(filePath, digester, errorMessage(e));
      return false;
    }
  }

  private void cascade(String filePath, String output) {
    Set<String> downstream = digesterRegistry.findDownstream(output);
    if (downstream.isEmpty()) {
      return;
    }
    int reset = digestStore.resetToPending(filePath, downstream);
    if (reset > 0) {
      log.debug("New {} output for {} reset {} downstream digests", output, filePath, reset);
      meterRegistry.counter("digest.cascade.reset").increment(reset);
    }
  }

  private void markFailed(String filePath, Digester digester, String error) {
    for (String output : digester.getOutputNames()) {
      digestStore.upsertDigest(DigestInput.failed(filePath, output, error));
    }
  }

  private static String errorMessage(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
