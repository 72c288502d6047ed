package com.flamingo.ai.lifedigest.service.worker;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import com.flamingo.ai.lifedigest.service.digest.DigestCoordinator;
import com.flamingo.ai.lifedigest.service.digest.DigestStore;
import com.flamingo.ai.lifedigest.service.digest.ProcessOptions;
import com.flamingo.ai.lifedigest.service.lock.ProcessingLockService;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Background loop that selects files needing digestion and runs them through the coordinator.
 *
 * <p>All processing happens on one dedicated thread. Commands from {@link DigestWorkerClient} are
 * queued and handled on that thread between iterations and while it sleeps. Every processing path
 * holds the file's processing lock; a file locked elsewhere is skipped, not waited for.
 */
@Component
@Slf4j
public class DigestWorker implements SmartLifecycle {

  private final DigestCoordinator digestCoordinator;
  private final DigestStore digestStore;
  private final ProcessingLockService processingLockService;
  private final ApplicationEventPublisher eventPublisher;
  private final ThreadPoolTaskExecutor executor;
  private final DigestConfig.Worker config;
  private final BackoffPolicy backoffPolicy;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final BlockingQueue<DigestWorkerCommand> inbox = new LinkedBlockingQueue<>();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private volatile boolean running;
  private volatile WorkerState state = WorkerState.IDLE;
  private volatile CountDownLatch terminated = new CountDownLatch(0);
  private volatile Future<?> loopFuture;

  // only touched by the worker thread
  private int consecutiveFailures;
  private long lastStaleSweepMs;
  private long lastLockSweepMs;

  public DigestWorker(
      DigestCoordinator digestCoordinator,
      DigestStore digestStore,
      ProcessingLockService processingLockService,
      ApplicationEventPublisher eventPublisher,
      @Qualifier("digestWorkerExecutor") ThreadPoolTaskExecutor executor,
      DigestConfig digestConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.digestCoordinator = digestCoordinator;
    this.digestStore = digestStore;
    this.processingLockService = processingLockService;
    this.eventPublisher = eventPublisher;
    this.executor = executor;
    this.config = digestConfig.getWorker();
    this.backoffPolicy =
        new BackoffPolicy(config.getFailureBaseDelayMs(), config.getFailureMaxDelayMs());
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  public boolean isAutoStartup() {
    return config.isEnabled();
  }

  /** Releases locks of a previous run, then starts the loop thread. A failure aborts start-up. */
  @Override
  public void start() {
    if (running) {
      return;
    }
    int released = processingLockService.releaseOrphanedLocks();
    log.info("Starting digest worker (released {} orphaned locks)", released);

    stopRequested.set(false);
    terminated = new CountDownLatch(1);
    running = true;
    loopFuture = executor.submit(this::runLoop);
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    log.info("Stopping digest worker");
    stopRequested.set(true);
    inbox.offer(new DigestWorkerCommand.Shutdown());
    try {
      if (!terminated.await(config.getShutdownGraceMs(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Digest worker did not finish within {} ms, interrupting",
            config.getShutdownGraceMs());
        Future<?> future = loopFuture;
        if (future != null) {
          future.cancel(true);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the digest worker to stop");
    }
    running = false;
    state = WorkerState.STOPPED;
    eventPublisher.publishEvent(new DigestWorkerEvent.ShutdownComplete());
    log.info("Digest worker stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Queues a command for the worker thread. */
  public void send(DigestWorkerCommand command) {
    inbox.offer(command);
  }

  public WorkerState getState() {
    return state;
  }

  private void runLoop() {
    try {
      eventPublisher.publishEvent(new DigestWorkerEvent.Ready());
      log.info("Digest worker ready, first iteration in {} ms", config.getStartDelayMs());
      waitFor(config.getStartDelayMs());

      while (!stopRequested.get()) {
        long delay;
        try {
          delay = runOnce();
        } catch (RuntimeException e) {
          consecutiveFailures++;
          delay = backoffPolicy.delayFor(consecutiveFailures);
          state = WorkerState.BACKOFF;
          meterRegistry.counter("digest.worker.loop_errors").increment();
          log.error(
              "Digest worker iteration failed ({} in a row), retrying in {} ms: {}",
              consecutiveFailures,
              delay,
              e.getMessage(),
              e);
        }
        waitFor(delay);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Digest worker interrupted");
    } catch (Error e) {
      log.error("Fatal error in digest worker, terminating: {}", e.getMessage(), e);
      throw e;
    } finally {
      state = WorkerState.STOPPED;
      running = false;
      terminated.countDown();
      log.info("Digest worker loop exited");
    }
  }

  /**
   * Runs one iteration: sweeps when due, selects at most one file and processes it.
   *
   * @return delay before the next iteration in milliseconds
   */
  @VisibleForTesting
  long runOnce() {
    meterRegistry.counter("digest.worker.iterations").increment();
    maybeSweepStaleDigests();
    maybeSweepLocks();

    state = WorkerState.SELECTING;
    List<String> candidates = digestStore.findFilesNeedingDigestion(1);
    if (candidates.isEmpty()) {
      consecutiveFailures = 0;
      state = WorkerState.IDLE;
      return config.getIdleSleepMs();
    }

    String filePath = candidates.get(0);
    ProcessOutcome outcome = processLocked(filePath, ProcessOptions.defaults());
    switch (outcome) {
      case LOCKED -> {
        log.debug("Skipping {}: locked by another process", filePath);
        state = WorkerState.IDLE;
        return config.getIdleSleepMs();
      }
      case SUCCEEDED -> {
        consecutiveFailures = 0;
        state = WorkerState.IDLE;
        return 0;
      }
      default -> {
        consecutiveFailures++;
        long delay = backoffPolicy.delayFor(consecutiveFailures);
        state = WorkerState.BACKOFF;
        meterRegistry.counter("digest.worker.backoff").increment();
        log.info(
            "File {} has failed digests ({} failures in a row), backing off {} ms",
            filePath,
            consecutiveFailures,
            delay);
        return delay;
      }
    }
  }

  /** Handles one inbox command. Errors are logged and never stop the loop. */
  @VisibleForTesting
  void handleCommand(DigestWorkerCommand command) {
    try {
      if (command instanceof DigestWorkerCommand.Digest digest) {
        ProcessOptions options = new ProcessOptions(digest.reset(), digest.digester());
        processRequested(digest.filePath(), options);
      } else if (command instanceof DigestWorkerCommand.FileChange change) {
        handleFileChange(change);
      } else if (command instanceof DigestWorkerCommand.Shutdown) {
        log.info("Shutdown requested");
        stopRequested.set(true);
      } else {
        log.warn("Unknown digest worker command: {}", command);
      }
    } catch (RuntimeException e) {
      log.error("Failed to handle {}: {}", command, e.getMessage(), e);
    }
  }

  private void handleFileChange(DigestWorkerCommand.FileChange change) {
    String filePath = change.filePath();
    if (change.isNew()) {
      processRequested(filePath, ProcessOptions.defaults());
    } else if (change.contentChanged()) {
      log.info("Content of {} changed, re-running all digesters", filePath);
      processRequested(filePath, ProcessOptions.forceAll());
    } else if (digestStore
        .findFilesNeedingDigestion(config.getFileChangeLookupLimit())
        .contains(filePath)) {
      processRequested(filePath, ProcessOptions.defaults());
    } else {
      log.debug("Ignoring change of {}: nothing to do", filePath);
    }
  }

  private void processRequested(String filePath, ProcessOptions options) {
    if (processLocked(filePath, options) == ProcessOutcome.LOCKED) {
      log.warn("Requested digest of {} skipped: file is locked by another process", filePath);
    }
  }

  private ProcessOutcome processLocked(String filePath, ProcessOptions options) {
    if (!processingLockService.acquireLock(filePath)) {
      return ProcessOutcome.LOCKED;
    }
    try {
      state = WorkerState.PROCESSING;
      eventPublisher.publishEvent(new DigestWorkerEvent.DigestStarted(filePath));
      boolean success = false;
      try {
        digestCoordinator.processFile(filePath, options);
        success = !digestStore.hasFailedDigests(filePath);
      } finally {
        eventPublisher.publishEvent(new DigestWorkerEvent.DigestComplete(filePath, success));
      }
      return success ? ProcessOutcome.SUCCEEDED : ProcessOutcome.FAILED;
    } finally {
      processingLockService.releaseLock(filePath);
    }
  }

  private void maybeSweepStaleDigests() {
    long now = clock.millis();
    if (now - lastStaleSweepMs < config.getStaleSweepIntervalMs()) {
      return;
    }
    lastStaleSweepMs = now;
    LocalDateTime cutoff =
        LocalDateTime.now(clock).minus(Duration.ofMillis(config.getStaleDigestThresholdMs()));
    int reset = digestStore.resetStaleInProgressDigests(cutoff);
    if (reset > 0) {
      meterRegistry.counter("digest.stale.reset").increment(reset);
    }
  }

  private void maybeSweepLocks() {
    long now = clock.millis();
    if (now - lastLockSweepMs < config.getLockSweepIntervalMs()) {
      return;
    }
    lastLockSweepMs = now;
    processingLockService.cleanupStaleLocks();
  }

  /** Sleeps up to {@code delayMs}, handling inbox commands as they arrive. */
  private void waitFor(long delayMs) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
    while (!stopRequested.get()) {
      DigestWorkerCommand command = inbox.poll();
      if (command == null) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return;
        }
        command = inbox.poll(remaining, TimeUnit.NANOSECONDS);
        if (command == null) {
          return;
        }
      }
      handleCommand(command);
    }
  }

  private enum ProcessOutcome {
    LOCKED,
    SUCCEEDED,
    FAILED
  }
}
