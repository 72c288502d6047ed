package com.flamingo.ai.lifedigest.service.worker;

import com.flamingo.ai.lifedigest.config.DigestConfig;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Caller-side facade of the digest worker. Requests are fire-and-forget; progress is reported
 * through {@link DigestWorkerEvent}s.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DigestWorkerClient {

  private final DigestWorker digestWorker;
  private final DigestConfig digestConfig;

  private volatile CountDownLatch ready = new CountDownLatch(1);

  @EventListener
  public void onReady(DigestWorkerEvent.Ready event) {
    log.debug("Digest worker reported ready");
    ready.countDown();
  }

  @EventListener
  public void onShutdownComplete(DigestWorkerEvent.ShutdownComplete event) {
    ready = new CountDownLatch(1);
  }

  @EventListener
  public void onDigestComplete(DigestWorkerEvent.DigestComplete event) {
    log.debug("Digest of {} finished, success={}", event.filePath(), event.success());
  }

  public boolean isReady() {
    return ready.getCount() == 0;
  }

  /** Waits for the worker up to the configured ready timeout. */
  public boolean awaitReady() {
    return awaitReady(Duration.ofMillis(digestConfig.getWorker().getReadyTimeoutMs()));
  }

  /**
   * Waits until the worker has started.
   *
   * @return true if the worker is ready, false on timeout or interruption
   */
  public boolean awaitReady(Duration timeout) {
    try {
      return ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Asks the worker to process a file.
   *
   * @param filePath the file path
   * @param reset re-run digesters whose output is complete
   * @param digester run only this digester, or null for all
   */
  public void requestDigest(String filePath, boolean reset, String digester) {
    warnIfNotReady("digest " + filePath);
    digestWorker.send(new DigestWorkerCommand.Digest(filePath, reset, digester));
  }

  public void requestDigest(String filePath) {
    requestDigest(filePath, false, null);
  }

  /**
   * Tells the worker that a file appeared or changed.
   *
   * @param filePath the file path
   * @param isNew the file was just created
   * @param contentChanged the content hash differs from the previous one
   */
  public void notifyFileChange(String filePath, boolean isNew, boolean contentChanged) {
    warnIfNotReady("file change " + filePath);
    digestWorker.send(new DigestWorkerCommand.FileChange(filePath, isNew, contentChanged));
  }

  private void warnIfNotReady(String request) {
    if (!isReady()) {
      log.warn("Digest worker not ready yet, queueing {}", request);
    }
  }
}
