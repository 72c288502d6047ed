package com.flamingo.ai.lifedigest.service.worker;

/** Messages accepted by the digest worker, handled in arrival order on the worker thread. */
public interface DigestWorkerCommand {

  /** Process one file now, typically right after an upload. */
  record Digest(String filePath, boolean reset, String digester) implements DigestWorkerCommand {}

  /** A file appeared or changed on disk. */
  record FileChange(String filePath, boolean isNew, boolean contentChanged)
      implements DigestWorkerCommand {}

  record Shutdown() implements DigestWorkerCommand {}
}
