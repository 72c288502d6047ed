package com.flamingo.ai.lifedigest.service.worker;

/** Notifications published by the digest worker on the application event bus. */
public interface DigestWorkerEvent {

  record Ready() implements DigestWorkerEvent {}

  record DigestStarted(String filePath) implements DigestWorkerEvent {}

  /**
   * Processing of a file ended.
   *
   * @param success true when no digest of the file is left failed
   */
  record DigestComplete(String filePath, boolean success) implements DigestWorkerEvent {}

  record ShutdownComplete() implements DigestWorkerEvent {}
}
