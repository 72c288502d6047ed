package com.flamingo.ai.lifedigest.service.worker;

/** Observable state of the digest worker loop. */
public enum WorkerState {
  IDLE,
  SELECTING,
  PROCESSING,
  BACKOFF,
  STOPPED
}
