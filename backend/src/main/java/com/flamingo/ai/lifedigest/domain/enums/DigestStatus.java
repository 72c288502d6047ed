package com.flamingo.ai.lifedigest.domain.enums;

/** Lifecycle status of a digest record. */
public enum DigestStatus {
  /** Placeholder created; waiting to be run. */
  PENDING,

  /** A digester is currently running for this record. */
  IN_PROGRESS,

  /** Digester finished; content may be null when there was nothing to produce. */
  COMPLETED,

  /** Digester threw; error and attempts are set. */
  FAILED,

  /** Digester no longer applies to the file. */
  SKIPPED;

  /** Returns true if no automatic transition will leave this status without a reset. */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == SKIPPED;
  }
}
