package com.flamingo.ai.lifedigest.service.worker;

/**
 * Exponential backoff with a ceiling: {@code min(base * 2^(failures - 1), max)}.
 *
 * @param baseDelayMs delay after the first failure
 * @param maxDelayMs upper bound for any delay
 */
public record BackoffPolicy(long baseDelayMs, long maxDelayMs) {

  public BackoffPolicy {
    if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "Invalid backoff: base=" + baseDelayMs + " max=" + maxDelayMs);
    }
  }

  /**
   * Returns the delay before the next attempt.
   *
   * @param consecutiveFailures failures in a row; zero or less means no delay
   */
  public long delayFor(int consecutiveFailures) {
    if (consecutiveFailures <= 0) {
      return 0;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < consecutiveFailures && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }
}
