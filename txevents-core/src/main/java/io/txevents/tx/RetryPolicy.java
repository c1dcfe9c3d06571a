package io.txevents.tx;

/**
 * Decides how long a read-write scope waits before re-running work that failed on a
 * transient conflict.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /** Re-runs immediately. */
  RetryPolicy IMMEDIATE = failedAttempts -> 0L;

  /**
   * @param failedAttempts attempts of the same unit of work that have failed so far, starting at 1
   * @return pause in milliseconds, never negative
   */
  long backoffMillis(int failedAttempts);
}
