package io.txevents.tx;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the pause after every failed attempt, starting at {@code baseDelayMs} and
 * saturating at {@code maxDelayMs}. Each pause is scaled by a random factor in
 * [0.5, 1.5) so that transactions that collided once do not collide again in lockstep.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private static final double MIN_JITTER = 0.5;
  private static final double MAX_JITTER = 1.5;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs (" + baseDelayMs + "), got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long backoffMillis(int failedAttempts) {
    if (failedAttempts < 1) {
      return 0L;
    }
    double factor = ThreadLocalRandom.current().nextDouble(MIN_JITTER, MAX_JITTER);
    return Math.min(maxDelayMs, (long) (ceiling(failedAttempts) * factor));
  }

  /**
   * Pause before jitter: {@code baseDelayMs * 2^(failedAttempts - 1)}, at most {@code maxDelayMs}.
   */
  long ceiling(int failedAttempts) {
    long delay = baseDelayMs;
    for (int i = 1; i < failedAttempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy{" + baseDelayMs + "ms.." + maxDelayMs + "ms}";
  }
}
