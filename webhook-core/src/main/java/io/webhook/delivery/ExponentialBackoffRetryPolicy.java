package io.webhook.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using capped exponential backoff with optional upward jitter.
 *
 * <p>Delay formula: {@code min(baseDelay * 2^(attempt-1), maxDelay)}, then extended by a
 * random fraction in {@code [0, jitterRatio)} of itself. Jitter never shortens a delay.
 * With the defaults (1s base, no jitter) the sequence is 1s, 2s, 4s, ...
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 1000;
  public static final long DEFAULT_MAX_DELAY_MS = 60_000;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitterRatio;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, 0.0);
  }

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   * @param maxDelayMs  cap on the exponential term (milliseconds)
   * @param jitterRatio extra random delay as a fraction of the computed delay, in [0, 1]
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitterRatio) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (!(jitterRatio >= 0.0 && jitterRatio <= 1.0)) {
      throw new IllegalArgumentException("jitterRatio must be in [0, 1], got: " + jitterRatio);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterRatio = jitterRatio;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (attempt >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      // overflow guard
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitterRatio == 0.0 || capped == 0) {
      return capped;
    }
    double extra = ThreadLocalRandom.current().nextDouble(0.0, jitterRatio);
    return capped + (long) (capped * extra);
  }
}
