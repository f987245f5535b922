package io.webhook.delivery;

/**
 * Strategy for computing the backoff before the next delivery attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds after a failed attempt.
     *
     * @param attempt the attempt that just failed (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
