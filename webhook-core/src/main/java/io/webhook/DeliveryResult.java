package io.webhook;

import io.webhook.model.DeliveryStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a delivery, returned to the caller.
 *
 * @param deliveryId     the record id, or {@code null} if the destination was rejected
 *                       before an id was assigned
 * @param status         {@link DeliveryStatus#DELIVERED} or {@link DeliveryStatus#FAILED}
 * @param attempts       HTTP attempts made
 * @param responseCode   status code of the last response, or {@code null}
 * @param error          human-readable error, or {@code null} on success
 * @param duration       wall-clock time including backoff
 * @param failureReason  why the delivery failed, {@link FailureReason#NONE} on success
 */
public record DeliveryResult(
        String deliveryId,
        DeliveryStatus status,
        int attempts,
        Integer responseCode,
        String error,
        Duration duration,
        FailureReason failureReason) {

    public DeliveryResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(failureReason, "failureReason");
        if (status == DeliveryStatus.PENDING) {
            throw new IllegalArgumentException("result status must be terminal");
        }
        if ((status == DeliveryStatus.DELIVERED) != (failureReason == FailureReason.NONE)) {
            throw new IllegalArgumentException(
                    "failureReason " + failureReason + " inconsistent with status " + status);
        }
    }

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }

    /** Classifies a failed delivery. */
    public enum FailureReason {
        NONE,
        /** Destination failed safety validation; no request was sent. */
        INVALID_DESTINATION,
        /** Receiver answered 3xx or 4xx; never retried. */
        CLIENT_REJECTED,
        /** Every attempt hit a 5xx or transport error. */
        RETRIES_EXHAUSTED,
        /** Endpoint circuit breaker was open; no request was sent. */
        CIRCUIT_OPEN,
        /** The delivering thread was interrupted. */
        INTERRUPTED
    }
}
