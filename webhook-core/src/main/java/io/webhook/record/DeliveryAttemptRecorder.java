package io.webhook.record;

import io.webhook.model.DeliveryStatus;

import java.time.Instant;

/**
 * Persists the lifecycle of tracked deliveries: one {@link #create} when a delivery
 * starts and one {@link #update} when it reaches a terminal status.
 *
 * <p>Implementations never throw. A failure to persist is logged and the delivery
 * continues; the outcome returned to the caller does not depend on persistence.
 *
 * @see DefaultDeliveryAttemptRecorder
 */
public interface DeliveryAttemptRecorder {

    /**
     * Recorder that persists nothing, used when no store is configured.
     */
    DeliveryAttemptRecorder NOOP = new Noop();

    /**
     * Records a new {@code PENDING} delivery.
     *
     * @param deliveryId  the delivery identifier
     * @param tenantId    owning tenant
     * @param webhookUrl  destination URL
     * @param payloadJson canonical JSON payload
     * @param eventType   event type name
     * @param objectId    related object identifier (may be {@code null})
     */
    void create(String deliveryId, String tenantId, String webhookUrl, String payloadJson,
                String eventType, String objectId);

    /**
     * Records the terminal outcome of a delivery.
     *
     * @param deliveryId   the delivery identifier
     * @param status       {@code DELIVERED} or {@code FAILED}
     * @param attempts     attempts made
     * @param responseCode last HTTP status (may be {@code null})
     * @param lastError    last error (may be {@code null})
     * @param deliveredAt  delivery time for {@code DELIVERED}, otherwise {@code null}
     */
    void update(String deliveryId, DeliveryStatus status, int attempts, Integer responseCode,
                String lastError, Instant deliveredAt);

    /**
     * No-op implementation.
     */
    final class Noop implements DeliveryAttemptRecorder {
        @Override
        public void create(String deliveryId, String tenantId, String webhookUrl, String payloadJson,
                           String eventType, String objectId) {
        }

        @Override
        public void update(String deliveryId, DeliveryStatus status, int attempts, Integer responseCode,
                           String lastError, Instant deliveredAt) {
        }
    }
}
