package io.webhook.model;

import java.time.Instant;

/**
 * Read-only view of a persisted delivery row, as returned by
 * {@link io.webhook.record.DeliveryRecordManager} queries.
 *
 * @see io.webhook.spi.DeliveryRecordStore
 */
public record DeliveryRecord(
    String deliveryId,
    String tenantId,
    String webhookUrl,
    String eventType,
    String objectId,
    String payloadJson,
    DeliveryStatus status,
    int attempts,
    Integer responseCode,
    String lastError,
    Instant createdAt,
    Instant lastAttemptAt,
    Instant deliveredAt
) {}
