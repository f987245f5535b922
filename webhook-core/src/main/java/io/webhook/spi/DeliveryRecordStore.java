package io.webhook.spi;

import io.webhook.model.DeliveryRecord;
import io.webhook.model.DeliveryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for delivery records, one row per delivery attempt set:
 * {@code PENDING} on creation, then exactly one terminal update to
 * {@code DELIVERED} or {@code FAILED}.
 *
 * <p>All methods receive an explicit {@link Connection}; implementations live in the
 * {@code webhook-jdbc} module and throw unchecked exceptions on SQL errors.
 *
 * @see io.webhook.record.DeliveryAttemptRecorder
 */
public interface DeliveryRecordStore {

    /**
     * Inserts a new record with status {@code PENDING} and zero attempts.
     *
     * @param conn        the JDBC connection
     * @param deliveryId  unique delivery identifier
     * @param tenantId    owning tenant
     * @param webhookUrl  destination URL
     * @param payloadJson canonical JSON payload
     * @param eventType   event type name
     * @param objectId    related object identifier (may be {@code null})
     * @param createdAt   creation time
     */
    void insertPending(Connection conn, String deliveryId, String tenantId, String webhookUrl,
                       String payloadJson, String eventType, String objectId, Instant createdAt);

    /**
     * Moves a {@code PENDING} record to a terminal status.
     *
     * <p>Implementations <strong>must</strong> only match rows still in {@code PENDING},
     * so a terminal record is never rewritten.
     *
     * @param conn          the JDBC connection
     * @param deliveryId    the delivery to update
     * @param status        terminal status ({@code DELIVERED} or {@code FAILED})
     * @param attempts      attempts made
     * @param responseCode  last HTTP status (may be {@code null})
     * @param lastError     last error text (may be {@code null})
     * @param lastAttemptAt time of the terminal outcome
     * @param deliveredAt   delivery time, set only for {@code DELIVERED}
     * @return the number of rows updated (0 or 1)
     */
    int markTerminal(Connection conn, String deliveryId, DeliveryStatus status, int attempts,
                     Integer responseCode, String lastError, Instant lastAttemptAt, Instant deliveredAt);

    /**
     * Looks up a single record.
     *
     * @param conn       the JDBC connection
     * @param deliveryId the delivery identifier
     * @return the record, if present
     */
    Optional<DeliveryRecord> find(Connection conn, String deliveryId);

    /**
     * Queries records with optional filters, newest first.
     *
     * @param conn      the JDBC connection
     * @param tenantId  optional tenant filter ({@code null} for all)
     * @param status    optional status filter ({@code null} for all)
     * @param eventType optional event type filter ({@code null} for all)
     * @param limit     maximum number of records to return
     * @return matching records
     */
    List<DeliveryRecord> query(Connection conn, String tenantId, DeliveryStatus status,
                               String eventType, int limit);

    /**
     * Counts records with optional filters.
     *
     * @param conn     the JDBC connection
     * @param tenantId optional tenant filter ({@code null} for all)
     * @param status   optional status filter ({@code null} for all)
     * @return the number of matching records
     */
    int count(Connection conn, String tenantId, DeliveryStatus status);
}
