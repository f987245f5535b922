package io.webhook.record;

import io.webhook.model.DeliveryRecord;
import io.webhook.model.DeliveryStatus;
import io.webhook.spi.ConnectionProvider;
import io.webhook.spi.DeliveryRecordStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for looking up and auditing delivery records.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Read
 * failures are logged and yield empty results.
 *
 * @see DeliveryRecordStore#find
 * @see DeliveryRecordStore#query
 * @see DeliveryRecordStore#count
 */
public final class DeliveryRecordManager {
  private static final Logger logger = Logger.getLogger(DeliveryRecordManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryRecordStore store;

  public DeliveryRecordManager(ConnectionProvider connectionProvider, DeliveryRecordStore store) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Finds a record by id.
   *
   * @param deliveryId the delivery identifier
   * @return the record, or empty if absent or the lookup failed
   */
  public Optional<DeliveryRecord> find(String deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.find(conn, deliveryId);
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to find delivery record: " + deliveryId, e);
      return Optional.empty();
    }
  }

  /**
   * Queries records with optional filters.
   *
   * @param tenantId  optional tenant filter ({@code null} for all)
   * @param status    optional status filter ({@code null} for all)
   * @param eventType optional event type filter ({@code null} for all)
   * @param limit     maximum number of records to return
   * @return matching records, newest first
   */
  public List<DeliveryRecord> query(String tenantId, DeliveryStatus status, String eventType, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return store.query(conn, tenantId, status, eventType, limit);
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to query delivery records", e);
      return List.of();
    }
  }

  /**
   * Counts records with optional filters.
   *
   * @param tenantId optional tenant filter ({@code null} for all)
   * @param status   optional status filter ({@code null} for all)
   * @return the number of matching records, or 0 if the count failed
   */
  public int count(String tenantId, DeliveryStatus status) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.count(conn, tenantId, status);
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to count delivery records", e);
      return 0;
    }
  }
}
