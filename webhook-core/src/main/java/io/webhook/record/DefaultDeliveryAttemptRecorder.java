package io.webhook.record;

import io.webhook.model.DeliveryStatus;
import io.webhook.spi.ConnectionProvider;
import io.webhook.spi.DeliveryRecordStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliveryAttemptRecorder} backed by a {@link DeliveryRecordStore}.
 *
 * <p>Each call obtains its own auto-commit connection. Every exception, checked or not,
 * is logged at {@code SEVERE} and swallowed. An update that matches no {@code PENDING}
 * row is logged at {@code WARNING}.
 */
public final class DefaultDeliveryAttemptRecorder implements DeliveryAttemptRecorder {
  private static final Logger logger = Logger.getLogger(DefaultDeliveryAttemptRecorder.class.getName());

  /** Longest {@code last_error} value written. */
  public static final int MAX_ERROR_LENGTH = 4000;

  private final ConnectionProvider connectionProvider;
  private final DeliveryRecordStore store;
  private final Clock clock;

  public DefaultDeliveryAttemptRecorder(ConnectionProvider connectionProvider, DeliveryRecordStore store) {
    this(connectionProvider, store, Clock.systemUTC());
  }

  public DefaultDeliveryAttemptRecorder(ConnectionProvider connectionProvider,
      DeliveryRecordStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void create(String deliveryId, String tenantId, String webhookUrl, String payloadJson,
      String eventType, String objectId) {
    Instant now = clock.instant();
    withConnection("create delivery record", deliveryId, conn -> {
      store.insertPending(conn, deliveryId, tenantId, webhookUrl, payloadJson, eventType, objectId, now);
      return 1;
    });
  }

  @Override
  public void update(String deliveryId, DeliveryStatus status, int attempts, Integer responseCode,
      String lastError, Instant deliveredAt) {
    Instant now = clock.instant();
    String error = truncate(lastError);
    int updated = withConnection("update delivery record", deliveryId,
        conn -> store.markTerminal(conn, deliveryId, status, attempts, responseCode, error, now, deliveredAt));
    if (updated == 0) {
      logger.warning("No pending delivery record to update: " + deliveryId);
    }
  }

  private int withConnection(String action, String deliveryId, StoreAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for deliveryId=" + deliveryId, e);
      return -1;
    }
  }

  static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  @FunctionalInterface
  private interface StoreAction {
    int execute(Connection conn) throws Exception;
  }
}
