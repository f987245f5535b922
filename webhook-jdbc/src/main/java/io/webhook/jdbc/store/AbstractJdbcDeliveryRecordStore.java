package io.webhook.jdbc.store;

import io.webhook.jdbc.JdbcTemplate;
import io.webhook.jdbc.TableNames;
import io.webhook.model.DeliveryRecord;
import io.webhook.model.DeliveryStatus;
import io.webhook.spi.DeliveryRecordStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC delivery record store with portable SQL.
 *
 * <p>Subclasses name the database they target and may override
 * {@link #payloadPlaceholder()} when the payload column needs a cast. Register custom
 * implementations via
 * {@code META-INF/services/io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore}.
 *
 * @see JdbcDeliveryRecordStores
 */
public abstract class AbstractJdbcDeliveryRecordStore implements DeliveryRecordStore {

  private static final String COLUMNS =
      "delivery_id, tenant_id, webhook_url, event_type, object_id, payload_json, " +
      "status, attempts, response_code, last_error, created_at, last_attempt_at, delivered_at";

  protected static final JdbcTemplate.RowMapper<DeliveryRecord> ROW_MAPPER = rs -> {
    int responseCode = rs.getInt("response_code");
    boolean noResponse = rs.wasNull();
    return new DeliveryRecord(
        rs.getString("delivery_id"),
        rs.getString("tenant_id"),
        rs.getString("webhook_url"),
        rs.getString("event_type"),
        rs.getString("object_id"),
        rs.getString("payload_json"),
        DeliveryStatus.fromCode(rs.getString("status")),
        rs.getInt("attempts"),
        noResponse ? null : responseCode,
        rs.getString("last_error"),
        JdbcTemplate.toInstant(rs.getTimestamp("created_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("last_attempt_at")),
        JdbcTemplate.toInstant(rs.getTimestamp("delivered_at")));
  };

  private final String tableName;

  protected AbstractJdbcDeliveryRecordStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcDeliveryRecordStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to another table.
   */
  public abstract AbstractJdbcDeliveryRecordStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  /** Bind expression for the payload column. */
  protected String payloadPlaceholder() {
    return "?";
  }

  @Override
  public void insertPending(Connection conn, String deliveryId, String tenantId, String webhookUrl,
      String payloadJson, String eventType, String objectId, Instant createdAt) {
    Objects.requireNonNull(deliveryId, "deliveryId");
    Objects.requireNonNull(createdAt, "createdAt");
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES " +
        "(?,?,?,?,?," + payloadPlaceholder() + ",?,0,NULL,NULL,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        deliveryId, tenantId, webhookUrl, eventType, objectId, payloadJson,
        DeliveryStatus.PENDING.code(), JdbcTemplate.toTimestamp(createdAt));
  }

  @Override
  public int markTerminal(Connection conn, String deliveryId, DeliveryStatus status, int attempts,
      Integer responseCode, String lastError, Instant lastAttemptAt, Instant deliveredAt) {
    Objects.requireNonNull(status, "status");
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal status: " + status);
    }
    String sql = "UPDATE " + tableName() +
        " SET status=?, attempts=?, response_code=?, last_error=?, last_attempt_at=?, delivered_at=?" +
        " WHERE delivery_id=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        status.code(), attempts, responseCode, lastError,
        JdbcTemplate.toTimestamp(lastAttemptAt),
        status == DeliveryStatus.DELIVERED ? JdbcTemplate.toTimestamp(deliveredAt) : null,
        deliveryId, DeliveryStatus.PENDING.code());
  }

  @Override
  public Optional<DeliveryRecord> find(Connection conn, String deliveryId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE delivery_id=?";
    List<DeliveryRecord> rows = JdbcTemplate.query(conn, sql, ROW_MAPPER, deliveryId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<DeliveryRecord> query(Connection conn, String tenantId, DeliveryStatus status,
      String eventType, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
        .append(" FROM ").append(tableName())
        .append(where(tenantId, status, eventType, params))
        .append(" ORDER BY created_at DESC, delivery_id DESC LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), ROW_MAPPER, params.toArray());
  }

  @Override
  public int count(Connection conn, String tenantId, DeliveryStatus status) {
    List<Object> params = new ArrayList<>();
    String sql = "SELECT COUNT(*) FROM " + tableName() + where(tenantId, status, null, params);
    return (int) JdbcTemplate.queryForLong(conn, sql, params.toArray());
  }

  private static String where(String tenantId, DeliveryStatus status, String eventType,
      List<Object> params) {
    List<String> clauses = new ArrayList<>();
    if (tenantId != null) {
      clauses.add("tenant_id=?");
      params.add(tenantId);
    }
    if (status != null) {
      clauses.add("status=?");
      params.add(status.code());
    }
    if (eventType != null) {
      clauses.add("event_type=?");
      params.add(eventType);
    }
    return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + tableName + "]";
  }
}
