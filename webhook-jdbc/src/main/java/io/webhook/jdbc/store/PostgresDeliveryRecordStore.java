package io.webhook.jdbc.store;

import java.util.List;

/**
 * PostgreSQL delivery record store.
 *
 * <p>Payloads are stored as {@code JSONB} so they can be queried in place. PostgreSQL
 * re-serializes {@code JSONB} on read, so {@code payload_json} comes back semantically
 * equal to the signed body but not byte-identical.
 */
public final class PostgresDeliveryRecordStore extends AbstractJdbcDeliveryRecordStore {

  public PostgresDeliveryRecordStore() {
    super();
  }

  public PostgresDeliveryRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryRecordStore withTableName(String tableName) {
    return new PostgresDeliveryRecordStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String payloadPlaceholder() {
    return "CAST(? AS JSONB)";
  }
}
