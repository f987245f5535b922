package io.webhook.jdbc.store;

import java.util.List;

/**
 * MySQL delivery record store. Also compatible with TiDB.
 *
 * <p>The payload column is {@code LONGTEXT} rather than {@code JSON}: MySQL normalizes
 * {@code JSON} values on write, which would break byte-for-byte comparison with the
 * signed body.
 */
public final class MySqlDeliveryRecordStore extends AbstractJdbcDeliveryRecordStore {

  public MySqlDeliveryRecordStore() {
    super();
  }

  public MySqlDeliveryRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryRecordStore withTableName(String tableName) {
    return new MySqlDeliveryRecordStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }
}
