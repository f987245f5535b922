package io.webhook.jdbc.store;

import java.util.List;

/**
 * H2 delivery record store, used for tests and embedded deployments.
 */
public final class H2DeliveryRecordStore extends AbstractJdbcDeliveryRecordStore {

  public H2DeliveryRecordStore() {
    super();
  }

  public H2DeliveryRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryRecordStore withTableName(String tableName) {
    return new H2DeliveryRecordStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
