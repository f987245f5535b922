/**
 * JDBC {@link io.webhook.spi.DeliveryRecordStore} implementations.
 *
 * <p>{@link io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore} holds the shared SQL;
 * subclasses cover H2, MySQL/TiDB and PostgreSQL. Terminal updates only match rows
 * still in {@code pending}.
 *
 * @see io.webhook.jdbc.store.JdbcDeliveryRecordStores
 */
package io.webhook.jdbc.store;
