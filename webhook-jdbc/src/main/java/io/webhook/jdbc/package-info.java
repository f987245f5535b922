/**
 * JDBC persistence for delivery records.
 *
 * <p>{@link io.webhook.jdbc.DataSourceConnectionProvider} adapts a pooled
 * {@link javax.sql.DataSource}; SQL failures surface as
 * {@link io.webhook.jdbc.DeliveryStoreException}. Database-specific stores live in
 * {@link io.webhook.jdbc.store}.
 */
package io.webhook.jdbc;
