package io.webhook.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections for recording delivery attempts.
 *
 * <p>Callers close each connection after a single create, update or query.
 *
 * @see io.webhook.record.DeliveryAttemptRecorder
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open JDBC connection
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
