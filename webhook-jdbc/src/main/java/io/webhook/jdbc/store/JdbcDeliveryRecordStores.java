package io.webhook.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC delivery record stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.webhook.jdbc.store.AbstractJdbcDeliveryRecordStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcDeliveryRecordStore store = JdbcDeliveryRecordStores.detect(dataSource);
 *
 * // Get by name, bound to a custom table
 * AbstractJdbcDeliveryRecordStore store =
 *     JdbcDeliveryRecordStores.get("postgresql").withTableName("tenant_webhook_log");
 * }</pre>
 */
public final class JdbcDeliveryRecordStores {

    private static final List<AbstractJdbcDeliveryRecordStore> STORES;
    private static final Map<String, AbstractJdbcDeliveryRecordStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcDeliveryRecordStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcDeliveryRecordStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcDeliveryRecordStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcDeliveryRecordStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcDeliveryRecordStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcDeliveryRecordStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown delivery record store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the store from a DataSource's connection URL.
     *
     * @param dataSource the data source
     * @return detected store
     * @throws IllegalStateException if the URL cannot be read or matches no store
     */
    public static AbstractJdbcDeliveryRecordStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect delivery record store from DataSource", e);
        }
        try {
            return detect(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Auto-detects the store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected store
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcDeliveryRecordStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcDeliveryRecordStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No delivery record store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
