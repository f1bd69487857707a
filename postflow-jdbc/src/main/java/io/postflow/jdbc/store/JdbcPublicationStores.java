package io.postflow.jdbc.store;

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
 * Registry for JDBC publication stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.postflow.jdbc.store.AbstractJdbcPublicationStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcPublicationStore store = JdbcPublicationStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcPublicationStore store = JdbcPublicationStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcPublicationStore store = JdbcPublicationStores.get("postgresql");
 * }</pre>
 */
public final class JdbcPublicationStores {

    private static final List<AbstractJdbcPublicationStore> STORES;
    private static final Map<String, AbstractJdbcPublicationStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcPublicationStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcPublicationStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcPublicationStores() {
    }

    /**
     * Returns all registered publication stores.
     */
    public static List<AbstractJdbcPublicationStore> all() {
        return STORES;
    }

    /**
     * Gets a publication store by name.
     *
     * @param name store name (case-insensitive)
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcPublicationStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcPublicationStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown publication store: " + name
                    + ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the publication store from a DataSource's JDBC URL.
     *
     * @throws IllegalStateException if the URL cannot be read
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcPublicationStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect publication store from DataSource", e);
        }
    }

    /**
     * Auto-detects the publication store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store matches the URL
     */
    public static AbstractJdbcPublicationStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcPublicationStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No publication store found for JDBC URL: " + jdbcUrl
                + ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
