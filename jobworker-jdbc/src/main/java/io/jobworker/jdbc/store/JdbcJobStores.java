package io.jobworker.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Picks the job store whose claim query fits the database behind a {@link DataSource}.
 *
 * <p>Stores are discovered with {@link ServiceLoader}; an application can plug in another
 * dialect by listing its {@link AbstractJdbcJobStore} subclass in
 * {@code META-INF/services/io.jobworker.jdbc.store.AbstractJdbcJobStore}. Stores returned
 * here use the default {@code jobs} table; call {@link AbstractJdbcJobStore#withTableName}
 * for another one.
 */
public final class JdbcJobStores {

    // keyed by lower-case dialect name, sorted so error messages are stable
    private static final Map<String, AbstractJdbcJobStore> DIALECTS = new TreeMap<>();

    static {
        for (AbstractJdbcJobStore store : ServiceLoader.load(AbstractJdbcJobStore.class)) {
            DIALECTS.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcJobStores() {
    }

    /**
     * Looks up a store by dialect name ({@code h2}, {@code mysql}, {@code postgresql}).
     *
     * @throws IllegalArgumentException for a dialect with no registered store
     */
    public static AbstractJdbcJobStore get(String dialect) {
        AbstractJdbcJobStore store = dialect == null ? null : DIALECTS.get(dialect.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("No job store for dialect " + dialect
                    + "; registered dialects: " + DIALECTS.keySet());
        }
        return store;
    }

    /**
     * Opens one connection to read the JDBC URL and matches it against the registered stores.
     *
     * @throws IllegalStateException if no connection can be opened
     * @throws IllegalArgumentException if the database has no matching store
     */
    public static AbstractJdbcJobStore detect(DataSource dataSource) {
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot open a connection to choose the job store", e);
        }
        return detect(url);
    }

    /**
     * Matches a JDBC URL such as {@code jdbc:postgresql://db/bot} against the URL prefixes of
     * the registered stores.
     *
     * @throws IllegalArgumentException if the URL is blank or no store claims it
     */
    public static AbstractJdbcJobStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("JDBC URL is required to choose a job store");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcJobStore store : DIALECTS.values()) {
            if (store.jdbcUrlPrefixes().stream().anyMatch(p -> url.startsWith(p.toLowerCase(Locale.ROOT)))) {
                return store;
            }
        }
        throw new IllegalArgumentException("Job queue needs H2, MySQL/MariaDB or PostgreSQL; unsupported JDBC URL "
                + jdbcUrl + " (registered dialects: " + DIALECTS.keySet() + ")");
    }
}
