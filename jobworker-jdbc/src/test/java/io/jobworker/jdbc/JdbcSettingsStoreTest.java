package io.jobworker.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSettingsStoreTest {

    private JdbcDataSource dataSource;
    private final JdbcSettingsStore store = new JdbcSettingsStore();

    @BeforeEach
    void setUp() throws Exception {
        dataSource = SchemaLoader.newH2DataSource();
    }

    @Test
    void missingKeyIsEmpty() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertTrue(store.get(conn, "auto_broadcast.last_triggered_at").isEmpty());
        }
    }

    @Test
    void putInsertsThenOverwrites() throws Exception {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            store.put(conn, "k", "first", now);
            store.put(conn, "k", "second", now.plusSeconds(5));

            assertEquals(Optional.of("second"), store.get(conn, "k"));
            try (var rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM worker_settings")) {
                rs.next();
                assertEquals(1, rs.getInt(1));
            }
        }
    }

    @Test
    void compareAndSetOnlyWritesOverExpectedValue() throws Exception {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            store.put(conn, "k", "first", now);

            assertFalse(store.compareAndSet(conn, "k", "stale", "second", now));
            assertEquals(Optional.of("first"), store.get(conn, "k"));

            assertTrue(store.compareAndSet(conn, "k", "first", "second", now));
            assertEquals(Optional.of("second"), store.get(conn, "k"));
        }
    }

    @Test
    void compareAndSetWithNullExpectedRequiresAbsentKey() throws Exception {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            assertTrue(store.compareAndSet(conn, "k", null, "first", now));
            assertFalse(store.compareAndSet(conn, "k", null, "second", now));
            assertEquals(Optional.of("first"), store.get(conn, "k"));
        }
    }

    @Test
    void rejectsNullValue() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertThrows(NullPointerException.class, () -> store.put(conn, "k", null, Instant.now()));
        }
    }
}
