package io.jobworker.jdbc;

import io.jobworker.jdbc.store.AbstractJdbcJobStore;
import io.jobworker.jdbc.store.H2JobStore;
import io.jobworker.jdbc.store.JdbcJobStores;
import io.jobworker.jdbc.store.MySqlJobStore;
import io.jobworker.jdbc.store.PostgresJobStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcJobStoresTest {

    @Test
    void everyShippedDialectIsRegistered() {
        for (String dialect : List.of("h2", "mysql", "postgresql")) {
            assertEquals(dialect, JdbcJobStores.get(dialect).name());
        }
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertInstanceOf(H2JobStore.class, JdbcJobStores.get("H2"));
        assertInstanceOf(PostgresJobStore.class, JdbcJobStores.get("postgresql"));
    }

    @Test
    void getUnknownName() {
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.get("oracle"));
    }

    @Test
    void detectFromUrl() {
        assertInstanceOf(H2JobStore.class, JdbcJobStores.detect("jdbc:h2:mem:test"));
        assertInstanceOf(PostgresJobStore.class, JdbcJobStores.detect("jdbc:postgresql://localhost/bot"));
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:mysql://localhost/bot"));
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:mariadb://localhost/bot"));
    }

    @Test
    void detectFromDataSource() throws Exception {
        assertInstanceOf(H2JobStore.class, JdbcJobStores.detect(SchemaLoader.newH2DataSource()));
    }

    @Test
    void detectUnsupportedUrl() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JdbcJobStores.detect("jdbc:sqlserver://localhost"));
        assertTrue(e.getMessage().contains("jdbc:sqlserver://localhost"), e.getMessage());
        assertTrue(e.getMessage().contains("[h2, mysql, postgresql]"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect("   "));
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect(""));
    }

    @Test
    void withTableNameKeepsKind() {
        AbstractJdbcJobStore renamed = JdbcJobStores.get("postgresql").withTableName("bot_jobs");
        assertInstanceOf(PostgresJobStore.class, renamed);
        assertEquals("postgresql", renamed.name());
    }
}
