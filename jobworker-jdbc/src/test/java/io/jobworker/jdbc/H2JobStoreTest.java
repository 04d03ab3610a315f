package io.jobworker.jdbc;

import io.jobworker.jdbc.store.AbstractJdbcJobStore;
import io.jobworker.jdbc.store.H2JobStore;
import io.jobworker.model.JobStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class H2JobStoreTest extends AbstractJobStoreIntegrationTest {

    private JdbcDataSource dataSource;
    private final H2JobStore store = new H2JobStore();

    @BeforeEach
    void setUp() throws Exception {
        dataSource = SchemaLoader.newH2DataSource();
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcJobStore store() {
        return store;
    }

    @Test
    void customTableName() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            conn.createStatement().execute(
                    "CREATE TABLE bot_jobs (" +
                            "job_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
                            "job_type VARCHAR(64) NOT NULL," +
                            "payload CLOB NOT NULL," +
                            "status VARCHAR(16) NOT NULL," +
                            "retries INT NOT NULL," +
                            "created_at TIMESTAMP NOT NULL," +
                            "updated_at TIMESTAMP NOT NULL" +
                            ")"
            );
            AbstractJdbcJobStore custom = store.withTableName("bot_jobs");

            long id = custom.enqueue(conn, "notify_live", "{}", T0);

            assertEquals(id, custom.claimNext(conn, Set.of(), T0).orElseThrow().jobId());
            assertEquals(0, store.countByStatus(conn, JobStatus.PROCESSING));
        }
    }

    @Test
    void rejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class, () -> store.withTableName("jobs; DROP TABLE jobs"));
    }
}
