package io.jobworker.jdbc;

import io.jobworker.jdbc.store.AbstractJdbcJobStore;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Job store contract shared by every database. Subclasses provide the DataSource and
 * store, and must hand each test an empty job table.
 */
abstract class AbstractJobStoreIntegrationTest {

    static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    abstract DataSource dataSource();

    abstract AbstractJdbcJobStore store();

    @Test
    void enqueueCreatesPendingJob() throws Exception {
        try (Connection conn = autoCommit()) {
            long id = store().enqueue(conn, "notify_live", "{\"entity\":\"alice\"}", T0);

            Job job = store().findById(conn, id).orElseThrow();
            assertEquals("notify_live", job.jobType());
            assertEquals(JobStatus.PENDING, job.status());
            assertEquals(0, job.retries());
            assertEquals(T0, job.createdAt());
            assertTrue(job.payloadJson().contains("alice"));
        }
    }

    @Test
    void claimsOldestPendingFirst() throws Exception {
        try (Connection conn = autoCommit()) {
            long second = store().enqueue(conn, "notify_live", "{}", T0.plusSeconds(2));
            long first = store().enqueue(conn, "notify_live", "{}", T0.plusSeconds(1));

            Job claimed = store().claimNext(conn, Set.of(), T0.plusSeconds(10)).orElseThrow();
            assertEquals(first, claimed.jobId());
            assertEquals(JobStatus.PROCESSING, claimed.status());
            assertEquals(T0.plusSeconds(10), claimed.updatedAt());

            assertEquals(second, store().claimNext(conn, Set.of(), T0.plusSeconds(10)).orElseThrow().jobId());
            assertTrue(store().claimNext(conn, Set.of(), T0.plusSeconds(10)).isEmpty());
        }
    }

    @Test
    void excludedTypesAreNeverClaimed() throws Exception {
        try (Connection conn = autoCommit()) {
            store().enqueue(conn, "send_to_groups", "{}", T0);
            long live = store().enqueue(conn, "notify_live", "{}", T0.plusSeconds(1));

            Set<String> excluded = Set.of("send_to_groups");
            assertEquals(live, store().claimNext(conn, excluded, T0).orElseThrow().jobId());
            assertTrue(store().claimNext(conn, excluded, T0).isEmpty());
            assertEquals(1, store().countByStatus(conn, JobStatus.PENDING));
        }
    }

    @Test
    void failuresRequeueUntilRetryCeiling() throws Exception {
        try (Connection conn = autoCommit()) {
            long id = store().enqueue(conn, "broadcast_message", "{}", T0);

            for (int attempt = 0; attempt < 3; attempt++) {
                Job job = store().claimNext(conn, Set.of(), T0).orElseThrow();
                assertEquals(attempt, job.retries());
                Optional<JobStatus> next = store().finish(conn, id, false, job.retries(), 3, T0);
                assertEquals(Optional.of(JobStatus.PENDING), next);
            }

            Job last = store().claimNext(conn, Set.of(), T0).orElseThrow();
            assertEquals(3, last.retries());
            assertEquals(Optional.of(JobStatus.FAILED), store().finish(conn, id, false, last.retries(), 3, T0));

            Job failed = store().findById(conn, id).orElseThrow();
            assertEquals(JobStatus.FAILED, failed.status());
            assertEquals(4, failed.retries());
            assertTrue(store().claimNext(conn, Set.of(), T0).isEmpty());
        }
    }

    @Test
    void finishOnlyAppliesToProcessingJobs() throws Exception {
        try (Connection conn = autoCommit()) {
            long id = store().enqueue(conn, "notify_live", "{}", T0);
            assertTrue(store().finish(conn, id, true, 0, 3, T0).isEmpty());

            store().claimNext(conn, Set.of(), T0);
            assertEquals(Optional.of(JobStatus.COMPLETED), store().finish(conn, id, true, 0, 3, T0.plusSeconds(1)));
            assertTrue(store().finish(conn, id, true, 0, 3, T0.plusSeconds(2)).isEmpty());
            assertTrue(store().finish(conn, id, false, 0, 3, T0.plusSeconds(2)).isEmpty());

            Job done = store().findById(conn, id).orElseThrow();
            assertEquals(JobStatus.COMPLETED, done.status());
            assertEquals(0, done.retries());
            assertEquals(T0.plusSeconds(1), done.updatedAt());
        }
    }

    @Test
    void requeueStaleOnlyTouchesOldProcessingRows() throws Exception {
        try (Connection conn = autoCommit()) {
            long stuck = store().enqueue(conn, "notify_live", "{}", T0);
            long fresh = store().enqueue(conn, "notify_live", "{}", T0.plusSeconds(1));
            long pending = store().enqueue(conn, "notify_live", "{}", T0.plusSeconds(2));
            store().claimNext(conn, Set.of(), T0);
            store().claimNext(conn, Set.of(), T0.plus(Duration.ofMinutes(20)));

            Instant now = T0.plus(Duration.ofMinutes(30));
            int requeued = store().requeueStale(conn, now.minus(Duration.ofMinutes(15)), now);

            assertEquals(1, requeued);
            Job job = store().findById(conn, stuck).orElseThrow();
            assertEquals(JobStatus.PENDING, job.status());
            assertEquals(1, job.retries());
            assertEquals(JobStatus.PROCESSING, store().findById(conn, fresh).orElseThrow().status());
            assertEquals(0, store().findById(conn, pending).orElseThrow().retries());
        }
    }

    @Test
    void countByStatus() throws Exception {
        try (Connection conn = autoCommit()) {
            store().enqueue(conn, "a", "{}", T0);
            store().enqueue(conn, "b", "{}", T0);
            store().enqueue(conn, "c", "{}", T0);
            store().claimNext(conn, Set.of(), T0);

            assertEquals(2, store().countByStatus(conn, JobStatus.PENDING));
            assertEquals(1, store().countByStatus(conn, JobStatus.PROCESSING));
            assertEquals(0, store().countByStatus(conn, JobStatus.FAILED));
        }
    }

    @Test
    void findByIdOnMissingRow() throws Exception {
        try (Connection conn = autoCommit()) {
            assertFalse(store().findById(conn, 12345L).isPresent());
        }
    }

    @Test
    void concurrentClaimersNeverShareAJob() throws Exception {
        int jobs = 40;
        try (Connection conn = autoCommit()) {
            for (int i = 0; i < jobs; i++) {
                store().enqueue(conn, "notify_live", "{\"n\":" + i + "}", T0.plusMillis(i));
            }
        }

        int threads = 4;
        List<Long> claimed = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < jobs; i++) {
                        claimInTransaction().ifPresent(job -> claimed.add(job.jobId()));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        Optional<Job> rest;
        while ((rest = claimInTransaction()).isPresent()) {
            claimed.add(rest.get().jobId());
        }

        Set<Long> distinct = new HashSet<>(claimed);
        assertEquals(claimed.size(), distinct.size(), "a job was claimed twice: " + claimed);
        assertEquals(jobs, distinct.size());
    }

    private Optional<Job> claimInTransaction() throws SQLException {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<Job> job = store().claimNext(conn, Set.of(), T0.plus(1, ChronoUnit.HOURS));
                conn.commit();
                return job;
            } catch (JobStoreException e) {
                conn.rollback();
                return Optional.empty();
            }
        }
    }

    private Connection autoCommit() throws SQLException {
        Connection conn = dataSource().getConnection();
        conn.setAutoCommit(true);
        return conn;
    }
}
