/**
 * Database-backed job queue worker.
 *
 * <p>A {@link io.jobworker.worker.JobWorker} claims pending rows from the job table through
 * a {@link io.jobworker.spi.JobStore}, hands them to a
 * {@link io.jobworker.dispatch.JobDispatcher} and records each
 * {@link io.jobworker.DispatchResult} as the job's next status.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * DataSource dataSource = ...;
 * ConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
 * JobStore store = JdbcJobStores.detect(dataSource);
 *
 * JobDispatcher dispatcher = JobDispatcher.builder()
 *     .registry(new DefaultJobHandlerRegistry()
 *         .register(JobType.NOTIFY_LIVE, liveNotificationHandler))
 *     .build();
 *
 * JobWorker worker = JobWorker.builder()
 *     .connectionProvider(connections)
 *     .jobStore(store)
 *     .dispatcher(dispatcher)
 *     .build();
 * worker.start();
 * }</pre>
 */
package io.jobworker;
