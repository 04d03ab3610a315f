/**
 * JDBC persistence for the job worker: connection provider, settings and live-notification
 * stores, and the {@link io.jobworker.jdbc.JdbcTemplate} helper they share.
 *
 * <p>Schema scripts for H2, PostgreSQL and MySQL ship under {@code /schema/} on the
 * classpath.
 */
package io.jobworker.jdbc;
