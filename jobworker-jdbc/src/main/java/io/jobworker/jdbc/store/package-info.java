/**
 * Database-specific {@link io.jobworker.spi.JobStore} implementations and their
 * ServiceLoader-based registry, {@link io.jobworker.jdbc.store.JdbcJobStores}.
 */
package io.jobworker.jdbc.store;
