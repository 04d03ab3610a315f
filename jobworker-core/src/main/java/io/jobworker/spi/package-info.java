/**
 * Service Provider Interfaces (SPI) for plugging the worker into a database and a
 * metrics backend.
 *
 * @see io.jobworker.spi.ConnectionProvider
 * @see io.jobworker.spi.JobStore
 * @see io.jobworker.spi.SettingsStore
 * @see io.jobworker.spi.LiveNotificationStore
 * @see io.jobworker.spi.MetricsExporter
 */
package io.jobworker.spi;
