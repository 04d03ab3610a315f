package io.jobworker.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for worker operations (claims, status updates,
 * settings and notification bookkeeping).
 *
 * <p>Callers are responsible for closing the returned connection and for its
 * auto-commit mode.
 *
 * @see io.jobworker.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
