package io.jobworker.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores in this module.
 */
public final class JobStoreException extends RuntimeException {
  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
