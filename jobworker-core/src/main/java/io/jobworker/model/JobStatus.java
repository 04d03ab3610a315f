package io.jobworker.model;

import java.util.Locale;

/**
 * Job lifecycle status, persisted as the lowercase name.
 *
 * <pre>
 * pending --claim--> processing --ok--> completed
 *                              \--fail, retries left--> pending
 *                              \--fail, ceiling reached--> failed
 * </pre>
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static JobStatus fromDbValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("status must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
