package io.jobworker.jdbc;

import java.util.Objects;

/**
 * Default table names and validation for table names spliced into SQL.
 */
public final class TableNames {
  public static final String JOBS = "jobs";
  public static final String LIVE_NOTIFICATIONS = "live_notification_messages";
  public static final String SETTINGS = "worker_settings";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
