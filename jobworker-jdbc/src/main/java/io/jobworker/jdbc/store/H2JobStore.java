package io.jobworker.jdbc.store;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>Uses the default compare-and-set claim from {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new H2JobStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
