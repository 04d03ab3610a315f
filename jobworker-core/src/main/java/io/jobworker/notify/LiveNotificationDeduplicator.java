package io.jobworker.notify;

import io.jobworker.spi.ConnectionProvider;
import io.jobworker.spi.LiveNotificationStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps at most one outstanding live alert per (entity, target).
 *
 * <p>{@link #replace} first retracts every alert previously recorded for the entity, then
 * sends the new one to each target and records it. Remote deletions are best effort and
 * are skipped for messages older than the retract window, which the chat API no longer
 * allows deleting; the local record is removed either way. Send failures are logged and
 * reported, never thrown.
 *
 * <p>Database access uses a short auto-commit connection per operation. A
 * {@link SQLException} (or a store's runtime exception) propagates to the caller.
 */
public final class LiveNotificationDeduplicator {
  private static final Logger logger = Logger.getLogger(LiveNotificationDeduplicator.class.getName());

  /** Messages older than this cannot be deleted remotely. */
  public static final Duration DEFAULT_RETRACT_WINDOW = Duration.ofHours(48);

  private final ConnectionProvider connectionProvider;
  private final LiveNotificationStore store;
  private final MessageGateway gateway;
  private final Clock clock;
  private final Duration retractWindow;

  private LiveNotificationDeduplicator(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.retractWindow = builder.retractWindow != null ? builder.retractWindow : DEFAULT_RETRACT_WINDOW;
    if (retractWindow.isNegative() || retractWindow.isZero()) {
      throw new IllegalArgumentException("retractWindow must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public DeliveryReport replace(String entityKey, List<String> targets, MessageComposer composer)
      throws SQLException {
    Objects.requireNonNull(entityKey, "entityKey");
    Objects.requireNonNull(targets, "targets");
    Objects.requireNonNull(composer, "composer");

    int retracted = retractPrevious(entityKey);

    int sent = 0;
    List<String> failed = new ArrayList<>();
    for (String target : targets) {
      String messageId;
      try {
        messageId = gateway.send(target, composer.compose(target));
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to send live alert for " + entityKey + " to " + target, e);
        failed.add(target);
        continue;
      }
      if (messageId == null) {
        logger.log(Level.WARNING, "Gateway returned no message id for {0} to {1}", new Object[]{entityKey, target});
        failed.add(target);
        continue;
      }
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        store.save(conn, new LiveNotificationRecord(entityKey, target, messageId, clock.instant()));
      }
      sent++;
    }
    if (!targets.isEmpty()) {
      logger.log(Level.INFO, "Live alert for {0}: sent={1} failed={2} retracted={3}",
          new Object[]{entityKey, sent, failed.size(), retracted});
    }
    return new DeliveryReport(retracted, sent, failed);
  }

  private int retractPrevious(String entityKey) throws SQLException {
    Instant retractCutoff = clock.instant().minus(retractWindow);
    int retracted = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<LiveNotificationRecord> previous = store.findByEntity(conn, entityKey);
      for (LiveNotificationRecord record : previous) {
        if (record.createdAt().isBefore(retractCutoff)) {
          logger.log(Level.FINE, "Skipping remote delete of expired message {0}", record.messageId());
        } else {
          try {
            gateway.delete(record.targetId(), record.messageId());
            retracted++;
          } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to delete message " + record.messageId()
                + " in " + record.targetId(), e);
          }
        }
        store.delete(conn, record.entityKey(), record.targetId());
      }
    }
    return retracted;
  }

  /**
   * Removes records that are past the retract window and can no longer be deleted remotely.
   *
   * @return number of records removed
   */
  public int purgeExpired() throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int removed = store.deleteOlderThan(conn, clock.instant().minus(retractWindow));
      if (removed > 0) {
        logger.log(Level.FINE, "Purged {0} expired live notification records", removed);
      }
      return removed;
    }
  }

  /** Builder for {@link LiveNotificationDeduplicator}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private LiveNotificationStore store;
    private MessageGateway gateway;
    private Clock clock;
    private Duration retractWindow;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder store(LiveNotificationStore store) {
      this.store = store;
      return this;
    }

    public Builder gateway(MessageGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Age after which sent messages are no longer deleted remotely.
     *
     * <p>Optional. Defaults to 48 hours.
     */
    public Builder retractWindow(Duration retractWindow) {
      this.retractWindow = retractWindow;
      return this;
    }

    public LiveNotificationDeduplicator build() {
      return new LiveNotificationDeduplicator(this);
    }
  }
}
