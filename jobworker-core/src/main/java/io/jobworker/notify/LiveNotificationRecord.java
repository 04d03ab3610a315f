package io.jobworker.notify;

import java.time.Instant;
import java.util.Objects;

/**
 * The last live alert delivered for an entity to one target.
 */
public record LiveNotificationRecord(String entityKey, String targetId, String messageId, Instant createdAt) {
  public LiveNotificationRecord {
    Objects.requireNonNull(entityKey, "entityKey");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
