package io.jobworker.model;

import java.util.Optional;

/**
 * Known job type tags. The {@code job_type} column may also contain tags written by
 * other producers; those are carried as plain strings on {@link Job}.
 */
public enum JobType {
  /** An inbound chat update (message, button press, pre-checkout, join request). */
  PROCESS_UPDATE("process_update"),
  /** A message broadcast to every registered user. */
  BROADCAST_MESSAGE("broadcast_message"),
  /** A live-stream alert for a tracked account. */
  NOTIFY_LIVE("notify_live"),
  /** Produced for an external group sender; never processed by this worker. */
  SEND_TO_GROUPS("send_to_groups");

  private final String value;

  JobType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<JobType> fromValue(String value) {
    for (JobType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
