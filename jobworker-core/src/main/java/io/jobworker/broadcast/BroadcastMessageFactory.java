package io.jobworker.broadcast;

import java.time.Instant;
import java.util.Map;

/**
 * Builds the payload of an automatically enqueued {@code broadcast_message} job.
 */
@FunctionalInterface
public interface BroadcastMessageFactory {

  Map<String, Object> payload(long metricValue, Instant now);
}
