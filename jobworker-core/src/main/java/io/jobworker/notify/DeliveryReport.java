package io.jobworker.notify;

import java.util.List;

/**
 * Outcome of {@link LiveNotificationDeduplicator#replace}.
 *
 * @param retracted     previous messages deleted on the remote side
 * @param sent          targets that received the new message
 * @param failedTargets targets whose send failed
 */
public record DeliveryReport(int retracted, int sent, List<String> failedTargets) {
  public DeliveryReport {
    failedTargets = List.copyOf(failedTargets);
  }

  public int failed() {
    return failedTargets.size();
  }

  /**
   * True when there was at least one target and every send failed.
   */
  public boolean allFailed() {
    return sent == 0 && !failedTargets.isEmpty();
  }
}
