package io.jobworker.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobworker.model.Job;
import io.jobworker.util.PayloadCodec;

import java.util.Objects;

/**
 * A claimed job together with its payload, decoded once by the dispatcher.
 */
public record JobContext(Job job, ObjectNode payload) {
  public JobContext {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Returns the non-blank text value of a top-level payload field, or {@code null}.
   */
  public String text(String field) {
    return PayloadCodec.text(payload, field);
  }
}
