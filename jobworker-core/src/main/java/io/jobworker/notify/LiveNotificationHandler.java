package io.jobworker.notify;

import io.jobworker.DispatchResult;
import io.jobworker.dispatch.JobContext;
import io.jobworker.dispatch.JobHandler;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles {@code notify_live} jobs with payload {@code {"entity"|"username": ..., "link": ...}}.
 *
 * <p>Missing fields drop the job. When every target fails the job is retried; partial
 * delivery counts as success.
 */
public final class LiveNotificationHandler implements JobHandler {
  private static final Logger logger = Logger.getLogger(LiveNotificationHandler.class.getName());

  private final LiveNotificationDeduplicator deduplicator;
  private final NotificationTargets targets;
  private final LiveAlertTemplate template;

  public LiveNotificationHandler(LiveNotificationDeduplicator deduplicator, NotificationTargets targets) {
    this(deduplicator, targets, LiveAlertTemplate.DEFAULT);
  }

  public LiveNotificationHandler(LiveNotificationDeduplicator deduplicator, NotificationTargets targets,
      LiveAlertTemplate template) {
    this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    this.targets = Objects.requireNonNull(targets, "targets");
    this.template = Objects.requireNonNull(template, "template");
  }

  @Override
  public DispatchResult handle(JobContext context) throws Exception {
    String entity = context.text("entity");
    if (entity == null) {
      entity = context.text("username");
    }
    String link = context.text("link");
    if (entity == null || link == null) {
      logger.log(Level.WARNING, "notify_live jobId={0} is missing entity or link", context.job().jobId());
      return DispatchResult.dropped("Missing entity or link");
    }

    List<String> recipients = targets.targetsFor(entity);
    if (recipients == null || recipients.isEmpty()) {
      logger.log(Level.FINE, "No targets subscribed to {0}", entity);
      return DispatchResult.ok();
    }
    String entityKey = entity;
    DeliveryReport report = deduplicator.replace(entity, recipients,
        target -> template.render(entityKey, link, target));
    if (report.allFailed()) {
      return DispatchResult.retryable("All " + report.failed() + " live alert sends failed for " + entity);
    }
    return DispatchResult.ok();
  }
}
