package io.jobworker.notify;

/**
 * Formats a live alert.
 */
@FunctionalInterface
public interface LiveAlertTemplate {

  LiveAlertTemplate DEFAULT = (entityKey, link, targetId) -> entityKey + " is live now: " + link;

  String render(String entityKey, String link, String targetId);
}
