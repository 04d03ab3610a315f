package io.jobworker.notify;

/**
 * Renders the alert text for one target, e.g. in the target's language.
 */
@FunctionalInterface
public interface MessageComposer {

  String compose(String targetId);
}
