package io.jobworker.notify;

import java.util.List;

/**
 * Resolves who subscribes to live alerts for an entity.
 */
@FunctionalInterface
public interface NotificationTargets {

  List<String> targetsFor(String entityKey) throws Exception;
}
