package io.jobworker.broadcast;

/**
 * Current value of the metric that drives the auto-broadcast, e.g. the number of tracked
 * entities live right now.
 */
@FunctionalInterface
public interface LiveMetric {

  long currentValue() throws Exception;
}
