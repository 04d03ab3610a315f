/**
 * Micrometer bridge for worker metrics.
 */
package io.jobworker.micrometer;
