/**
 * Live alerts with a single outstanding message per (entity, target).
 */
package io.jobworker.notify;
