/**
 * Threshold-driven broadcast with a persistent cooldown.
 */
package io.jobworker.broadcast;
