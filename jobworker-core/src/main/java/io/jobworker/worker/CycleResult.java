package io.jobworker.worker;

/**
 * What a single {@link JobWorker#runCycle()} did.
 */
public enum CycleResult {
  /** A job was claimed, dispatched and its status recorded. */
  PROCESSED,
  /** No eligible job was pending. */
  IDLE,
  /** The cycle failed; the worker backs off before the next one. */
  ERROR
}
