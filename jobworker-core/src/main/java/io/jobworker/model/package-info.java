/**
 * Persistent job model: the {@link io.jobworker.model.Job} row, its
 * {@link io.jobworker.model.JobStatus} lifecycle and the known
 * {@link io.jobworker.model.JobType} tags.
 */
package io.jobworker.model;
