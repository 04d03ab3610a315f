/**
 * Job routing: {@link io.jobworker.dispatch.JobDispatcher} selects a
 * {@link io.jobworker.dispatch.JobHandler} by job type, and
 * {@link io.jobworker.dispatch.UpdateRouter} routes chat updates by payload shape,
 * command prefix and {@link io.jobworker.dispatch.CallbackAction}.
 */
package io.jobworker.dispatch;
