/**
 * The worker loop and its periodic background tasks.
 */
package io.jobworker.worker;
