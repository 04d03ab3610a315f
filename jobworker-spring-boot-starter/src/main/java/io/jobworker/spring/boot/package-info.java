/**
 * Spring Boot auto-configuration for the job worker.
 *
 * <p>Add the starter and a {@link javax.sql.DataSource}; the worker starts with the
 * context unless {@code jobworker.auto-start=false}.
 */
package io.jobworker.spring.boot;
