/**
 * Job orchestration.
 *
 * <p>{@link io.seatwatch.runtime.JobRegistry} owns the set of running jobs. Each running job is a
 * {@link io.seatwatch.runtime.JobRuntime} on its own thread, driving
 * {@link io.seatwatch.runtime.SectionCycle} over its targets with
 * {@link io.seatwatch.runtime.RetryExecutor} around every collaborator call and
 * {@link io.seatwatch.runtime.NotificationThrottle} deciding which failures are reported.
 */
package io.seatwatch.runtime;
