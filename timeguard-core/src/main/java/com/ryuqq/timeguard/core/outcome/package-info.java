/**
 * Job execution outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the terminal result of a job.
 * Exactly one outcome is produced per job.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.timeguard.core.outcome.Outcome} - Sealed interface (permits Completed, TimedOut, Faulted)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.timeguard.core.outcome.Completed} - Work finished before the deadline</li>
 *   <li>{@link com.ryuqq.timeguard.core.outcome.TimedOut} - Deadline elapsed first ({@code SCAN_TIMEOUT})</li>
 *   <li>{@link com.ryuqq.timeguard.core.outcome.Faulted} - Work failed or the execution unit crashed ({@code SCAN_ERROR})</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.core.outcome;
