/**
 * Deadline resolution.
 *
 * <p>{@link com.ryuqq.timeguard.core.policy.DeadlinePolicy} picks the effective timeout of a job
 * from the per-job override, the process-wide {@link com.ryuqq.timeguard.core.policy.DeadlineConfig}
 * and the 30000ms fallback, in that order.</p>
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.core.policy;
