/**
 * Job value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.timeguard.core.model.JobId} - correlation identifier</li>
 *   <li>{@link com.ryuqq.timeguard.core.model.WorkInput} - opaque payload handed to the work function</li>
 *   <li>{@link com.ryuqq.timeguard.core.model.Job} - one bounded-time execution request</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.core.model;
