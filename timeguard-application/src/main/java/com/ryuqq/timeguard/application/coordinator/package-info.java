/**
 * Coordinator port.
 *
 * <p>{@link com.ryuqq.timeguard.application.coordinator.Coordinator} is implemented by the
 * runner adapter at two isolation levels (inline and child-process).</p>
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.application.coordinator;
