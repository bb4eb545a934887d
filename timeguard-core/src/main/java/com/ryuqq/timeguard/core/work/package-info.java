/**
 * Work function SPI and the analysis result model it produces.
 *
 * <p>The coordinators never look inside a {@link com.ryuqq.timeguard.core.work.WorkFunction};
 * they only manage its lifetime against a deadline.</p>
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.core.work;
