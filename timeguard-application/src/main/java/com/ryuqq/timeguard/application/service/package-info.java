/**
 * Boundary API used by callers such as an HTTP layer.
 *
 * @since 1.0.0
 * @author Timeguard Team
 */
package com.ryuqq.timeguard.application.service;
