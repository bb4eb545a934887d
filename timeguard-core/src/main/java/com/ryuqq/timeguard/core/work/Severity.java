package com.ryuqq.timeguard.core.work;

/**
 * Finding 심각도.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
