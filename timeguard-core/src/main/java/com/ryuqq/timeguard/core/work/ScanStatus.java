package com.ryuqq.timeguard.core.work;

/**
 * 분석 결과 상태.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public enum ScanStatus {
    COMPLETED,
    FAILED,
    TIMEOUT
}
