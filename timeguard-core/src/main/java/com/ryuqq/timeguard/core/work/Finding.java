package com.ryuqq.timeguard.core.work;

/**
 * 분석 규칙 하나가 보고한 개별 발견 사항.
 *
 * @param ruleId 규칙 ID
 * @param severity 심각도
 * @param message 설명
 * @param location 위치 (선택, null 가능)
 * @param suggestion 수정 제안 (선택, null 가능)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record Finding(
    String ruleId,
    Severity severity,
    String message,
    Location location,
    String suggestion
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ruleId, severity, message가 누락된 경우
     */
    public Finding {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Finding of(String ruleId, Severity severity, String message) {
        return new Finding(ruleId, severity, message, null, null);
    }
}
