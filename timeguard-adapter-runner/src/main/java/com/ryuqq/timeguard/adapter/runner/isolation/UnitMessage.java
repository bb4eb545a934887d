package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.core.work.AnalysisResult;

/**
 * 실행 단위가 코디네이터에게 보내는 종료 메시지.
 *
 * <p>두 종류 모두 종료 메시지이며 단위당 최대 한 번 전송됩니다.</p>
 * <ul>
 *   <li>RESULT: result 필수</li>
 *   <li>ERROR: errorCode, message 필수. SCAN_TIMEOUT이면 timeoutMs 양수</li>
 * </ul>
 *
 * @param type 메시지 종류
 * @param result 분석 결과 (RESULT일 때)
 * @param errorCode 분류 코드 (ERROR일 때)
 * @param message 오류 메시지 (ERROR일 때)
 * @param timeoutMs 분류된 타임아웃 값 (SCAN_TIMEOUT일 때)
 * @param cause 원인 예외 타입 (ERROR일 때, 선택)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record UnitMessage(
    Type type,
    AnalysisResult result,
    ErrorCode errorCode,
    String message,
    long timeoutMs,
    String cause
) {

    /**
     * 메시지 종류.
     */
    public enum Type {
        RESULT,
        ERROR
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 종류별 필수 값이 누락된 경우
     */
    public UnitMessage {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == Type.RESULT && result == null) {
            throw new IllegalArgumentException("result cannot be null for RESULT message");
        }
        if (type == Type.ERROR) {
            if (errorCode == null) {
                throw new IllegalArgumentException("errorCode cannot be null for ERROR message");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank for ERROR message");
            }
            if (errorCode == ErrorCode.SCAN_TIMEOUT && timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive for SCAN_TIMEOUT (current: " + timeoutMs + ")");
            }
        }
    }

    public static UnitMessage ofResult(AnalysisResult result) {
        return new UnitMessage(Type.RESULT, result, null, null, 0, null);
    }

    public static UnitMessage ofError(ErrorCode errorCode, String message, long timeoutMs, String cause) {
        return new UnitMessage(Type.ERROR, null, errorCode, message, timeoutMs, cause);
    }
}
