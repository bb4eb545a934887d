package com.ryuqq.timeguard.core.exception;

import com.ryuqq.timeguard.core.outcome.ErrorCode;

/**
 * 이미 분류 코드를 가진 스캔 실패.
 *
 * <p>Work Function이 스스로 타임아웃을 감지한 경우 등, 실패를 미리 분류해 던질 때 사용합니다.
 * 코디네이터는 이 분류를 다시 감싸지 않고 그대로 Outcome으로 전파합니다.</p>
 *
 * <ul>
 *   <li>{@link ErrorCode#SCAN_TIMEOUT}: TimedOut으로 전파 (timeoutMs 필수)</li>
 *   <li>{@link ErrorCode#SCAN_ERROR}: 메시지 그대로 Faulted로 전파</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public class ClassifiedScanException extends RuntimeException {

    private final ErrorCode errorCode;
    private final long timeoutMs;

    /**
     * 생성자.
     *
     * @param errorCode 분류 코드
     * @param message 메시지
     * @param timeoutMs 타임아웃 값 (SCAN_TIMEOUT일 때 양수, 그 외 0)
     * @throws IllegalArgumentException errorCode가 null이거나 SCAN_TIMEOUT인데 timeoutMs가 양수가 아닌 경우
     */
    public ClassifiedScanException(ErrorCode errorCode, String message, long timeoutMs) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (errorCode == ErrorCode.SCAN_TIMEOUT && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive for SCAN_TIMEOUT (current: " + timeoutMs + ")");
        }
        this.errorCode = errorCode;
        this.timeoutMs = timeoutMs;
    }

    /**
     * 타임아웃 분류 예외 생성.
     *
     * @param message 메시지
     * @param timeoutMs 초과된 타임아웃 (밀리초)
     * @return 예외 인스턴스
     */
    public static ClassifiedScanException timeout(String message, long timeoutMs) {
        return new ClassifiedScanException(ErrorCode.SCAN_TIMEOUT, message, timeoutMs);
    }

    /**
     * 실행 오류 분류 예외 생성.
     *
     * @param message 메시지
     * @return 예외 인스턴스
     */
    public static ClassifiedScanException error(String message) {
        return new ClassifiedScanException(ErrorCode.SCAN_ERROR, message, 0);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
