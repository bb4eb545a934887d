package com.ryuqq.timeguard.core.outcome;

import com.ryuqq.timeguard.core.model.JobId;

/**
 * 데드라인이 작업 완료보다 먼저 도래한 결과.
 *
 * <p>메시지에는 항상 초과된 제한 시간(밀리초)이 포함되며,
 * jobId와 함께 로그 상호 연결에 사용됩니다.</p>
 *
 * @param jobId Job ID
 * @param timeoutMs 적용된 타임아웃 (밀리초, 양수)
 * @param message 사람이 읽을 수 있는 메시지
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record TimedOut(
    JobId jobId,
    long timeoutMs,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null이거나 timeoutMs가 양수가 아니거나 message가 비어있는 경우
     */
    public TimedOut {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 표준 메시지로 TimedOut 생성.
     *
     * @param jobId Job ID
     * @param timeoutMs 타임아웃 (밀리초)
     * @return TimedOut 인스턴스
     */
    public static TimedOut of(JobId jobId, long timeoutMs) {
        return new TimedOut(jobId, timeoutMs, "Scan exceeded maximum execution time of " + timeoutMs + "ms");
    }

    /**
     * 분류 코드.
     *
     * @return 항상 {@link ErrorCode#SCAN_TIMEOUT}
     */
    public ErrorCode code() {
        return ErrorCode.SCAN_TIMEOUT;
    }
}
