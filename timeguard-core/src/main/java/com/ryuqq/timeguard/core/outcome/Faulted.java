package com.ryuqq.timeguard.core.outcome;

import com.ryuqq.timeguard.core.model.JobId;

/**
 * 실행 오류 결과.
 *
 * <p>Work Function이 예외를 던졌거나, 격리 실행 단위가 비정상 종료한 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>분석 엔진 예외 (파싱 실패 등)</li>
 *   <li>자식 프로세스가 결과 없이 0이 아닌 코드로 종료</li>
 *   <li>코디네이터 내부 오류 (실행기 거부, 프로세스 시작 실패)</li>
 * </ul>
 *
 * @param jobId Job ID
 * @param message 오류 메시지
 * @param cause 원인 상세 (선택, null 가능)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record Faulted(
    JobId jobId,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null이거나 message가 비어있는 경우
     */
    public Faulted {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Faulted of(JobId jobId, String message, String cause) {
        return new Faulted(jobId, message, cause);
    }

    /**
     * cause 없이 Faulted 생성.
     *
     * @param jobId Job ID
     * @param message 오류 메시지
     * @return Faulted 인스턴스
     */
    public static Faulted of(JobId jobId, String message) {
        return new Faulted(jobId, message, null);
    }

    /**
     * 분류 코드.
     *
     * @return 항상 {@link ErrorCode#SCAN_ERROR}
     */
    public ErrorCode code() {
        return ErrorCode.SCAN_ERROR;
    }
}
