package com.ryuqq.timeguard.core.model;

/**
 * 하나의 시간 제한 실행 요청.
 *
 * <p>Job은 코디네이터 호출 시점에 생성되고, 정확히 하나의 Outcome이 기록된 뒤 버려집니다.
 * 코디네이터는 Job 간에 어떤 상태도 보관하지 않습니다.</p>
 *
 * <pre>
 * Job job = Job.now(JobId.generate(), WorkInput.of(source), 30_000);
 * </pre>
 *
 * @param jobId 로그/결과 상호 연결용 식별자
 * @param workInput Work Function 입력
 * @param effectiveTimeoutMs 확정된 타임아웃 (밀리초, 양수)
 * @param acceptedAt 요청 수락 시각 (epoch millis)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record Job(
    JobId jobId,
    WorkInput workInput,
    long effectiveTimeoutMs,
    long acceptedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 시간 값이 유효하지 않은 경우
     */
    public Job {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (workInput == null) {
            throw new IllegalArgumentException("workInput cannot be null");
        }
        if (effectiveTimeoutMs <= 0) {
            throw new IllegalArgumentException("effectiveTimeoutMs must be positive (current: " + effectiveTimeoutMs + ")");
        }
        if (acceptedAt < 0) {
            throw new IllegalArgumentException("acceptedAt must be non-negative (current: " + acceptedAt + ")");
        }
    }

    /**
     * 현재 시각으로 Job 생성.
     *
     * @param jobId Job ID
     * @param workInput 입력
     * @param effectiveTimeoutMs 타임아웃 (밀리초)
     * @return 생성된 Job
     */
    public static Job now(JobId jobId, WorkInput workInput, long effectiveTimeoutMs) {
        return new Job(jobId, workInput, effectiveTimeoutMs, System.currentTimeMillis());
    }
}
