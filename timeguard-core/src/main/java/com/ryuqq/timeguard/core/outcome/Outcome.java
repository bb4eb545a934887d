package com.ryuqq.timeguard.core.outcome;

import com.ryuqq.timeguard.core.model.JobId;

/**
 * Job 실행의 최종 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Completed}: 데드라인 전에 작업 완료</li>
 *   <li>{@link TimedOut}: 데드라인이 먼저 도래</li>
 *   <li>{@link Faulted}: 작업 실패 또는 격리 실행 단위의 비정상 종료</li>
 * </ul>
 *
 * <p>하나의 Job에 대해 Outcome은 정확히 한 번만 생성되고 관찰됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Completed completed) {
 *     render(completed.result());
 * } else if (outcome instanceof TimedOut timedOut) {
 *     reply(408, timedOut.message());
 * } else if (outcome instanceof Faulted faulted) {
 *     reply(500, faulted.message());
 * }
 * </pre>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Completed, TimedOut, Faulted {

    /**
     * 결과가 속한 Job ID.
     *
     * @return Job ID
     */
    JobId jobId();

    /**
     * 결과가 완료인지 확인.
     *
     * @return 완료 여부
     */
    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * 결과가 타임아웃인지 확인.
     *
     * @return 타임아웃 여부
     */
    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 결과가 실행 오류인지 확인.
     *
     * @return 실행 오류 여부
     */
    default boolean isFaulted() {
        return this instanceof Faulted;
    }

    /**
     * 실패 분류 코드.
     *
     * @return SCAN_TIMEOUT / SCAN_ERROR, 완료인 경우 null
     */
    default ErrorCode codeOrNull() {
        if (this instanceof TimedOut) {
            return ErrorCode.SCAN_TIMEOUT;
        }
        if (this instanceof Faulted) {
            return ErrorCode.SCAN_ERROR;
        }
        return null;
    }
}
