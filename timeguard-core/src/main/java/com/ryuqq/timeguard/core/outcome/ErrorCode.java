package com.ryuqq.timeguard.core.outcome;

/**
 * 실패 Outcome의 분류 코드.
 *
 * <p>호출자는 이 값으로 타임아웃과 실행 오류를 프로그램적으로 구분합니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 데드라인 초과.
     */
    SCAN_TIMEOUT,

    /**
     * Work Function 오류 또는 격리 실행 단위의 비정상 종료.
     */
    SCAN_ERROR
}
