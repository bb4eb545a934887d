package com.ryuqq.timeguard.adapter.runner;

/**
 * Outcome 결정을 두고 경쟁하는 신호 종류.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public enum Signal {

    /**
     * 인라인 작업 정상 완료.
     */
    WORK_COMPLETED,

    /**
     * 인라인 작업 예외.
     */
    WORK_FAILED,

    /**
     * 실행 단위의 Result 메시지.
     */
    UNIT_RESULT,

    /**
     * 실행 단위의 Error 메시지.
     */
    UNIT_ERROR,

    /**
     * 실행 단위 프로세스 종료 이벤트.
     */
    UNIT_EXIT,

    /**
     * 데드라인 타이머 만료.
     */
    DEADLINE,

    /**
     * 코디네이터 자체 오류 (실행기 거부, 프로세스 시작 실패 등).
     */
    INTERNAL_ERROR
}
