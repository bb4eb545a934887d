package com.ryuqq.timeguard.adapter.runner;

/**
 * IsolatedCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>terminationGraceMs: 타임아웃이 아닌 Outcome 이후 실행 단위가 스스로 종료하기를 기다리는 시간
 *       (기본 1000ms). 이 시간이 지나도 살아있으면 강제 종료합니다.</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 * @param terminationGraceMs 종료 유예 시간 (밀리초, 양수여야 함)
 */
public record IsolatedCoordinatorConfig(long terminationGraceMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: terminationGraceMs=1000ms</p>
     */
    public IsolatedCoordinatorConfig() {
        this(1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException terminationGraceMs가 양수가 아닌 경우
     */
    public IsolatedCoordinatorConfig {
        if (terminationGraceMs <= 0) {
            throw new IllegalArgumentException(
                "terminationGraceMs must be positive (current: " + terminationGraceMs + ")"
            );
        }
    }

    /**
     * terminationGraceMs만 변경한 새 인스턴스 생성.
     *
     * @param terminationGraceMs 새로운 종료 유예 시간 (밀리초)
     * @return 새 IsolatedCoordinatorConfig 인스턴스
     */
    public IsolatedCoordinatorConfig withTerminationGraceMs(long terminationGraceMs) {
        return new IsolatedCoordinatorConfig(terminationGraceMs);
    }
}
