package com.ryuqq.timeguard.application.service;

/**
 * 제출 옵션 (불변 record).
 *
 * <p>두 값 모두 선택이며, 잘못된 timeoutMs는 오류가 아니라 다음 우선순위로 넘어갑니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 * @param timeoutMs Job별 타임아웃 오버라이드 (밀리초, null 허용)
 * @param jobId 호출자가 지정한 Job ID (null이면 자동 발급)
 */
public record SubmitOptions(
    Long timeoutMs,
    String jobId
) {

    private static final SubmitOptions NONE = new SubmitOptions(null, null);

    /**
     * 옵션 없음.
     *
     * @return 빈 옵션
     */
    public static SubmitOptions none() {
        return NONE;
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public SubmitOptions withTimeoutMs(Long timeoutMs) {
        return new SubmitOptions(timeoutMs, jobId);
    }

    /**
     * jobId만 변경한 새 인스턴스 생성.
     */
    public SubmitOptions withJobId(String jobId) {
        return new SubmitOptions(timeoutMs, jobId);
    }
}
