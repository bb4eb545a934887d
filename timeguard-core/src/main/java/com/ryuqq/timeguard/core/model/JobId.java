package com.ryuqq.timeguard.core.model;

import java.util.UUID;

/**
 * 스캔 Job의 식별자.
 *
 * <p>JobId는 로그와 Outcome을 상호 연결(correlation)하는 용도로만 사용되며,
 * 재시도나 중복 제거 키로 쓰이지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>문자 제한 없음 (호출자가 준 값을 그대로 보존)</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class JobId {

    private static final String GENERATED_PREFIX = "scan-";

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("JobId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * 새 JobId 발급 (scan-{UUID}).
     *
     * @return 발급된 JobId
     */
    public static JobId generate() {
        return new JobId(GENERATED_PREFIX + UUID.randomUUID());
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
