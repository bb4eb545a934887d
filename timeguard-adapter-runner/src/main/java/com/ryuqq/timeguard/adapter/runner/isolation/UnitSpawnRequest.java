package com.ryuqq.timeguard.adapter.runner.isolation;

/**
 * 실행 단위 시작 시 stdin으로 전달되는 요청.
 *
 * @param jobId Job ID 값
 * @param workInput 입력 사본 (null 허용)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record UnitSpawnRequest(
    String jobId,
    String workInput
) {

    public UnitSpawnRequest {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
    }
}
