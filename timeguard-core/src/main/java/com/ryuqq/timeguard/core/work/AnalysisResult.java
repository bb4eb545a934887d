package com.ryuqq.timeguard.core.work;

import java.util.List;

/**
 * Work Function이 생성하는 분석 결과.
 *
 * <p>격리 모드에서는 자식 프로세스에서 JSON으로 직렬화되어 전달되므로
 * 모든 구성 요소가 단순 값 타입입니다. 어떤 Job의 결과인지는
 * {@link com.ryuqq.timeguard.core.outcome.Completed#jobId()}가 나타냅니다.</p>
 *
 * @param status 분석 상태
 * @param findings 발견 사항 목록 (null이면 빈 목록)
 * @param executionTime 결과 생성 시각 (epoch millis)
 * @param metadata 부가 정보 (선택, null 가능)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record AnalysisResult(
    ScanStatus status,
    List<Finding> findings,
    long executionTime,
    ScanMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 null인 경우
     */
    public AnalysisResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * 발견 사항이 있는 완료 결과 생성 (현재 시각).
     *
     * @param findings 발견 사항
     * @return AnalysisResult 인스턴스
     */
    public static AnalysisResult completed(List<Finding> findings) {
        return new AnalysisResult(ScanStatus.COMPLETED, findings, System.currentTimeMillis(), null);
    }

    /**
     * 발견 사항이 없는 완료 결과 생성 (현재 시각).
     *
     * @return AnalysisResult 인스턴스
     */
    public static AnalysisResult clean() {
        return completed(List.of());
    }

    /**
     * metadata만 변경한 새 인스턴스 생성.
     */
    public AnalysisResult withMetadata(ScanMetadata metadata) {
        return new AnalysisResult(status, findings, executionTime, metadata);
    }
}
