package com.ryuqq.timeguard.core.work;

import java.util.List;

/**
 * 분석 부가 정보.
 *
 * @param contractSize 분석 대상 크기 (문자 수, null 가능)
 * @param rulesApplied 적용된 규칙 ID 목록 (null이면 빈 목록)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record ScanMetadata(
    Integer contractSize,
    List<String> rulesApplied
) {

    public ScanMetadata {
        rulesApplied = rulesApplied == null ? List.of() : List.copyOf(rulesApplied);
    }
}
