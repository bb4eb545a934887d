package com.ryuqq.timeguard.core.outcome;

import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.work.AnalysisResult;

/**
 * 데드라인 전에 작업이 완료된 결과.
 *
 * @param jobId Job ID
 * @param result Work Function이 생성한 분석 결과
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record Completed(
    JobId jobId,
    AnalysisResult result
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId 또는 result가 null인 경우
     */
    public Completed {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public static Completed of(JobId jobId, AnalysisResult result) {
        return new Completed(jobId, result);
    }
}
