package com.ryuqq.timeguard.application.service;

import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.model.WorkInput;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.policy.DeadlineConfig;
import com.ryuqq.timeguard.core.policy.DeadlinePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 스캔 실행 진입점.
 *
 * <p>HTTP 계층 등 호출자가 사용하는 경계 API입니다. 유효 타임아웃을 결정하고 Job을 만든 뒤
 * 인라인 또는 격리 코디네이터에 위임합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>SubmitOptions.timeoutMs → DeadlinePolicy로 유효 타임아웃 결정</li>
 *   <li>SubmitOptions.jobId → 없거나 255자를 넘으면 새로 발급, 그 외에는 그대로 사용</li>
 *   <li>Job 생성 → Coordinator.execute(job)</li>
 *   <li>코디네이터 자체 오류 → Faulted("Internal coordinator error")</li>
 * </ol>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class ScanExecutionService {

    static final String INTERNAL_ERROR_MESSAGE = "Internal coordinator error";

    private static final Logger log = LoggerFactory.getLogger(ScanExecutionService.class);

    private final DeadlinePolicy deadlinePolicy;
    private final Coordinator inlineCoordinator;
    private final Coordinator isolatedCoordinator;

    /**
     * 생성자.
     *
     * @param config 프로세스 타임아웃 설정 (시작 시 한 번 로드된 값)
     * @param inlineCoordinator 인라인 코디네이터
     * @param isolatedCoordinator 격리 코디네이터
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScanExecutionService(DeadlineConfig config, Coordinator inlineCoordinator, Coordinator isolatedCoordinator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (inlineCoordinator == null) {
            throw new IllegalArgumentException("inlineCoordinator cannot be null");
        }
        if (isolatedCoordinator == null) {
            throw new IllegalArgumentException("isolatedCoordinator cannot be null");
        }
        this.deadlinePolicy = new DeadlinePolicy(config);
        this.inlineCoordinator = inlineCoordinator;
        this.isolatedCoordinator = isolatedCoordinator;
        log.info("Scan service initialized with max execution time: {}ms", config.defaultTimeoutMs());
    }

    /**
     * 인라인 모드로 스캔 제출.
     *
     * @param input 분석 입력
     * @param options 제출 옵션 (null이면 옵션 없음)
     * @return Outcome future (정확히 한 번 완료)
     * @throws IllegalArgumentException input이 null인 경우
     */
    public CompletableFuture<Outcome> submit(WorkInput input, SubmitOptions options) {
        return dispatch(inlineCoordinator, input, options);
    }

    /**
     * 격리 모드(자식 프로세스)로 스캔 제출.
     *
     * @param input 분석 입력
     * @param options 제출 옵션 (null이면 옵션 없음)
     * @return Outcome future (정확히 한 번 완료)
     * @throws IllegalArgumentException input이 null인 경우
     */
    public CompletableFuture<Outcome> submitIsolated(WorkInput input, SubmitOptions options) {
        return dispatch(isolatedCoordinator, input, options);
    }

    /**
     * 현재 프로세스 기본 타임아웃.
     *
     * @return 밀리초
     */
    public long getDefaultTimeoutMs() {
        return deadlinePolicy.getConfig().defaultTimeoutMs();
    }

    private CompletableFuture<Outcome> dispatch(Coordinator coordinator, WorkInput input, SubmitOptions options) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        SubmitOptions effective = options == null ? SubmitOptions.none() : options;
        Job job = Job.now(resolveJobId(effective.jobId()), input, deadlinePolicy.resolve(effective.timeoutMs()));

        try {
            CompletableFuture<Outcome> outcome = coordinator.execute(job);
            return outcome.exceptionally(e -> internalError(job, e));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(internalError(job, e));
        }
    }

    private Outcome internalError(Job job, Throwable e) {
        log.error("Scan {} failed inside coordinator", job.jobId(), e);
        return Faulted.of(job.jobId(), INTERNAL_ERROR_MESSAGE, e.getClass().getName());
    }

    private JobId resolveJobId(String requested) {
        if (requested == null || requested.isBlank()) {
            return JobId.generate();
        }
        try {
            return JobId.of(requested);
        } catch (IllegalArgumentException e) {
            JobId generated = JobId.generate();
            log.warn("Ignoring invalid jobId '{}', using {}", requested, generated);
            return generated;
        }
    }
}
