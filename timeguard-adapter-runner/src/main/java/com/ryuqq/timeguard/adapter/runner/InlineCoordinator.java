package com.ryuqq.timeguard.adapter.runner;

import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.outcome.Completed;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.outcome.TimedOut;
import com.ryuqq.timeguard.core.work.AnalysisResult;
import com.ryuqq.timeguard.core.work.WorkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Inline Coordinator 구현체.
 *
 * <p>Work Function과 데드라인 타이머를 같은 프로세스 안에서 경쟁시킵니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Job별 {@link FirstSignalArbiter} 생성</li>
 *   <li>데드라인 타이머 예약 (scheduler)</li>
 *   <li>Work Function 비동기 시작 (workExecutor)</li>
 *   <li>완료 → Completed, 예외 → Faulted (분류된 타임아웃은 TimedOut), 타이머 → TimedOut</li>
 *   <li>먼저 도착한 신호만 반영, 결정 후 타이머 취소</li>
 * </ol>
 *
 * <p><strong>제약:</strong> 타임아웃이 보고된 뒤에도 Work Function은 중단되지 않고 끝까지 실행되며,
 * 늦게 도착한 결과는 버려집니다. 실행 자체를 멈춰야 한다면 {@link IsolatedCoordinator}를 사용합니다.</p>
 *
 * <p><strong>동시성:</strong> Job 간 공유 상태 없음 (thread-safe). 실행기와 스케줄러는 Job 상태를 갖지 않습니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class InlineCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(InlineCoordinator.class);

    private final WorkFunction workFunction;
    private final ExecutorService workExecutor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsExecutors;

    /**
     * 생성자 (전용 실행기 생성).
     *
     * @param workFunction 분석 작업
     * @throws IllegalArgumentException workFunction이 null인 경우
     */
    public InlineCoordinator(WorkFunction workFunction) {
        this(workFunction,
            Executors.newCachedThreadPool(new DaemonThreadFactory("timeguard-inline-work")),
            Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("timeguard-inline-deadline")),
            true);
    }

    /**
     * 생성자 (외부 실행기 주입, close() 시 종료하지 않음).
     *
     * @param workFunction 분석 작업
     * @param workExecutor Work Function 실행기
     * @param scheduler 데드라인 타이머 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InlineCoordinator(WorkFunction workFunction, ExecutorService workExecutor, ScheduledExecutorService scheduler) {
        this(workFunction, workExecutor, scheduler, false);
    }

    private InlineCoordinator(WorkFunction workFunction, ExecutorService workExecutor,
                              ScheduledExecutorService scheduler, boolean ownsExecutors) {
        if (workFunction == null) {
            throw new IllegalArgumentException("workFunction cannot be null");
        }
        if (workExecutor == null) {
            throw new IllegalArgumentException("workExecutor cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.workFunction = workFunction;
        this.workExecutor = workExecutor;
        this.scheduler = scheduler;
        this.ownsExecutors = ownsExecutors;
    }

    @Override
    public CompletableFuture<Outcome> execute(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        JobId jobId = job.jobId();
        long timeoutMs = job.effectiveTimeoutMs();
        FirstSignalArbiter arbiter = new FirstSignalArbiter(jobId);

        log.info("Starting scan {} with timeout: {}ms", jobId, timeoutMs);

        try {
            // 1. 데드라인 타이머 예약
            ScheduledFuture<?> timer = scheduler.schedule(
                () -> arbiter.resolve(Signal.DEADLINE, () -> onDeadline(jobId, timeoutMs)),
                timeoutMs, TimeUnit.MILLISECONDS);
            arbiter.whenResolved(() -> timer.cancel(false));

            // 2. 작업 시작 (비블로킹)
            startWork(job, arbiter);
        } catch (RuntimeException e) {
            log.error("Scan {} could not be started", jobId, e);
            arbiter.resolve(Signal.INTERNAL_ERROR,
                () -> Faulted.of(jobId, FirstSignalArbiter.INTERNAL_ERROR_MESSAGE, e.getClass().getName()));
        }

        return arbiter.outcome();
    }

    /**
     * Work Function 시작 및 완료/실패 신호 연결.
     *
     * <p>analyzeAsync 호출 자체가 던지는 예외도 작업 실패로 취급합니다.
     * 단, 실행기 거부는 코디네이터 내부 오류이므로 호출자에게 전파합니다.</p>
     *
     * @param job Job
     * @param arbiter 중재자
     */
    private void startWork(Job job, FirstSignalArbiter arbiter) {
        JobId jobId = job.jobId();
        CompletionStage<AnalysisResult> work;
        try {
            work = workFunction.analyzeAsync(job.workInput(), workExecutor);
        } catch (RejectedExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            arbiter.resolve(Signal.WORK_FAILED, () -> onFailure(jobId, e));
            return;
        }

        work.whenComplete((result, error) -> {
            if (error != null) {
                arbiter.resolve(Signal.WORK_FAILED, () -> onFailure(jobId, error));
            } else {
                arbiter.resolve(Signal.WORK_COMPLETED, () -> onCompleted(jobId, result));
            }
        });
    }

    private Outcome onCompleted(JobId jobId, AnalysisResult result) {
        if (result == null) {
            log.error("Scan {} work function returned no result", jobId);
            return Faulted.of(jobId, "Work function returned no result");
        }
        log.info("Scan {} completed successfully", jobId);
        return Completed.of(jobId, result);
    }

    private Outcome onFailure(JobId jobId, Throwable error) {
        Outcome outcome = FailureClassifier.classify(jobId, error);
        if (outcome instanceof TimedOut timedOut) {
            log.warn("Scan {} reported its own timeout after {}ms", jobId, timedOut.timeoutMs());
        } else {
            log.error("Scan {} failed with error", jobId, FailureClassifier.unwrap(error));
        }
        return outcome;
    }

    private Outcome onDeadline(JobId jobId, long timeoutMs) {
        log.warn("Scan {} timed out after {}ms", jobId, timeoutMs);
        return TimedOut.of(jobId, timeoutMs);
    }

    /**
     * 소유한 실행기 종료.
     *
     * <p>외부에서 주입한 실행기는 종료하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (ownsExecutors) {
            scheduler.shutdownNow();
            workExecutor.shutdownNow();
        }
    }
}
