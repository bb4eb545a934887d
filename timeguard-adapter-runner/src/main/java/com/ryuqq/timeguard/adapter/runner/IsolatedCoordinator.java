package com.ryuqq.timeguard.adapter.runner;

import com.ryuqq.timeguard.adapter.runner.isolation.ExecutionUnit;
import com.ryuqq.timeguard.adapter.runner.isolation.ExecutionUnitLaunchException;
import com.ryuqq.timeguard.adapter.runner.isolation.ExecutionUnitLauncher;
import com.ryuqq.timeguard.adapter.runner.isolation.UnitMessage;
import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.outcome.Completed;
import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.outcome.TimedOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Isolated Coordinator 구현체.
 *
 * <p>Job마다 별도의 실행 단위(기본: 자식 JVM 프로세스)를 생성하고, 단위의 메시지/종료 이벤트와
 * 데드라인 타이머를 경쟁시킵니다. 타임아웃 시 실행 단위를 강제 종료하므로 폭주한 작업이
 * 코디네이터 자원을 잠식하지 못합니다.</p>
 *
 * <p><strong>신호와 Outcome:</strong></p>
 * <ul>
 *   <li>Result 메시지 → Completed</li>
 *   <li>Error 메시지 → Faulted (SCAN_TIMEOUT으로 분류된 경우 TimedOut)</li>
 *   <li>종료 코드 0, 메시지 없음 → Faulted("Worker exited without producing a result")</li>
 *   <li>종료 코드 N(≠0), 메시지 없음 → Faulted("Worker exited unexpectedly with code N")</li>
 *   <li>타이머 → 실행 단위 강제 종료 후 TimedOut</li>
 *   <li>실행 단위 시작 실패 → Faulted</li>
 * </ul>
 *
 * <p>종료 이벤트는 단위의 출력이 모두 소진된 뒤에만 평가되므로, 단위가 종료 직전에 보낸 메시지가
 * 항상 자신의 종료 이벤트보다 먼저 반영됩니다.</p>
 *
 * <p><strong>정리:</strong> 타임아웃이 아닌 Outcome 이후에도 terminationGraceMs 동안 살아있는 단위는
 * 강제 종료됩니다. close() 시 실행 중인 모든 단위를 강제 종료합니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class IsolatedCoordinator implements Coordinator {

    static final String EXIT_WITHOUT_RESULT_MESSAGE = "Worker exited without producing a result";

    private static final Logger log = LoggerFactory.getLogger(IsolatedCoordinator.class);

    private final ExecutionUnitLauncher launcher;
    private final IsolatedCoordinatorConfig config;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Set<ExecutionUnit> activeUnits = ConcurrentHashMap.newKeySet();

    public IsolatedCoordinator(ExecutionUnitLauncher launcher) {
        this(launcher, new IsolatedCoordinatorConfig());
    }

    /**
     * 생성자 (전용 스케줄러 생성).
     *
     * @param launcher 실행 단위 생성기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IsolatedCoordinator(ExecutionUnitLauncher launcher, IsolatedCoordinatorConfig config) {
        this(launcher, config,
            Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("timeguard-isolated-deadline")),
            true);
    }

    /**
     * 생성자 (외부 스케줄러 주입, close() 시 종료하지 않음).
     *
     * @param launcher 실행 단위 생성기
     * @param config 설정
     * @param scheduler 데드라인/정리 타이머 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IsolatedCoordinator(ExecutionUnitLauncher launcher, IsolatedCoordinatorConfig config,
                               ScheduledExecutorService scheduler) {
        this(launcher, config, scheduler, false);
    }

    private IsolatedCoordinator(ExecutionUnitLauncher launcher, IsolatedCoordinatorConfig config,
                                ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.launcher = launcher;
        this.config = config;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public CompletableFuture<Outcome> execute(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        JobId jobId = job.jobId();
        long timeoutMs = job.effectiveTimeoutMs();
        FirstSignalArbiter arbiter = new FirstSignalArbiter(jobId);

        log.info("Starting isolated scan {} with timeout: {}ms", jobId, timeoutMs);

        // 1. 실행 단위 생성
        ExecutionUnit unit;
        try {
            unit = launcher.launch(job);
        } catch (ExecutionUnitLaunchException e) {
            log.error("Scan {} could not start execution unit", jobId, e);
            arbiter.resolve(Signal.INTERNAL_ERROR,
                () -> Faulted.of(jobId, "Failed to start execution unit: " + e.getMessage(), e.getClass().getName()));
            return arbiter.outcome();
        } catch (RuntimeException e) {
            log.error("Scan {} could not start execution unit", jobId, e);
            arbiter.resolve(Signal.INTERNAL_ERROR,
                () -> Faulted.of(jobId, FirstSignalArbiter.INTERNAL_ERROR_MESSAGE, e.getClass().getName()));
            return arbiter.outcome();
        }
        activeUnits.add(unit);
        unit.exit().whenComplete((code, error) -> activeUnits.remove(unit));

        try {
            // 2. 데드라인 타이머 예약
            ScheduledFuture<?> timer = scheduler.schedule(
                () -> arbiter.resolve(Signal.DEADLINE, () -> onDeadline(unit, timeoutMs)),
                timeoutMs, TimeUnit.MILLISECONDS);
            arbiter.whenResolved(() -> timer.cancel(false));
        } catch (RuntimeException e) {
            log.error("Scan {} could not schedule its deadline", jobId, e);
            unit.terminate();
            arbiter.resolve(Signal.INTERNAL_ERROR,
                () -> Faulted.of(jobId, FirstSignalArbiter.INTERNAL_ERROR_MESSAGE, e.getClass().getName()));
            return arbiter.outcome();
        }

        // 3. 메시지 → 출력 소진 후 종료 이벤트 순서로 연결
        CompletableFuture<Void> drained = unit.message().handle((message, error) -> {
            if (error != null) {
                log.warn("Scan {} message channel failed: {}", jobId, error.getMessage());
            } else if (message.isPresent()) {
                onMessage(arbiter, message.get());
            }
            return null;
        });
        unit.exit().thenCombine(drained, (code, ignored) -> code).whenComplete((code, error) -> {
            if (error != null) {
                log.error("Scan {} lost track of its execution unit", jobId, error);
                arbiter.resolve(Signal.INTERNAL_ERROR,
                    () -> Faulted.of(jobId, FirstSignalArbiter.INTERNAL_ERROR_MESSAGE, error.getClass().getName()));
            } else {
                arbiter.resolve(Signal.UNIT_EXIT, () -> onExit(jobId, code));
            }
        });

        // 4. 타임아웃이 아닌 결정 이후 남은 단위 정리
        arbiter.whenResolved(() -> {
            if (arbiter.winnerOrNull() != Signal.DEADLINE) {
                scheduleCleanup(unit);
            }
        });

        return arbiter.outcome();
    }

    private void onMessage(FirstSignalArbiter arbiter, UnitMessage message) {
        JobId jobId = arbiter.getJobId();
        if (message.type() == UnitMessage.Type.RESULT) {
            arbiter.resolve(Signal.UNIT_RESULT, () -> {
                log.info("Scan {} completed successfully", jobId);
                return Completed.of(jobId, message.result());
            });
            return;
        }
        arbiter.resolve(Signal.UNIT_ERROR, () -> {
            if (message.errorCode() == ErrorCode.SCAN_TIMEOUT) {
                log.warn("Scan {} reported its own timeout after {}ms", jobId, message.timeoutMs());
                return new TimedOut(jobId, message.timeoutMs(), message.message());
            }
            log.error("Scan {} failed in worker: {}", jobId, message.message());
            return Faulted.of(jobId, message.message(), message.cause());
        });
    }

    private Outcome onExit(JobId jobId, int code) {
        if (code == 0) {
            log.error("Scan {} worker exited without a result", jobId);
            return Faulted.of(jobId, EXIT_WITHOUT_RESULT_MESSAGE, "exit code 0");
        }
        log.error("Scan {} worker exited unexpectedly with code {}", jobId, code);
        return Faulted.of(jobId, "Worker exited unexpectedly with code " + code, "exit code " + code);
    }

    private Outcome onDeadline(ExecutionUnit unit, long timeoutMs) {
        log.warn("Worker scan {} timed out after {}ms", unit.jobId(), timeoutMs);
        unit.terminate();
        return TimedOut.of(unit.jobId(), timeoutMs);
    }

    private void scheduleCleanup(ExecutionUnit unit) {
        if (unit.exit().isDone()) {
            return;
        }
        Runnable cleanup = () -> {
            if (unit.isAlive()) {
                log.warn("Scan {} worker still alive after {}ms, terminating", unit.jobId(), config.terminationGraceMs());
                unit.terminate();
            }
        };
        try {
            scheduler.schedule(cleanup, config.terminationGraceMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            cleanup.run();
        }
    }

    public IsolatedCoordinatorConfig getConfig() {
        return config;
    }

    /**
     * 실행 중인 단위 강제 종료 및 소유한 스케줄러 종료.
     */
    @Override
    public void close() {
        for (ExecutionUnit unit : activeUnits) {
            unit.terminate();
        }
        activeUnits.clear();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
