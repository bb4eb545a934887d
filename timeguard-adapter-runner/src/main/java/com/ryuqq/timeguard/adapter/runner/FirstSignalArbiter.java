package com.ryuqq.timeguard.adapter.runner;

import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 먼저 도착한 신호 하나만 Outcome을 결정하도록 보장하는 중재자 (Job당 1개).
 *
 * <p>모든 신호 핸들러는 {@link #resolve(Signal, Supplier)}를 통해서만 결과를 전달합니다.
 * 결정 지점은 {@code winner}에 대한 단일 compareAndSet이며, 이를 통과한 신호만
 * Outcome을 계산하고 전달합니다. 늦게 도착한 신호는 debug 로그만 남기고 무시됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>winner CAS(null → signal) 시도</li>
 *   <li>실패 시: 이미 결정됨 → false 반환</li>
 *   <li>성공 시: outcomeSupplier 실행 (부수 효과 허용, 예: 실행 단위 강제 종료)</li>
 *   <li>supplier 예외 시: Faulted("Internal coordinator error")로 대체</li>
 *   <li>outcome future 완료 → true 반환</li>
 * </ol>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class FirstSignalArbiter {

    static final String INTERNAL_ERROR_MESSAGE = "Internal coordinator error";

    private static final Logger log = LoggerFactory.getLogger(FirstSignalArbiter.class);

    private final JobId jobId;
    private final AtomicReference<Signal> winner = new AtomicReference<>();
    private final CompletableFuture<Outcome> outcome = new CompletableFuture<>();

    /**
     * 생성자.
     *
     * @param jobId Job ID
     * @throws IllegalArgumentException jobId가 null인 경우
     */
    public FirstSignalArbiter(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        this.jobId = jobId;
    }

    /**
     * 신호로 Outcome 결정 시도.
     *
     * @param signal 도착한 신호
     * @param outcomeSupplier 이 신호가 이겼을 때만 호출되는 Outcome 생성 함수
     * @return 이 신호가 Outcome을 결정했으면 true, 이미 결정된 뒤였으면 false
     */
    public boolean resolve(Signal signal, Supplier<? extends Outcome> outcomeSupplier) {
        if (!winner.compareAndSet(null, signal)) {
            log.debug("Scan {} ignored late {} signal (resolved by {})", jobId, signal, winner.get());
            return false;
        }

        Outcome resolved;
        try {
            resolved = outcomeSupplier.get();
            if (resolved == null) {
                throw new IllegalStateException("outcome supplier returned null for " + signal);
            }
        } catch (RuntimeException e) {
            log.error("Scan {} could not build outcome for {} signal", jobId, signal, e);
            resolved = Faulted.of(jobId, INTERNAL_ERROR_MESSAGE, e.getClass().getName());
        }

        outcome.complete(resolved);
        return true;
    }

    /**
     * 이미 결정되었는지 확인.
     *
     * @return 결정되었으면 true
     */
    public boolean isResolved() {
        return winner.get() != null;
    }

    /**
     * Outcome을 결정한 신호.
     *
     * @return 이긴 신호, 아직 결정 전이면 null
     */
    public Signal winnerOrNull() {
        return winner.get();
    }

    public JobId getJobId() {
        return jobId;
    }

    /**
     * 호출자에게 전달할 Outcome future.
     *
     * <p>내부 future의 사본을 반환하므로 호출자가 complete()를 호출해도
     * 결정된 결과에 영향을 주지 않습니다.</p>
     *
     * @return Outcome future 사본
     */
    public CompletableFuture<Outcome> outcome() {
        return outcome.copy();
    }

    /**
     * 결정 이후 정리 작업 등록.
     *
     * @param action Outcome 결정 직후 실행할 작업
     */
    void whenResolved(Runnable action) {
        outcome.whenComplete((resolved, error) -> action.run());
    }
}
