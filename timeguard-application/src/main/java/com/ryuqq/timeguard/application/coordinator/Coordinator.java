package com.ryuqq.timeguard.application.coordinator;

import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.outcome.Outcome;

import java.util.concurrent.CompletableFuture;

/**
 * 시간 제한 실행 조정자.
 *
 * <p>Job의 작업을 데드라인과 경쟁시키고, 먼저 도착한 신호로 Outcome을 정확히 한 번 결정합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>호출자를 블로킹하지 않음 (즉시 future 반환)</li>
 *   <li>반환된 future는 정확히 한 번, 항상 정상 완료됨 (예외로 완료되지 않음)</li>
 *   <li>타임아웃과 실행 오류는 예외가 아닌 {@link com.ryuqq.timeguard.core.outcome.TimedOut},
 *       {@link com.ryuqq.timeguard.core.outcome.Faulted}로 전달</li>
 *   <li>Job 간 상태 공유 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Job job = Job.now(JobId.generate(), WorkInput.of(source), 5_000);
 * coordinator.execute(job).thenAccept(outcome -&gt; {
 *     if (outcome.isTimedOut()) {
 *         // SCAN_TIMEOUT
 *     }
 * });
 * </pre>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public interface Coordinator extends AutoCloseable {

    /**
     * Job 실행.
     *
     * @param job 실행할 Job
     * @return Outcome future (정확히 한 번 완료)
     * @throws IllegalArgumentException job이 null인 경우
     */
    CompletableFuture<Outcome> execute(Job job);

    /**
     * 코디네이터가 소유한 실행기 자원 해제.
     *
     * <p>진행 중인 Job의 결과 전달은 보장되지 않습니다.</p>
     */
    @Override
    void close();
}
