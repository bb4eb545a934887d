package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.model.JobId;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 하나의 Job을 위해 생성된 격리 실행 단위.
 *
 * <p>실행 단위는 자신만의 입력 사본을 갖고 독립적으로 스케줄되며, 메시지로만 코디네이터와 통신합니다.
 * Job 간 공유되거나 재사용되지 않습니다.</p>
 *
 * <p><strong>신호:</strong></p>
 * <ul>
 *   <li>{@link #message()}: 단위가 보낸 첫 번째 종료 메시지 (Result 또는 Error).
 *       메시지 없이 출력이 끝나면 {@code Optional.empty()}로 완료</li>
 *   <li>{@link #exit()}: 단위 종료 코드 (실행 기반이 전달하는 생명주기 이벤트)</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public interface ExecutionUnit {

    /**
     * 이 단위가 실행 중인 Job ID.
     *
     * @return Job ID
     */
    JobId jobId();

    /**
     * 첫 번째 종료 메시지.
     *
     * @return 메시지 future (메시지 채널이 닫힐 때까지 완료됨)
     */
    CompletableFuture<Optional<UnitMessage>> message();

    /**
     * 단위 종료 이벤트.
     *
     * @return 종료 코드 future
     */
    CompletableFuture<Integer> exit();

    /**
     * 강제 종료 요청 (비블로킹, 종료 확인을 기다리지 않음).
     */
    void terminate();

    /**
     * 아직 실행 중인지 확인.
     *
     * @return 실행 중이면 true
     */
    boolean isAlive();
}
