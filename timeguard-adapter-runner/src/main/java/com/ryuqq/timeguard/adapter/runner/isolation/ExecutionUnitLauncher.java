package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.model.Job;

/**
 * 실행 단위 생성기.
 *
 * <p>구현체는 Job의 workInput과 jobId를 생성 시점에 복사해 전달해야 하며,
 * 호출자와 가변 상태를 공유해서는 안 됩니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public interface ExecutionUnitLauncher {

    /**
     * Job 전용 실행 단위 시작.
     *
     * @param job 실행할 Job
     * @return 시작된 실행 단위
     * @throws ExecutionUnitLaunchException 실행 단위를 시작할 수 없는 경우
     */
    ExecutionUnit launch(Job job) throws ExecutionUnitLaunchException;
}
