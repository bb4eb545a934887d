package com.ryuqq.timeguard.adapter.runner.isolation;

/**
 * 실행 단위를 시작하지 못했을 때 발생하는 예외.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public class ExecutionUnitLaunchException extends Exception {

    public ExecutionUnitLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
