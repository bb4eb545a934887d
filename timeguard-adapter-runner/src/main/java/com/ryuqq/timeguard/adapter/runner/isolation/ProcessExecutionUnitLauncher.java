package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.adapter.runner.DaemonThreadFactory;
import com.ryuqq.timeguard.core.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ThreadFactory;

/**
 * 자식 JVM 프로세스로 실행 단위를 시작하는 Launcher.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>요청 직렬화: {jobId, workInput} (입력 사본)</li>
 *   <li>프로세스 시작: {@link ProcessUnitConfig#command()}, stderr는 부모에게 상속</li>
 *   <li>I/O 스레드가 stdin 전송 후 stdout 메시지 수신</li>
 * </ol>
 *
 * <p>프로세스 시작 자체는 호출 스레드에서 수행되지만 stdin 쓰기와 stdout 읽기는 I/O 스레드가 담당하므로
 * 호출자는 자식 JVM 기동을 기다리지 않습니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class ProcessExecutionUnitLauncher implements ExecutionUnitLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionUnitLauncher.class);

    private final ProcessUnitConfig config;
    private final UnitProtocol protocol;
    private final ThreadFactory ioThreadFactory;

    public ProcessExecutionUnitLauncher(ProcessUnitConfig config) {
        this(config, new UnitProtocol());
    }

    /**
     * 생성자.
     *
     * @param config 자식 JVM 설정
     * @param protocol 메시지 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProcessExecutionUnitLauncher(ProcessUnitConfig config, UnitProtocol protocol) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("protocol cannot be null");
        }
        this.config = config;
        this.protocol = protocol;
        this.ioThreadFactory = new DaemonThreadFactory("timeguard-unit-io");
    }

    @Override
    public ExecutionUnit launch(Job job) throws ExecutionUnitLaunchException {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }

        byte[] request;
        try {
            request = protocol.encodeRequest(
                new UnitSpawnRequest(job.jobId().getValue(), job.workInput().getValue()));
        } catch (IOException e) {
            throw new ExecutionUnitLaunchException("Failed to encode request for " + job.jobId(), e);
        }

        Process process;
        try {
            process = new ProcessBuilder(config.command())
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            throw new ExecutionUnitLaunchException("Failed to start worker process for " + job.jobId(), e);
        }

        ProcessExecutionUnit unit = new ProcessExecutionUnit(job.jobId(), process, protocol);
        unit.start(ioThreadFactory, request);
        log.debug("Scan {} started worker pid {} ({})", job.jobId(), unit.pid(), config.workFunctionClass());
        return unit;
    }

    public ProcessUnitConfig getConfig() {
        return config;
    }
}
