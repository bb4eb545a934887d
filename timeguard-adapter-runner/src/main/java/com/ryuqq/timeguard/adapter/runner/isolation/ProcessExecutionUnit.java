package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.model.JobId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;

/**
 * 자식 JVM 프로세스 기반 실행 단위.
 *
 * <p>전용 I/O 스레드 하나가 요청을 stdin에 쓰고 닫은 뒤, stdout을 끝까지 읽으며
 * 첫 번째 메시지 줄로 {@link #message()}를 완료합니다. 이후 메시지 줄은 버려집니다.</p>
 *
 * <p>강제 종료는 자식 프로세스와 그 하위 프로세스 모두에 destroyForcibly를 보냅니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
final class ProcessExecutionUnit implements ExecutionUnit {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionUnit.class);

    private final JobId jobId;
    private final Process process;
    private final UnitProtocol protocol;
    private final CompletableFuture<Optional<UnitMessage>> message = new CompletableFuture<>();
    private final CompletableFuture<Integer> exit;

    ProcessExecutionUnit(JobId jobId, Process process, UnitProtocol protocol) {
        this.jobId = jobId;
        this.process = process;
        this.protocol = protocol;
        this.exit = process.onExit().thenApply(Process::exitValue);
    }

    /**
     * I/O 스레드 시작.
     *
     * @param threadFactory I/O 스레드 생성기
     * @param request stdin으로 보낼 요청 바이트
     */
    void start(ThreadFactory threadFactory, byte[] request) {
        threadFactory.newThread(() -> pump(request)).start();
    }

    private void pump(byte[] request) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(request);
        } catch (IOException e) {
            log.warn("Scan {} could not hand its input to worker pid {}: {}", jobId, process.pid(), e.getMessage());
        }

        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                accept(line);
            }
        } catch (IOException e) {
            log.debug("Scan {} worker output closed: {}", jobId, e.getMessage());
        } finally {
            message.complete(Optional.empty());
        }
    }

    private void accept(String line) {
        if (!protocol.isMessageLine(line)) {
            log.debug("[worker {}] {}", jobId, line);
            return;
        }
        if (message.isDone()) {
            log.debug("Scan {} dropped extra worker message", jobId);
            return;
        }
        try {
            message.complete(Optional.of(protocol.decodeMessage(line)));
        } catch (IOException e) {
            log.warn("Scan {} received malformed worker message: {}", jobId, e.getMessage());
        }
    }

    @Override
    public JobId jobId() {
        return jobId;
    }

    @Override
    public CompletableFuture<Optional<UnitMessage>> message() {
        return message;
    }

    @Override
    public CompletableFuture<Integer> exit() {
        return exit;
    }

    @Override
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        log.debug("Scan {} sent kill to worker pid {}", jobId, process.pid());
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    long pid() {
        return process.pid();
    }
}
