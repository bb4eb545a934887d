package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.exception.ClassifiedScanException;
import com.ryuqq.timeguard.core.model.WorkInput;
import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.core.work.AnalysisResult;
import com.ryuqq.timeguard.core.work.WorkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 실행 단위(자식 JVM)의 진입점.
 *
 * <p><strong>실행:</strong> {@code java -cp <classpath> IsolatedWorkerMain <workFunctionClass>}</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>Work Function 클래스를 기본 생성자로 생성</li>
 *   <li>stdin에서 요청 JSON 읽기 (EOF까지)</li>
 *   <li>Work Function 실행 (이 프로세스의 메인 스레드, Error 포함 모든 실패를 Error 메시지로 변환)</li>
 *   <li>결과 또는 오류를 stdout에 메시지 한 줄로 전송 후 종료</li>
 * </ol>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 메시지 전송 완료 (Result 또는 Error)</li>
 *   <li>64: 인자 오류 또는 Work Function 생성 실패</li>
 *   <li>65: 요청을 읽을 수 없음</li>
 *   <li>70: 메시지를 보내지 못한 내부 오류</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class IsolatedWorkerMain {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_BAD_REQUEST = 65;
    static final int EXIT_SOFTWARE = 70;

    static final String UNKNOWN_ERROR_MESSAGE = "Unknown error in worker";

    private static final Logger log = LoggerFactory.getLogger(IsolatedWorkerMain.class);

    private IsolatedWorkerMain() {
    }

    /**
     * 진입점.
     *
     * <p>메시지 채널로 쓸 원래 stdout을 확보한 뒤 {@code System.out}을 stderr로 돌립니다.
     * Work Function의 출력은 메시지 줄과 섞이지 않습니다.</p>
     *
     * @param args Work Function 클래스 이름
     */
    public static void main(String[] args) {
        PrintStream protocolOut = System.out;
        System.setOut(System.err);

        int code = EXIT_SOFTWARE;
        try {
            code = run(args, System.in, protocolOut);
        } catch (RuntimeException | Error e) {
            log.error("Worker failed outside the work function", e);
        } finally {
            System.exit(code);
        }
    }

    /**
     * 실행 단위 본문.
     *
     * @param args 명령행 인자 (Work Function 클래스 이름 1개)
     * @param in 요청 입력 스트림
     * @param out 메시지 출력 스트림
     * @return 종료 코드
     */
    static int run(String[] args, InputStream in, PrintStream out) {
        if (args == null || args.length != 1 || args[0].isBlank()) {
            log.error("Usage: IsolatedWorkerMain <workFunctionClass>");
            return EXIT_USAGE;
        }

        WorkFunction workFunction;
        try {
            workFunction = instantiate(args[0]);
        } catch (ReflectiveOperationException | ClassCastException e) {
            log.error("Cannot create work function {}", args[0], e);
            return EXIT_USAGE;
        }

        UnitProtocol protocol = new UnitProtocol();
        UnitSpawnRequest request;
        try {
            request = protocol.decodeRequest(in);
        } catch (IOException e) {
            log.error("Cannot read scan request", e);
            return EXIT_BAD_REQUEST;
        }

        UnitMessage message = analyze(workFunction, request);
        try {
            out.println(protocol.encodeMessage(message));
            out.flush();
        } catch (IOException e) {
            log.error("Cannot encode result for {}", request.jobId(), e);
            out.println(encodeFallback(protocol, request.jobId()));
            out.flush();
        }
        return EXIT_OK;
    }

    private static WorkFunction instantiate(String className) throws ReflectiveOperationException {
        Class<?> type = Class.forName(className);
        return (WorkFunction) type.getDeclaredConstructor().newInstance();
    }

    private static UnitMessage analyze(WorkFunction workFunction, UnitSpawnRequest request) {
        try {
            AnalysisResult result = workFunction
                .analyzeAsync(WorkInput.of(request.workInput()), Runnable::run)
                .toCompletableFuture()
                .join();
            if (result == null) {
                return UnitMessage.ofError(ErrorCode.SCAN_ERROR, "Work function returned no result", 0, null);
            }
            return UnitMessage.ofResult(result);
        } catch (Throwable e) {
            return toErrorMessage(e);
        }
    }

    static UnitMessage toErrorMessage(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() == null || cause.getMessage().isBlank()
            ? UNKNOWN_ERROR_MESSAGE
            : cause.getMessage();

        if (cause instanceof ClassifiedScanException classified) {
            return UnitMessage.ofError(classified.getErrorCode(), message,
                classified.getTimeoutMs(), cause.getClass().getName());
        }
        return UnitMessage.ofError(ErrorCode.SCAN_ERROR, message, 0, cause.getClass().getName());
    }

    private static String encodeFallback(UnitProtocol protocol, String jobId) {
        try {
            return protocol.encodeMessage(
                UnitMessage.ofError(ErrorCode.SCAN_ERROR, "Worker could not encode result for " + jobId, 0, null));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot encode worker error message", e);
        }
    }
}
