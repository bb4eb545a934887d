package com.ryuqq.timeguard.adapter.runner;

import com.ryuqq.timeguard.core.exception.ClassifiedScanException;
import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.outcome.TimedOut;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Work Function 실패를 Outcome으로 변환.
 *
 * <p>{@link ClassifiedScanException}은 이미 분류된 실패이므로 다시 감싸지 않고 그대로 전파합니다.
 * 그 외 예외는 메시지를 보존한 {@link Faulted}가 됩니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    static final String UNKNOWN_ERROR_MESSAGE = "Unknown scan error";

    private FailureClassifier() {
    }

    /**
     * 실패를 Outcome으로 변환.
     *
     * @param jobId Job ID
     * @param failure Work Function이 던진 예외 (CompletionException 래핑 허용)
     * @return TimedOut (분류된 타임아웃) 또는 Faulted
     */
    public static Outcome classify(JobId jobId, Throwable failure) {
        return classify(jobId, failure, UNKNOWN_ERROR_MESSAGE);
    }

    /**
     * 실패를 Outcome으로 변환 (메시지 없는 예외의 대체 메시지 지정).
     *
     * @param jobId Job ID
     * @param failure 예외
     * @param fallbackMessage 메시지가 없을 때 사용할 문구
     * @return TimedOut 또는 Faulted
     */
    public static Outcome classify(JobId jobId, Throwable failure, String fallbackMessage) {
        Throwable cause = unwrap(failure);
        String message = messageOr(cause, fallbackMessage);

        if (cause instanceof ClassifiedScanException classified
            && classified.getErrorCode() == ErrorCode.SCAN_TIMEOUT) {
            return new TimedOut(jobId, classified.getTimeoutMs(), message);
        }
        return Faulted.of(jobId, message, cause.getClass().getName());
    }

    /**
     * CompletionException / ExecutionException 래핑 제거.
     *
     * @param failure 예외
     * @return 가장 안쪽의 실제 원인
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 예외 메시지 조회 (없으면 대체 문구).
     *
     * @param failure 예외
     * @param fallback 대체 문구
     * @return 메시지
     */
    public static String messageOr(Throwable failure, String fallback) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? fallback : message;
    }
}
