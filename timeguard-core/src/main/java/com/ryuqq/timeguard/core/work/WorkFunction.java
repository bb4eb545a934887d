package com.ryuqq.timeguard.core.work;

import com.ryuqq.timeguard.core.model.WorkInput;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * 분석 작업 SPI.
 *
 * <p>코디네이터는 Work Function의 내부를 알지 못하며, 취소에 협조한다고 가정하지 않습니다.
 * 구현체는 결과를 반환하거나, 예외를 던지거나, (격리 모드에서) 강제 종료될 수 있어야 합니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>동기 구현: {@link #analyze(WorkInput)}만 구현 (블로킹 허용)</li>
 *   <li>비동기 구현: {@link #analyzeAsync(WorkInput, Executor)}를 재정의</li>
 *   <li>격리 모드: public 기본 생성자 필요 (자식 프로세스에서 리플렉션으로 생성)</li>
 *   <li>분류된 실패: {@link com.ryuqq.timeguard.core.exception.ClassifiedScanException} 사용</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public interface WorkFunction {

    /**
     * 입력을 분석하여 결과 생성 (블로킹).
     *
     * @param input 분석 입력
     * @return 분석 결과 (non-null)
     * @throws Exception 분석 실패 시
     */
    AnalysisResult analyze(WorkInput input) throws Exception;

    /**
     * 비동기 분석.
     *
     * <p>기본 구현은 {@link #analyze(WorkInput)}를 주어진 실행기에서 실행합니다.
     * checked 예외는 {@link CompletionException}으로 감싸집니다.</p>
     *
     * @param input 분석 입력
     * @param executor 작업 실행기
     * @return 분석 결과 stage
     */
    default CompletionStage<AnalysisResult> analyzeAsync(WorkInput input, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return analyze(input);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
