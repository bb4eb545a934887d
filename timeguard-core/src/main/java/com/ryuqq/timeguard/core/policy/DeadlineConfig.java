package com.ryuqq.timeguard.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 프로세스 전역 타임아웃 설정 (불변 record).
 *
 * <p>프로세스 시작 시 한 번 로드되어 코디네이터 생성자에 전달되며, 이후 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>configuredDefaultMs: 환경 변수 {@value #ENV_MAX_EXECUTION_TIME_MS}에서 읽은 기본값 (없거나 잘못되면 null)</li>
 *   <li>fallbackTimeoutMs: 최종 대체값 (기본 30000ms)</li>
 * </ul>
 *
 * <p>잘못된 설정 값은 오류로 취급하지 않고 다음 단계로 넘어갑니다 (WARN 로그만 남김).</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 * @param configuredDefaultMs 설정된 기본 타임아웃 (밀리초, null 허용, 양수가 아니면 null로 정규화)
 * @param fallbackTimeoutMs 대체 타임아웃 (밀리초, 양수여야 함)
 */
public record DeadlineConfig(
    Long configuredDefaultMs,
    long fallbackTimeoutMs
) {

    /**
     * 프로세스 기본 타임아웃 환경 변수 이름.
     */
    public static final String ENV_MAX_EXECUTION_TIME_MS = "SCAN_MAX_EXECUTION_TIME_MS";

    private static final Logger log = LoggerFactory.getLogger(DeadlineConfig.class);

    /**
     * 기본 설정 생성자 (configuredDefault 없음, fallback 30000ms).
     */
    public DeadlineConfig() {
        this(null, DeadlinePolicy.FALLBACK_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException fallbackTimeoutMs가 양수가 아닌 경우
     */
    public DeadlineConfig {
        if (fallbackTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "fallbackTimeoutMs must be positive (current: " + fallbackTimeoutMs + ")"
            );
        }
        if (configuredDefaultMs != null && configuredDefaultMs <= 0) {
            configuredDefaultMs = null;
        }
    }

    /**
     * 현재 프로세스 환경 변수에서 설정 로드.
     *
     * @return DeadlineConfig 인스턴스
     */
    public static DeadlineConfig fromEnvironment() {
        return from(System.getenv());
    }

    /**
     * 주어진 환경 맵에서 설정 로드.
     *
     * @param environment 환경 변수 맵
     * @return DeadlineConfig 인스턴스
     * @throws IllegalArgumentException environment가 null인 경우
     */
    public static DeadlineConfig from(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        String raw = environment.get(ENV_MAX_EXECUTION_TIME_MS);
        Long parsed = DeadlinePolicy.parse(raw);
        if (raw != null && (parsed == null || parsed <= 0)) {
            log.warn("Ignoring invalid {}={}, falling back to {}ms",
                ENV_MAX_EXECUTION_TIME_MS, raw, DeadlinePolicy.FALLBACK_TIMEOUT_MS);
        }
        return new DeadlineConfig(parsed, DeadlinePolicy.FALLBACK_TIMEOUT_MS);
    }

    /**
     * configuredDefaultMs만 변경한 새 인스턴스 생성.
     */
    public DeadlineConfig withConfiguredDefaultMs(Long configuredDefaultMs) {
        return new DeadlineConfig(configuredDefaultMs, fallbackTimeoutMs);
    }

    /**
     * fallbackTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public DeadlineConfig withFallbackTimeoutMs(long fallbackTimeoutMs) {
        return new DeadlineConfig(configuredDefaultMs, fallbackTimeoutMs);
    }

    /**
     * Job 오버라이드가 없을 때 적용되는 기본 타임아웃.
     *
     * @return configuredDefaultMs가 있으면 그 값, 없으면 fallbackTimeoutMs
     */
    public long defaultTimeoutMs() {
        return DeadlinePolicy.resolve(null, configuredDefaultMs, fallbackTimeoutMs);
    }
}
