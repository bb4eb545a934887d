package com.ryuqq.timeguard.core.policy;

/**
 * Job의 유효 타임아웃을 결정하는 정책.
 *
 * <p><strong>우선순위:</strong></p>
 * <ol>
 *   <li>Job별 오버라이드 (양수일 때)</li>
 *   <li>설정된 프로세스 기본값 (양수일 때)</li>
 *   <li>대체 상수 (30000ms)</li>
 * </ol>
 *
 * <p>양수가 아니거나 숫자가 아닌 오버라이드는 호출자의 실수로 보고 다음 단계로 넘어갑니다.
 * 이 정책은 예외를 던지지 않습니다.</p>
 *
 * <pre>{@code
 * DeadlinePolicy.resolve(500L, 30000L, 30000L);   // 500
 * DeadlinePolicy.resolve(null, 15000L, 30000L);   // 15000
 * DeadlinePolicy.resolve(null, null, 30000L);     // 30000
 * DeadlinePolicy.resolve(-1L, 15000L, 30000L);    // 15000
 * }</pre>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class DeadlinePolicy {

    /**
     * 최종 대체 타임아웃 (밀리초).
     */
    public static final long FALLBACK_TIMEOUT_MS = 30_000L;

    private final DeadlineConfig config;

    /**
     * 생성자.
     *
     * @param config 프로세스 타임아웃 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public DeadlinePolicy(DeadlineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 설정을 기준으로 유효 타임아웃 결정.
     *
     * @param perJobOverrideMs Job별 오버라이드 (null 허용)
     * @return 유효 타임아웃 (밀리초, 항상 양수)
     */
    public long resolve(Long perJobOverrideMs) {
        return resolve(perJobOverrideMs, config.configuredDefaultMs(), config.fallbackTimeoutMs());
    }

    /**
     * 문자열 오버라이드를 기준으로 유효 타임아웃 결정.
     *
     * @param rawOverride 파싱 전 오버라이드 (null, 공백, 숫자 아님 허용)
     * @return 유효 타임아웃 (밀리초, 항상 양수)
     */
    public long resolve(String rawOverride) {
        return resolve(parse(rawOverride));
    }

    /**
     * 현재 설정.
     *
     * @return DeadlineConfig
     */
    public DeadlineConfig getConfig() {
        return config;
    }

    /**
     * 세 단계 우선순위로 유효 타임아웃 결정.
     *
     * @param perJobOverrideMs Job별 오버라이드 (null 허용)
     * @param configuredDefaultMs 설정 기본값 (null 허용)
     * @param fallbackMs 대체값 (양수가 아니면 {@link #FALLBACK_TIMEOUT_MS} 사용)
     * @return 유효 타임아웃 (밀리초, 항상 양수)
     */
    public static long resolve(Long perJobOverrideMs, Long configuredDefaultMs, long fallbackMs) {
        if (isPositive(perJobOverrideMs)) {
            return perJobOverrideMs;
        }
        if (isPositive(configuredDefaultMs)) {
            return configuredDefaultMs;
        }
        return fallbackMs > 0 ? fallbackMs : FALLBACK_TIMEOUT_MS;
    }

    /**
     * 문자열을 밀리초 값으로 파싱.
     *
     * @param raw 원본 문자열 (null 허용)
     * @return 파싱된 값, null/공백/숫자 아님이면 null
     */
    public static Long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isPositive(Long value) {
        return value != null && value > 0;
    }
}
