package com.ryuqq.timeguard.adapter.runner;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름이 붙은 데몬 스레드 생성기.
 *
 * <p>코디네이터가 소유한 스레드가 JVM 종료를 막지 않도록 모두 데몬으로 생성합니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class DaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param prefix 스레드 이름 접두어 (예: timeguard-deadline)
     * @throws IllegalArgumentException prefix가 null이거나 빈 문자열인 경우
     */
    public DaemonThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
