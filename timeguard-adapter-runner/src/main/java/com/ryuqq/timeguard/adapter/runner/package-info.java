/**
 * Runner Adapter Layer - Coordinator 구현체.
 *
 * <p>이 패키지는 Coordinator 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.timeguard.adapter.runner.InlineCoordinator} - 같은 프로세스에서 작업과 데드라인을 경쟁</li>
 *   <li>{@link com.ryuqq.timeguard.adapter.runner.IsolatedCoordinator} - Job마다 자식 JVM을 생성, 타임아웃 시 강제 종료</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (InlineCoordinator, IsolatedCoordinator, FirstSignalArbiter)
 *   ↓ implements
 * application (Coordinator interface, ScanExecutionService)
 *   ↓ depends on
 * core (JobId, WorkInput, Job, Outcome, DeadlinePolicy)
 *   ↓ depends on
 * core/work (WorkFunction SPI)
 * </pre>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
package com.ryuqq.timeguard.adapter.runner;
