package com.ryuqq.timeguard.application.service;

import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.model.WorkInput;
import com.ryuqq.timeguard.core.outcome.Completed;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.policy.DeadlineConfig;
import com.ryuqq.timeguard.core.work.AnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ScanExecutionService 유닛 테스트.
 *
 * <p>코디네이터 선택, 타임아웃 결정, Job ID 발급, 내부 오류 변환을 검증합니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ScanExecutionServiceTest {

    @Mock
    private Coordinator inline;

    @Mock
    private Coordinator isolated;

    private ScanExecutionService service;

    @BeforeEach
    void setUp() {
        service = new ScanExecutionService(new DeadlineConfig(15000L, 30000L), inline, isolated);
    }

    // ============================================================
    // 1. 코디네이터 선택 및 Job 구성
    // ============================================================

    @Test
    void submit_인라인_코디네이터에_위임하고_설정_기본값_적용() {
        // given
        ArgumentCaptor<Job> jobCaptor = ArgumentCaptor.forClass(Job.class);
        when(inline.execute(jobCaptor.capture())).thenAnswer(invocation -> {
            Job job = invocation.getArgument(0);
            return CompletableFuture.completedFuture(
                Completed.of(job.jobId(), AnalysisResult.clean()));
        });

        // when
        Outcome outcome = service.submit(WorkInput.of("contract A {}"), SubmitOptions.none()).join();

        // then
        assertThat(outcome).isInstanceOf(Completed.class);
        Job job = jobCaptor.getValue();
        assertThat(job.effectiveTimeoutMs()).isEqualTo(15000);
        assertThat(job.jobId().getValue()).startsWith("scan-");
        assertThat(job.workInput().getValue()).isEqualTo("contract A {}");
        verifyNoInteractions(isolated);
    }

    @Test
    void submitIsolated_격리_코디네이터에_위임하고_오버라이드와_jobId_적용() {
        // given
        ArgumentCaptor<Job> jobCaptor = ArgumentCaptor.forClass(Job.class);
        when(isolated.execute(jobCaptor.capture())).thenReturn(new CompletableFuture<>());

        // when
        service.submitIsolated(WorkInput.of("x"), SubmitOptions.none().withTimeoutMs(500L).withJobId("job-42"));

        // then
        Job job = jobCaptor.getValue();
        assertThat(job.effectiveTimeoutMs()).isEqualTo(500);
        assertThat(job.jobId().getValue()).isEqualTo("job-42");
        verifyNoInteractions(inline);
    }

    @Test
    void submit_잘못된_오버라이드는_무시되고_기본값_적용() {
        // given
        ArgumentCaptor<Job> jobCaptor = ArgumentCaptor.forClass(Job.class);
        when(inline.execute(jobCaptor.capture())).thenReturn(new CompletableFuture<>());

        // when
        service.submit(WorkInput.of("x"), SubmitOptions.none().withTimeoutMs(-1L));

        // then
        assertThat(jobCaptor.getValue().effectiveTimeoutMs()).isEqualTo(15000);
    }

    @Test
    void submit_호출자가_준_jobId는_문자와_관계없이_그대로_사용() {
        // given
        when(inline.execute(any())).thenAnswer(invocation -> {
            Job job = invocation.getArgument(0);
            return CompletableFuture.completedFuture(Completed.of(job.jobId(), AnalysisResult.clean()));
        });

        // when
        Outcome outcome = service.submit(WorkInput.of("c"), SubmitOptions.none().withJobId("req:42/a.b")).join();

        // then
        assertThat(outcome.jobId().getValue()).isEqualTo("req:42/a.b");
    }

    @Test
    void submit_길이_제한을_넘는_jobId는_새로_발급() {
        // given
        ArgumentCaptor<Job> jobCaptor = ArgumentCaptor.forClass(Job.class);
        when(inline.execute(jobCaptor.capture())).thenReturn(new CompletableFuture<>());

        // when
        service.submit(WorkInput.of("x"), SubmitOptions.none().withJobId("x".repeat(256)));

        // then
        assertThat(jobCaptor.getValue().jobId().getValue()).startsWith("scan-");
    }

    @Test
    void submit_options가_null이면_옵션_없음으로_처리() {
        // given
        when(inline.execute(any())).thenReturn(new CompletableFuture<>());

        // when & then
        assertThat(service.submit(WorkInput.of("x"), null)).isNotDone();
    }

    @Test
    void submit_input이_null이면_예외() {
        assertThatThrownBy(() -> service.submit(null, SubmitOptions.none()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("input cannot be null");
    }

    // ============================================================
    // 2. 코디네이터 내부 오류 → Faulted
    // ============================================================

    @Test
    void submit_코디네이터가_예외를_던지면_Faulted로_변환() {
        // given
        when(inline.execute(any())).thenThrow(new RejectedExecutionException("pool shut down"));

        // when
        Outcome outcome = service.submit(WorkInput.of("x"), SubmitOptions.none().withJobId("job-1")).join();

        // then
        assertThat(outcome).isInstanceOf(Faulted.class);
        Faulted faulted = (Faulted) outcome;
        assertThat(faulted.message()).isEqualTo("Internal coordinator error");
        assertThat(faulted.cause()).isEqualTo(RejectedExecutionException.class.getName());
        assertThat(faulted.jobId().getValue()).isEqualTo("job-1");
    }

    @Test
    void submit_future가_예외로_완료되어도_Faulted로_변환() {
        // given
        when(inline.execute(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bug")));

        // when
        Outcome outcome = service.submit(WorkInput.of("x"), SubmitOptions.none()).join();

        // then
        assertThat(outcome.isFaulted()).isTrue();
    }

    // ============================================================
    // 3. 기본 타임아웃 조회 / 생성자 검증
    // ============================================================

    @Test
    void getDefaultTimeoutMs_설정값_반환() {
        assertThat(service.getDefaultTimeoutMs()).isEqualTo(15000);
        assertThat(new ScanExecutionService(new DeadlineConfig(), inline, isolated).getDefaultTimeoutMs())
            .isEqualTo(30000);
    }

    @Test
    void 생성자_null_의존성_거부() {
        assertThatThrownBy(() -> new ScanExecutionService(null, inline, isolated))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScanExecutionService(new DeadlineConfig(), null, isolated))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScanExecutionService(new DeadlineConfig(), inline, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
