package com.ryuqq.timeguard.testkit.contract;

import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.core.model.Job;
import com.ryuqq.timeguard.core.model.JobId;
import com.ryuqq.timeguard.core.model.WorkInput;
import com.ryuqq.timeguard.core.outcome.Completed;
import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.core.outcome.Faulted;
import com.ryuqq.timeguard.core.outcome.Outcome;
import com.ryuqq.timeguard.core.outcome.TimedOut;
import com.ryuqq.timeguard.testkit.work.ScriptedWork;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract contract suite every {@link Coordinator} implementation must pass.
 *
 * <p>Subclasses supply a coordinator whose work function is {@link ScriptedWork}, so each test
 * describes the work's behavior as a script in the job input.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InlineCoordinatorContractTest extends AbstractCoordinatorContractTest {
 *     {@literal @}Override
 *     protected Coordinator createCoordinator() {
 *         return new InlineCoordinator(new ScriptedWork());
 *     }
 * }
 * </pre>
 *
 * <p>Coordinators that need time to start their execution units (for example a child JVM) override
 * {@link #startupAllowanceMs()}; it is added to every deadline that the work is expected to meet.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public abstract class AbstractCoordinatorContractTest {

    /**
     * Slack allowed between the deadline and the delivery of the TimedOut outcome.
     */
    protected static final long DELIVERY_SLACK_MS = 2000;

    protected Coordinator coordinator;

    /**
     * Creates the coordinator under test, running {@link ScriptedWork}.
     *
     * @return a fresh coordinator
     */
    protected abstract Coordinator createCoordinator();

    /**
     * Time the coordinator may spend before the work function starts.
     *
     * @return allowance in milliseconds (default 0)
     */
    protected long startupAllowanceMs() {
        return 0;
    }

    @BeforeEach
    void setUpCoordinator() {
        coordinator = createCoordinator();
    }

    @AfterEach
    void tearDownCoordinator() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    @Test
    void testFastWork_CompletesBeforeDeadline_ReturnsCompleted() throws Exception {
        // Given
        Job job = job(ScriptedWork.script("sleep 50", "finding R-001"), startupAllowanceMs() + 3000);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        Completed completed = assertInstanceOf(Completed.class, outcome);
        assertEquals(job.jobId(), completed.jobId());
        assertEquals(1, completed.result().findings().size());
        assertEquals("R-001", completed.result().findings().get(0).ruleId());
        assertNull(outcome.codeOrNull());
    }

    @Test
    void testSlowWork_ExceedsDeadline_ReturnsTimedOutShortlyAfterDeadline() throws Exception {
        // Given
        long timeoutMs = startupAllowanceMs() + 300;
        Job job = job(ScriptedWork.script("sleep 60000"), timeoutMs);
        long start = System.currentTimeMillis();

        // When
        Outcome outcome = await(coordinator.execute(job), job);
        long elapsed = System.currentTimeMillis() - start;

        // Then
        TimedOut timedOut = assertInstanceOf(TimedOut.class, outcome);
        assertEquals(job.jobId(), timedOut.jobId());
        assertEquals(timeoutMs, timedOut.timeoutMs());
        assertEquals(ErrorCode.SCAN_TIMEOUT, timedOut.code());
        assertTrue(timedOut.message().contains(String.valueOf(timeoutMs)),
                "Timeout message should state the limit: " + timedOut.message());
        assertTrue(elapsed >= timeoutMs - 50, "Should not time out before the deadline (elapsed " + elapsed + "ms)");
        assertTrue(elapsed < timeoutMs + DELIVERY_SLACK_MS, "Should time out shortly after the deadline (elapsed " + elapsed + "ms)");
    }

    @Test
    void testRunawayWork_IgnoringInterrupts_StillTimesOut() throws Exception {
        // Given
        long timeoutMs = startupAllowanceMs() + 300;
        Job job = job(ScriptedWork.script("spin 5000"), timeoutMs);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        TimedOut timedOut = assertInstanceOf(TimedOut.class, outcome);
        assertEquals(timeoutMs, timedOut.timeoutMs());
    }

    @Test
    void testFailingWork_FailsImmediately_ReturnsFaultedAndNeverTimesOut() throws Exception {
        // Given
        long timeoutMs = startupAllowanceMs() + 500;
        Job job = job(ScriptedWork.script("fail Parser crashed"), timeoutMs);

        // When
        CompletableFuture<Outcome> future = coordinator.execute(job);
        Outcome outcome = await(future, job);
        sleep(timeoutMs + 200);

        // Then
        Faulted faulted = assertInstanceOf(Faulted.class, outcome);
        assertEquals("Parser crashed", faulted.message());
        assertEquals(ErrorCode.SCAN_ERROR, faulted.code());
        assertSame(outcome, future.getNow(null), "Outcome must not change after the deadline passes");
    }

    @Test
    void testClassifiedTimeout_RaisedByWork_PropagatesAsTimedOut() throws Exception {
        // Given
        Job job = job(ScriptedWork.script("fail-classified-timeout 1234"), startupAllowanceMs() + 3000);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        TimedOut timedOut = assertInstanceOf(TimedOut.class, outcome);
        assertEquals(1234, timedOut.timeoutMs());
        assertEquals("Scan exceeded maximum execution time of 1234ms", timedOut.message());
    }

    @Test
    void testClassifiedError_RaisedByWork_KeepsMessageUnchanged() throws Exception {
        // Given
        Job job = job(ScriptedWork.script("fail-classified-error Rule engine unavailable"), startupAllowanceMs() + 3000);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        Faulted faulted = assertInstanceOf(Faulted.class, outcome);
        assertEquals("Rule engine unavailable", faulted.message());
    }

    @Test
    void testFatalError_ThrownByWork_ReturnsFaultedWithMessage() throws Exception {
        // Given
        Job job = job(ScriptedWork.script("fail-error stack exhausted"), startupAllowanceMs() + 3000);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        Faulted faulted = assertInstanceOf(Faulted.class, outcome);
        assertEquals("stack exhausted", faulted.message());
        assertEquals(StackOverflowError.class.getName(), faulted.cause());
    }

    @Test
    void testNullResult_ReturnedByWork_ReturnsFaulted() throws Exception {
        // Given
        Job job = job(ScriptedWork.script("return-null"), startupAllowanceMs() + 3000);

        // When
        Outcome outcome = await(coordinator.execute(job), job);

        // Then
        Faulted faulted = assertInstanceOf(Faulted.class, outcome);
        assertEquals("Work function returned no result", faulted.message());
    }

    @Test
    void testConcurrentJobs_MixedDurations_ResolveIndependently() throws Exception {
        // Given
        long timeoutMs = startupAllowanceMs() + 1000;
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String script = i % 2 == 0 ? "sleep 20; finding R-" + i : "sleep 60000";
            jobs.add(job(WorkInput.of(script), timeoutMs));
        }

        // When
        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (Job job : jobs) {
            futures.add(coordinator.execute(job));
        }

        // Then
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            Outcome outcome = await(futures.get(i), job);
            assertEquals(job.jobId(), outcome.jobId());
            if (i % 2 == 0) {
                Completed completed = assertInstanceOf(Completed.class, outcome);
                assertEquals("R-" + i, completed.result().findings().get(0).ruleId());
            } else {
                assertInstanceOf(TimedOut.class, outcome);
            }
        }
    }

    /**
     * Creates a job with a generated ID.
     *
     * @param input work input (usually a {@link ScriptedWork} script)
     * @param timeoutMs effective timeout
     * @return job
     */
    protected Job job(WorkInput input, long timeoutMs) {
        return Job.now(JobId.generate(), input, timeoutMs);
    }

    /**
     * Waits for the outcome, failing the test if the coordinator never resolves it.
     *
     * @param future outcome future
     * @param job the job it belongs to
     * @return the outcome
     */
    protected Outcome await(CompletableFuture<Outcome> future, Job job)
            throws InterruptedException, ExecutionException {
        try {
            return future.get(job.effectiveTimeoutMs() + DELIVERY_SLACK_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return fail("Coordinator did not resolve " + job.jobId() + " within its deadline");
        }
    }

    /**
     * Sleeps for the specified duration.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
