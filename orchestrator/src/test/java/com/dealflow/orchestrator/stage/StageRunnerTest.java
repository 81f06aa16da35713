package com.dealflow.orchestrator.stage;

import com.dealflow.orchestrator.model.ExecutionStatus;
import com.dealflow.orchestrator.model.StageState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for StageRunner.
 *
 * Uses a real thread pool and millisecond-scale timeouts/backoff so the retry
 * loop, per-attempt deadline and cancellation paths run exactly as in
 * production, just faster.
 */
class StageRunnerTest {

    private static final Duration TIMEOUT = Duration.ofMillis(500);
    private static final Duration BACKOFF = Duration.ofMillis(10);

    ExecutorService     executor;
    SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        meters   = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StageRunner runner(int maxRetries) {
        return new StageRunner("analysis", executor, new RetrySettings(maxRetries, TIMEOUT, BACKOFF), meters);
    }

    // ------------------------------------------------------------------
    // Success paths
    // ------------------------------------------------------------------

    @Test
    void run_successOnFirstAttempt_completedWithZeroRetries() {
        StageRunner runner = runner(3);

        StageOutcome<String> outcome = runner.run(() -> "ok");

        assertThat(outcome).isEqualTo(new StageOutcome.Completed<>("ok"));
        ExecutionStatus status = runner.status();
        assertThat(status.state()).isEqualTo(StageState.COMPLETED);
        assertThat(status.retryCount()).isZero();
        assertThat(status.startedAt()).isNotNull();
        assertThat(status.completedAt()).isNotNull();
        assertThat(status.duration()).isNotNull();
        assertThat(status.errorMessage()).isNull();
    }

    @Test
    void run_failsThenSucceeds_retryCountIsFailedAttempts() {
        StageRunner runner = runner(3);
        AtomicInteger calls = new AtomicInteger();

        StageOutcome<String> outcome = runner.run(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new StageException(StageException.Kind.OPERATION_ERROR, "rate limited");
            }
            return "third time lucky";
        });

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(calls.get()).isEqualTo(3);
        assertThat(runner.status().state()).isEqualTo(StageState.COMPLETED);
        assertThat(runner.status().retryCount()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Exhaustion
    // ------------------------------------------------------------------

    @Test
    void run_alwaysFailing_failsAfterExactlyMaxRetriesWithBackoff() {
        StageRunner runner = runner(3);
        AtomicInteger calls = new AtomicInteger();

        long start = System.nanoTime();
        StageOutcome<String> outcome = runner.run(() -> {
            calls.incrementAndGet();
            throw new StageException(StageException.Kind.OPERATION_ERROR, "service unavailable");
        });
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(outcome).isInstanceOf(StageOutcome.Failed.class);
        StageOutcome.Failed<String> failed = (StageOutcome.Failed<String>) outcome;
        assertThat(failed.kind()).isEqualTo(StageErrorKind.MAX_RETRIES_EXCEEDED);
        assertThat(failed.lastAttemptKind()).isEqualTo(StageErrorKind.OPERATION_ERROR);
        assertThat(failed.message()).contains("service unavailable");

        // backoff after attempt 1 and 2: 10*2 + 10*4 ms
        assertThat(elapsedMs).isGreaterThanOrEqualTo(60);

        ExecutionStatus status = runner.status();
        assertThat(status.state()).isEqualTo(StageState.FAILED);
        assertThat(status.retryCount()).isEqualTo(3);
        assertThat(status.errorMessage()).contains("service unavailable");
        assertThat(status.completedAt()).isNotNull();
    }

    @Test
    void run_unexpectedException_isStillRetried() {
        StageRunner runner = runner(2);
        AtomicInteger calls = new AtomicInteger();

        StageOutcome<String> outcome = runner.run(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        assertThat(calls.get()).isEqualTo(2);
        assertThat(((StageOutcome.Failed<String>) outcome).lastAttemptKind())
                .isEqualTo(StageErrorKind.UNEXPECTED);
    }

    @Test
    void run_nonRetryableError_failsImmediately() {
        StageRunner runner = runner(3);
        AtomicInteger calls = new AtomicInteger();

        StageOutcome<String> outcome = runner.run(() -> {
            calls.incrementAndGet();
            throw new StageException(StageException.Kind.NON_RETRYABLE, "permission denied");
        });

        assertThat(calls.get()).isEqualTo(1);
        assertThat(((StageOutcome.Failed<String>) outcome).kind()).isEqualTo(StageErrorKind.NON_RETRYABLE);
        assertThat(runner.status().state()).isEqualTo(StageState.FAILED);
        assertThat(runner.status().retryCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Timeouts and cancellation
    // ------------------------------------------------------------------

    @Test
    void run_attemptExceedsTimeout_isCancelledAndCountsAsTimeout() throws Exception {
        StageRunner runner = new StageRunner("risk", executor,
                new RetrySettings(2, Duration.ofMillis(50), BACKOFF), meters);
        CountDownLatch interrupted = new CountDownLatch(2);

        StageOutcome<String> outcome = runner.run(() -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "too late";
        });

        StageOutcome.Failed<String> failed = (StageOutcome.Failed<String>) outcome;
        assertThat(failed.kind()).isEqualTo(StageErrorKind.MAX_RETRIES_EXCEEDED);
        assertThat(failed.lastAttemptKind()).isEqualTo(StageErrorKind.TIMEOUT);
        // Both late attempts were interrupted, not left running.
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void run_callerInterrupted_failsAsCancelledWithoutFurtherAttempts() throws Exception {
        StageRunner runner = runner(3);
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<StageOutcome<String>> result = new AtomicReference<>();
        CountDownLatch attemptStarted = new CountDownLatch(1);

        Thread caller = new Thread(() -> result.set(runner.run(() -> {
            calls.incrementAndGet();
            attemptStarted.countDown();
            Thread.sleep(5_000);
            return "never";
        })));
        caller.start();
        assertThat(attemptStarted.await(1, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2_000);

        assertThat(((StageOutcome.Failed<String>) result.get()).kind()).isEqualTo(StageErrorKind.CANCELLED);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(runner.status().state()).isEqualTo(StageState.FAILED);
    }

    // ------------------------------------------------------------------
    // Status lifecycle and metrics
    // ------------------------------------------------------------------

    @Test
    void status_beforeRunAndAfterReset_isPending() {
        StageRunner runner = runner(1);
        assertThat(runner.status()).isEqualTo(ExecutionStatus.pending("analysis"));

        runner.run(() -> "ok");
        runner.reset();

        assertThat(runner.status().state()).isEqualTo(StageState.PENDING);
        assertThat(runner.status().startedAt()).isNull();
    }

    @Test
    void run_secondRun_startsFromFreshStatus() {
        StageRunner runner = runner(2);
        runner.run(() -> { throw new StageException(StageException.Kind.OPERATION_ERROR, "x"); });
        assertThat(runner.status().retryCount()).isEqualTo(2);

        runner.run(() -> "ok");

        assertThat(runner.status().state()).isEqualTo(StageState.COMPLETED);
        assertThat(runner.status().retryCount()).isZero();
    }

    @Test
    void run_recordsAttemptCountersByOutcome() {
        StageRunner runner = runner(3);
        AtomicInteger calls = new AtomicInteger();

        runner.run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new StageException(StageException.Kind.OPERATION_ERROR, "flaky");
            }
            return "ok";
        });

        assertThat(meters.counter("dealflow.stage.attempts",
                "stage", "analysis", "outcome", "operation_error").count()).isEqualTo(1.0);
        assertThat(meters.counter("dealflow.stage.attempts",
                "stage", "analysis", "outcome", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("dealflow.stage.duration",
                "stage", "analysis", "status", "completed").count()).isEqualTo(1);
    }

    @Test
    void run_turkishDefaultLocale_counterTagsStayAscii() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr"));
        try {
            runner(1).run(() -> { throw new StageException(StageException.Kind.OPERATION_ERROR, "flaky"); });
        } finally {
            Locale.setDefault(original);
        }

        assertThat(meters.counter("dealflow.stage.attempts",
                "stage", "analysis", "outcome", "operation_error").count()).isEqualTo(1.0);
    }

    @Test
    void run_executorRejectsAttempt_failsAsUnexpectedWithTerminalStatus() {
        executor.shutdownNow();
        StageRunner runner = runner(3);

        StageOutcome<String> outcome = runner.run(() -> "never runs");

        assertThat(outcome).isInstanceOf(StageOutcome.Failed.class);
        StageOutcome.Failed<String> failed = (StageOutcome.Failed<String>) outcome;
        assertThat(failed.kind()).isEqualTo(StageErrorKind.UNEXPECTED);
        assertThat(failed.message()).contains("could not be scheduled");
        assertThat(runner.status().state()).isEqualTo(StageState.FAILED);
        assertThat(runner.status().completedAt()).isNotNull();
        assertThat(meters.counter("dealflow.stage.attempts",
                "stage", "analysis", "outcome", "unexpected").count()).isEqualTo(1.0);
    }
}
