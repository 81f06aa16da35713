package com.dealflow.orchestrator.stage;

import com.dealflow.orchestrator.model.ExecutionStatus;
import com.dealflow.orchestrator.model.StageState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage operation with a per-attempt deadline, bounded retries and
 * exponential backoff, tracking an {@link ExecutionStatus} throughout.
 *
 * Each attempt is submitted to the shared stage executor and awaited with
 * {@code Future.get(timeout)}; a late attempt is cancelled (interrupted) and
 * counts as one TIMEOUT failure. Between attempts the calling thread sleeps
 * {@code backoffBase * 2^attempt}.
 *
 * The runner never substitutes a fallback. Exhaustion comes back as
 * {@link StageOutcome.Failed} and the caller decides what to do with it.
 *
 * Metrics:
 * <pre>
 *   dealflow.stage.attempts{stage, outcome="success|timeout|operation_error|unexpected|non_retryable|cancelled"}
 *   dealflow.stage.duration{stage, status="completed|failed"}
 * </pre>
 *
 * One runner tracks one stage; {@link #status()} may be read from any thread.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final String          stageName;
    private final ExecutorService executor;
    private final RetrySettings   settings;
    private final MeterRegistry   meterRegistry;

    private ExecutionStatus status;

    public StageRunner(String stageName,
                       ExecutorService executor,
                       RetrySettings settings,
                       MeterRegistry meterRegistry) {
        this.stageName     = stageName;
        this.executor      = executor;
        this.settings      = settings;
        this.meterRegistry = meterRegistry;
        this.status        = ExecutionStatus.pending(stageName);
    }

    public String stageName() { return stageName; }

    public synchronized ExecutionStatus status() {
        return status;
    }

    /** Returns a reused runner to PENDING. */
    public synchronized void reset() {
        status = ExecutionStatus.pending(stageName);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public <T> StageOutcome<T> run(Callable<T> operation) {
        update(new ExecutionStatus(stageName, StageState.RUNNING, Instant.now(), null, 0, null));
        log.info("[{}] Starting execution", stageName);

        Timer.Sample sample = Timer.start(meterRegistry);
        StageOutcome<T> outcome = attemptAll(operation);
        sample.stop(meterRegistry.timer("dealflow.stage.duration",
                "stage", stageName,
                "status", outcome.isCompleted() ? "completed" : "failed"));
        return outcome;
    }

    private <T> StageOutcome<T> attemptAll(Callable<T> operation) {
        StageErrorKind lastKind    = null;
        String         lastMessage = null;
        int            maxRetries  = settings.maxRetries();

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Future<T> future;
            try {
                future = executor.submit(MdcPropagation.wrap("stage", stageName, operation));
            } catch (RejectedExecutionException e) {
                countAttempt("unexpected");
                log.error("[{}] Attempt {}/{} could not be scheduled", stageName, attempt, maxRetries, e);
                return fail(StageErrorKind.UNEXPECTED, StageErrorKind.UNEXPECTED,
                        stageName + " could not be scheduled: " + e.getMessage());
            }
            try {
                T value = future.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
                countAttempt("success");
                Instant done = Instant.now();
                update(status().completed(done));
                log.info("[{}] Completed successfully in {}s",
                        stageName, String.format("%.2f", status().durationSeconds()));
                return new StageOutcome.Completed<>(value);

            } catch (TimeoutException e) {
                future.cancel(true);
                lastKind    = StageErrorKind.TIMEOUT;
                lastMessage = stageName + " timed out after " + settings.timeout().toSeconds() + "s";
                log.warn("[{}] Timeout on attempt {}/{}", stageName, attempt, maxRetries);

            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                countAttempt("cancelled");
                return fail(StageErrorKind.CANCELLED, StageErrorKind.CANCELLED,
                        stageName + " was cancelled");

            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastKind    = classify(cause);
                lastMessage = String.valueOf(cause.getMessage());

                if (lastKind == StageErrorKind.NON_RETRYABLE) {
                    update(status().withRetryCount(attempt));
                    countAttempt("non_retryable");
                    log.warn("[{}] Non-retryable error on attempt {}/{}: {}",
                            stageName, attempt, maxRetries, lastMessage);
                    return fail(StageErrorKind.NON_RETRYABLE, lastKind, lastMessage);
                }
                if (lastKind == StageErrorKind.OPERATION_ERROR) {
                    log.warn("[{}] Operation error on attempt {}/{}: {}",
                            stageName, attempt, maxRetries, lastMessage);
                } else {
                    log.error("[{}] Unexpected error on attempt {}/{}",
                            stageName, attempt, maxRetries, cause);
                }
            }

            countAttempt(lastKind.name().toLowerCase(Locale.ROOT));
            update(status().withRetryCount(attempt));

            if (attempt < maxRetries) {
                update(status().withState(StageState.RETRYING));
                Duration delay = settings.backoffAfter(attempt);
                log.info("[{}] Retrying in {}ms...", stageName, delay.toMillis());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(StageErrorKind.CANCELLED, lastKind,
                            stageName + " was cancelled during backoff");
                }
                update(status().withState(StageState.RUNNING));
            }
        }

        log.error("[{}] Failed after {} attempts: {}", stageName, maxRetries, lastMessage);
        return fail(StageErrorKind.MAX_RETRIES_EXCEEDED, lastKind, lastMessage);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static StageErrorKind classify(Throwable cause) {
        if (cause instanceof StageException se) {
            return se.getKind() == StageException.Kind.NON_RETRYABLE
                    ? StageErrorKind.NON_RETRYABLE
                    : StageErrorKind.OPERATION_ERROR;
        }
        return StageErrorKind.UNEXPECTED;
    }

    private <T> StageOutcome<T> fail(StageErrorKind kind, StageErrorKind lastKind, String message) {
        update(status().failed(Instant.now(), message));
        return new StageOutcome.Failed<>(kind, lastKind, message);
    }

    private void countAttempt(String outcome) {
        meterRegistry.counter("dealflow.stage.attempts",
                "stage", stageName, "outcome", outcome).increment();
    }

    private synchronized void update(ExecutionStatus next) {
        this.status = next;
    }
}
