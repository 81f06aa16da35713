package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.fallback.FallbackSynthesizer;
import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.model.CompositeReport;
import com.dealflow.orchestrator.model.ExecutionStatus;
import com.dealflow.orchestrator.model.PipelineInput;
import com.dealflow.orchestrator.model.PipelineState;
import com.dealflow.orchestrator.model.ProgressSnapshot;
import com.dealflow.orchestrator.model.StageResult;
import com.dealflow.orchestrator.model.StageState;
import com.dealflow.orchestrator.model.Synthesis;
import com.dealflow.orchestrator.stage.FanOutInput;
import com.dealflow.orchestrator.stage.FanOutStage;
import com.dealflow.orchestrator.stage.MdcPropagation;
import com.dealflow.orchestrator.stage.RetrySettings;
import com.dealflow.orchestrator.stage.StageErrorKind;
import com.dealflow.orchestrator.stage.StageOutcome;
import com.dealflow.orchestrator.stage.StageRunner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one pipeline run: the foundational stage, then every fan-out stage in
 * parallel, then synthesis into a {@link CompositeReport}.
 *
 * <pre>
 *   IDLE → RUNNING_FOUNDATIONAL → RUNNING_FAN_OUT → SYNTHESIZING → DONE
 *                 │                                          (any) │
 *                 └──────────────────→ ABORTED ←─────────────────┘
 * </pre>
 *
 * Failure policy:
 *   - foundational stage fails → ABORTED, {@link PipelineException.Kind#ABORTED}, fan-out never starts
 *   - a fan-out stage fails    → optional enrichment retry, then its slot becomes a fallback
 *   - outer deadline passes    → every running stage is cancelled, {@link PipelineException.Kind#TIMEOUT}
 *
 * One instance serves exactly one run; build a fresh one per run with
 * {@link PipelineOrchestratorFactory}. Progress is pushed to observers after
 * each phase transition and kept in an ordered log.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final String PHASE_FOUNDATIONAL = "foundational";
    public static final String PHASE_FAN_OUT      = "fanout";
    public static final String PHASE_SYNTHESIS    = "synthesis";
    public static final String PHASE_COMPLETE     = "complete";

    private final PipelineDefinition  definition;
    private final PipelineSettings    settings;
    private final ExecutorService     executor;
    private final FallbackSynthesizer fallbacks;
    private final ReportSynthesizer   synthesizer;
    private final MeterRegistry       meterRegistry;

    private final String                   runId     = UUID.randomUUID().toString();
    private final List<ProgressObserver>   observers = new CopyOnWriteArrayList<>();
    private final ProgressLog              progress  = new ProgressLog();
    private final AtomicBoolean            started   = new AtomicBoolean(false);
    private final Map<String, StageRunner> runners   = new LinkedHashMap<>();

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile Instant       startedAt;

    public PipelineOrchestrator(PipelineDefinition definition,
                                PipelineSettings settings,
                                ExecutorService executor,
                                FallbackSynthesizer fallbacks,
                                ReportSynthesizer synthesizer,
                                MeterRegistry meterRegistry) {
        this.definition    = definition;
        this.settings      = settings;
        this.executor      = executor;
        this.fallbacks     = fallbacks;
        this.synthesizer   = synthesizer;
        this.meterRegistry = meterRegistry;

        RetrySettings retry = settings.stageRetry();
        runners.put(definition.foundational().name(),
                new StageRunner(definition.foundational().name(), executor, retry, meterRegistry));
        for (FanOutStage stage : definition.fanOut()) {
            runners.put(stage.name(), new StageRunner(stage.name(), executor, retry, meterRegistry));
        }
    }

    // ------------------------------------------------------------------
    // Public surface
    // ------------------------------------------------------------------

    public String runId() { return runId; }

    public PipelineState state() { return state; }

    /** Registers an observer; observers are notified in registration order. */
    public void onProgress(ProgressObserver observer) {
        observers.add(observer);
    }

    /** Latest snapshot, empty before the run emits anything. */
    public Optional<ProgressSnapshot> status() {
        return progress.latest();
    }

    public List<ProgressSnapshot> progressLog() {
        return progress.snapshot();
    }

    public CompositeReport run(PipelineInput input) {
        return run(input, settings.overallTimeout());
    }

    /**
     * Runs the whole pipeline under one outer deadline.
     *
     * @throws PipelineException    on foundational failure or when the deadline passes
     * @throws IllegalStateException if this instance has already been run
     */
    public CompositeReport run(PipelineInput input, Duration overallTimeout) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline run " + runId + " has already been started");
        }
        startedAt = Instant.now();
        log.info("Pipeline run {} starting (timeout={}s)", runId, overallTimeout.toSeconds());

        Future<CompositeReport> body = executor.submit(
                MdcPropagation.wrap("runId", runId, () -> execute(input)));
        try {
            CompositeReport report = body.get(overallTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Pipeline run {} complete in {}s", runId,
                    String.format("%.1f", report.processingTimeSeconds()));
            return report;

        } catch (TimeoutException e) {
            abort();
            body.cancel(true);
            log.error("Pipeline run {} timed out after {}ms", runId, overallTimeout.toMillis());
            throw new PipelineException(PipelineException.Kind.TIMEOUT,
                    "Analysis pipeline timed out after " + overallTimeout.toMillis() + "ms");

        } catch (InterruptedException e) {
            abort();
            body.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineException(PipelineException.Kind.ABORTED, "Pipeline run was interrupted", e);

        } catch (ExecutionException e) {
            abort();
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            log.error("Pipeline run {} failed unexpectedly", runId, cause);
            throw new PipelineException(PipelineException.Kind.ABORTED,
                    "Pipeline failed unexpectedly: " + cause.getMessage(), cause);
        }
    }

    // ------------------------------------------------------------------
    // Pipeline body (runs on the stage executor)
    // ------------------------------------------------------------------

    private CompositeReport execute(PipelineInput input) throws InterruptedException {
        String foundationalName = definition.foundational().name();

        // Phase 1: foundational stage, alone, no fallback
        transition(PipelineState.RUNNING_FOUNDATIONAL);
        emit(PHASE_FOUNDATIONAL, 5, "Starting " + foundationalName + "...");

        StageOutcome<Fragment> foundationOutcome = runners.get(foundationalName)
                .run(() -> definition.foundational().execute(input));

        if (foundationOutcome instanceof StageOutcome.Failed<Fragment> failed) {
            abort();
            log.error("Foundational stage '{}' failed ({}), aborting run {}",
                    foundationalName, failed.kind(), runId);
            throw new PipelineException(PipelineException.Kind.ABORTED,
                    foundationalName + " failed: " + failed.message());
        }
        Fragment foundation = ((StageOutcome.Completed<Fragment>) foundationOutcome).value();
        StageResult foundationalResult = new StageResult.Success(foundation);
        String companyName = ReportSynthesizer.companyName(foundation);

        emit(PHASE_FOUNDATIONAL, 30, "Extracted data for " + companyName);

        // Phase 2: fan-out
        transition(PipelineState.RUNNING_FAN_OUT);
        emit(PHASE_FAN_OUT, 35, "Running " + definition.fanOut().size() + " stages in parallel...");

        Map<String, StageOutcome<Fragment>> outcomes = runFanOut(FanOutInput.of(foundation));
        applyEnrichment(foundation, outcomes);

        Map<String, StageResult> fanOut = new LinkedHashMap<>();
        outcomes.forEach((name, outcome) -> fanOut.put(name, toResult(name, outcome, foundation)));

        // Phase 3: synthesis
        transition(PipelineState.SYNTHESIZING);
        emit(PHASE_SYNTHESIS, 85, "Synthesizing results into report...");

        Synthesis synthesis = synthesizer.synthesize(foundationalResult, fanOut);
        Instant completedAt = Instant.now();
        CompositeReport report = new CompositeReport(
                companyName,
                foundationalResult,
                fanOut,
                synthesis,
                stageStatuses(),
                StageState.COMPLETED,
                startedAt,
                completedAt,
                Duration.between(startedAt, completedAt).toMillis() / 1000.0);

        transition(PipelineState.DONE);
        emit(PHASE_COMPLETE, 100, "Analysis complete");
        return report;
    }

    private Map<String, StageOutcome<Fragment>> runFanOut(FanOutInput shared) throws InterruptedException {
        Map<String, Future<StageOutcome<Fragment>>> futures = new LinkedHashMap<>();
        for (FanOutStage stage : definition.fanOut()) {
            StageRunner runner = runners.get(stage.name());
            futures.put(stage.name(), executor.submit(MdcPropagation.wrap(() -> {
                log.info("Starting fan-out stage '{}'", stage.name());
                return runner.run(() -> stage.execute(shared));
            })));
        }

        Map<String, StageOutcome<Fragment>> outcomes = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Future<StageOutcome<Fragment>>> e : futures.entrySet()) {
                outcomes.put(e.getKey(), await(e.getKey(), e.getValue()));
            }
        } catch (InterruptedException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        }
        return outcomes;
    }

    private StageOutcome<Fragment> await(String stageName, Future<StageOutcome<Fragment>> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // StageRunner returns failures as values; reaching here means the runner itself broke.
            log.error("Stage task '{}' crashed", stageName, e.getCause());
            return new StageOutcome.Failed<>(
                    StageErrorKind.UNEXPECTED,
                    StageErrorKind.UNEXPECTED,
                    String.valueOf(e.getCause()));
        }
    }

    /**
     * One extra attempt for the enrichment target, with the source's genuine
     * result as additional input. Runs outside the target's own retry budget.
     */
    private void applyEnrichment(Fragment foundation, Map<String, StageOutcome<Fragment>> outcomes) {
        Optional<EnrichmentRule> rule = definition.enrichmentRule();
        if (rule.isEmpty()) {
            return;
        }
        String target = rule.get().target();
        String source = rule.get().source();

        StageOutcome<Fragment> targetOutcome = outcomes.get(target);
        StageOutcome<Fragment> sourceOutcome = outcomes.get(source);
        if (targetOutcome == null || targetOutcome.isCompleted()) {
            return;
        }
        if (!(sourceOutcome instanceof StageOutcome.Completed<Fragment> completedSource)) {
            log.info("Skipping enrichment of '{}': source '{}' has no genuine result", target, source);
            return;
        }

        FanOutStage stage = definition.fanOut().stream()
                .filter(s -> s.name().equals(target))
                .findFirst()
                .orElseThrow();

        String enrichedName = target + ":enriched";
        StageRunner runner = new StageRunner(enrichedName, executor,
                RetrySettings.singleAttempt(settings.stageRetry().timeout()), meterRegistry);
        synchronized (runners) {
            runners.put(enrichedName, runner);
        }

        log.info("Retrying '{}' with '{}' data...", target, source);
        emit(PHASE_FAN_OUT, 80, "Retrying " + target + " with " + source + " data...");

        FanOutInput enriched = new FanOutInput(foundation, completedSource.value());
        StageOutcome<Fragment> retried = runner.run(() -> stage.execute(enriched));
        if (retried.isCompleted()) {
            outcomes.put(target, retried);
        } else {
            log.error("Enriched retry of '{}' failed: {}", target,
                    ((StageOutcome.Failed<Fragment>) retried).message());
        }
    }

    private StageResult toResult(String stageName, StageOutcome<Fragment> outcome, Fragment foundation) {
        if (outcome instanceof StageOutcome.Completed<Fragment> completed) {
            return new StageResult.Success(completed.value());
        }
        StageOutcome.Failed<Fragment> failed = (StageOutcome.Failed<Fragment>) outcome;
        log.warn("Stage '{}' failed ({}), using fallback: {}", stageName, failed.kind(), failed.message());
        meterRegistry.counter("dealflow.pipeline.fallbacks", "stage", stageName).increment();
        return new StageResult.Fallback(fallbacks.synthesize(stageName, foundation), failed.message());
    }

    // ------------------------------------------------------------------
    // State and progress
    // ------------------------------------------------------------------

    private synchronized void transition(PipelineState next) throws InterruptedException {
        if (state == PipelineState.ABORTED || Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Pipeline run " + runId + " was aborted");
        }
        state = next;
    }

    private synchronized void abort() {
        state = PipelineState.ABORTED;
    }

    private List<ExecutionStatus> stageStatuses() {
        synchronized (runners) {
            List<ExecutionStatus> statuses = new ArrayList<>(runners.size());
            runners.values().forEach(r -> statuses.add(r.status()));
            return statuses;
        }
    }

    /**
     * Appends and publishes a snapshot. Runs under the same monitor as
     * {@link #abort()}, so nothing is delivered once a run has been aborted.
     */
    private void emit(String phase, double percentage, String message) {
        synchronized (this) {
            if (state == PipelineState.ABORTED) {
                return;
            }
            Instant now = Instant.now();
            ProgressSnapshot snapshot = progress.append(new ProgressSnapshot(
                    phase,
                    percentage,
                    message,
                    stageStatuses(),
                    startedAt,
                    estimateCompletion(now, percentage),
                    state));

            log.info("[{}] {}% - {}", phase, (int) snapshot.percentage(), message);
            for (ProgressObserver observer : observers) {
                try {
                    observer.onProgress(snapshot);
                } catch (Exception e) {
                    log.warn("Progress observer failed for run {}: {}", runId, e.getMessage(), e);
                }
            }
        }
    }

    private Instant estimateCompletion(Instant now, double percentage) {
        if (percentage <= 0 || startedAt == null) {
            return null;
        }
        long elapsedMs   = Duration.between(startedAt, now).toMillis();
        long estimatedMs = (long) (elapsedMs / (percentage / 100.0));
        return startedAt.plusMillis(estimatedMs);
    }
}
