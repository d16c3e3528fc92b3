package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livepipe.realtime.model.Dataset;
import com.livepipe.realtime.model.ExecutionStatus;
import com.livepipe.realtime.model.PipelineConfig;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.model.StepType;
import com.livepipe.realtime.repository.DatasetCatalog;
import com.livepipe.realtime.repository.ExecutionHistoryRepository;
import com.livepipe.realtime.scheduling.Backoff;
import com.livepipe.realtime.scheduling.TimerHandle;
import com.livepipe.realtime.scheduling.TimerService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the extract → load → transform pipeline over a sample dataset.
 *
 * Execution model:
 *   - {@link #executePipeline} validates, creates the execution (status =
 *     RUNNING), starts the first step and returns immediately.
 *   - Each step attempt is three timers on the shared scheduler: a progress
 *     ticker (+5 every duration/20, capped at 95), the body completion after
 *     the step's estimated duration, and the hard timeout. Whichever of the
 *     last two fires first decides the attempt.
 *   - A failed attempt is retried after retry-base-delay × 2^(n−1) until the
 *     config's total attempts are used up; then the step fails and the
 *     execution aborts. Malformed upstream input fails the step at once.
 *   - Every terminal transition appends a snapshot to history, so a failed
 *     run keeps its record after recovery re-enters it.
 *
 * All state is guarded by this object's monitor, including the fields of
 * the live execution and its steps. Callers on other threads read them
 * through {@link #inspect} or {@link #snapshot}. Timer callbacks carry the
 * {@link StepRun} they belong to and do nothing once that run is no longer
 * the active one or the execution has left RUNNING, so a cancelled
 * execution is never mutated afterwards.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    static final int PROGRESS_INCREMENT = 5;
    static final int PROGRESS_CEILING   = 95;
    static final int TICKS_PER_STEP     = 20;
    static final int MAX_RETRY_SHIFT    = 20;

    private final DatasetCatalog                 catalog;
    private final ExecutionHistoryRepository     history;
    private final Map<StepType, StepProcessor>   processors;
    private final FailurePolicy                  failurePolicy;
    private final TimerService                   timers;
    private final PipelineProperties             props;
    private final MeterRegistry                  meterRegistry;
    private final ObjectMapper                   objectMapper;
    private final List<ExecutionListener>        listeners;
    private final Backoff                        retryBackoff;

    // ---- guarded by this ----
    private PipelineExecution current;
    private boolean           executing;
    private StepRun           activeRun;
    private long              sequence;

    public PipelineEngine(DatasetCatalog catalog,
                          ExecutionHistoryRepository history,
                          List<StepProcessor> processors,
                          FailurePolicy failurePolicy,
                          TimerService timers,
                          PipelineProperties props,
                          MeterRegistry meterRegistry,
                          ObjectMapper objectMapper,
                          List<ExecutionListener> listeners) {
        this.catalog       = catalog;
        this.history       = history;
        this.failurePolicy = failurePolicy;
        this.timers        = timers;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.objectMapper  = objectMapper;
        this.listeners     = List.copyOf(listeners);
        // Attempts are few; the cap only guards against overflow.
        this.retryBackoff  = Backoff.exponential(props.retryBaseDelay(),
                props.retryBaseDelay().multipliedBy(1L << MAX_RETRY_SHIFT));

        this.processors = new EnumMap<>(StepType.class);
        for (StepProcessor processor : processors) {
            this.processors.put(processor.type(), processor);
        }
        for (StepType type : StepType.values()) {
            if (!this.processors.containsKey(type)) {
                throw new IllegalArgumentException("No StepProcessor registered for " + type);
            }
        }
    }

    // ------------------------------------------------------------------
    // Starting and stopping
    // ------------------------------------------------------------------

    public PipelineExecution executePipeline(String datasetId) {
        return executePipeline(datasetId, null);
    }

    /** Start with the configured defaults, overlaid by whichever override is non-null. */
    public PipelineExecution executePipeline(String datasetId, Duration timeout, Integer retryAttempts) {
        return executePipeline(datasetId, props.defaultConfig().merge(timeout, retryAttempts));
    }

    /**
     * Start a new execution over {@code datasetId}.
     *
     * @param config effective config, or null for the configured defaults
     * @throws PipelineRejectedException NOT_FOUND for an unknown dataset,
     *         INVALID_INPUT for an unusable dataset or config, CONFLICT while
     *         another execution is running. Nothing is created in any case.
     */
    public synchronized PipelineExecution executePipeline(String datasetId, PipelineConfig config) {
        if (datasetId == null || datasetId.isBlank()) {
            throw new PipelineRejectedException(PipelineRejectedException.Kind.INVALID_INPUT,
                    "datasetId is required");
        }
        Dataset dataset = catalog.findById(datasetId).orElseThrow(() ->
                new PipelineRejectedException(PipelineRejectedException.Kind.NOT_FOUND,
                        "Dataset with id '" + datasetId + "' not found. Available datasets: "
                                + catalog.findAll().stream().map(Dataset::id).collect(Collectors.joining(", "))));

        List<String> problems = DatasetValidator.validate(dataset);
        if (!problems.isEmpty()) {
            throw new PipelineRejectedException(PipelineRejectedException.Kind.INVALID_INPUT,
                    "Selected dataset contains no valid sample data: " + String.join("; ", problems));
        }
        PipelineConfig effective = config != null ? config : props.defaultConfig();
        if (!effective.isValid()) {
            throw new PipelineRejectedException(PipelineRejectedException.Kind.INVALID_INPUT,
                    "Invalid pipeline config: timeout must be positive and retryAttempts at least 1");
        }
        if (executing) {
            throw new PipelineRejectedException(PipelineRejectedException.Kind.CONFLICT,
                    "Pipeline is already executing. Please wait for completion or cancel the current execution.");
        }

        PipelineExecution execution = new PipelineExecution(nextId(), dataset, effective, timers.now());
        execution.markRunning();
        current   = execution;
        executing = true;

        log.info("Execution {} started on dataset '{}' (timeout={}ms, attempts={})",
                execution.getId(), dataset.id(), effective.timeout().toMillis(), effective.retryAttempts());
        notifyListeners(l -> l.executionStarted(execution));

        startStep(execution, 0, effective.retryAttempts());
        return execution;
    }

    /**
     * Cancel the running execution.
     *
     * Status becomes CANCELLED and endTime is set at once; pending timers are
     * cancelled and any callback that still fires is ignored.
     *
     * @return the cancelled execution, empty if nothing was running
     */
    public synchronized Optional<PipelineExecution> cancelExecution() {
        if (!executing || current == null || current.getStatus() != ExecutionStatus.RUNNING) {
            return Optional.empty();
        }
        PipelineExecution execution = current;
        if (activeRun != null) {
            activeRun.cancelTimers();
            activeRun = null;
        }
        execution.markCancelled(timers.now());
        log.info("Execution {} cancelled", execution.getId());
        finish(execution);
        return Optional.of(execution);
    }

    /**
     * Re-enter a failed execution in place, one attempt per remaining step.
     *
     * {@code prepareFailedStep} runs on the failed step under the engine's
     * monitor before anything is scheduled. With {@code rerunFailedStep}
     * the failed step runs again on its recorded input; otherwise execution
     * continues with the step after it.
     *
     * @throws PipelineRejectedException CONFLICT while an execution is running
     * @throws IllegalStateException if {@code execution} is not failed on a step
     */
    public synchronized PipelineExecution resume(PipelineExecution execution,
                                                 Consumer<PipelineStep> prepareFailedStep,
                                                 boolean rerunFailedStep) {
        if (executing) {
            throw new PipelineRejectedException(PipelineRejectedException.Kind.CONFLICT,
                    "Pipeline is already executing");
        }
        if (execution.getStatus() != ExecutionStatus.FAILED) {
            throw new IllegalStateException("Execution " + execution.getId() + " is not failed");
        }
        PipelineStep failed = execution.failedStep().orElseThrow(() ->
                new IllegalStateException("Execution " + execution.getId() + " has no failed step"));
        int index = execution.indexOf(failed);

        prepareFailedStep.accept(failed);
        execution.markRunning();
        current   = execution;
        executing = true;

        log.info("Execution {} resumed at step {} ({})", execution.getId(),
                rerunFailedStep ? failed.getId() : "after " + failed.getId(),
                rerunFailedStep ? "retry" : "skip");
        notifyListeners(l -> l.executionStarted(execution));
        if (!rerunFailedStep) {
            notifyListeners(l -> l.stepCompleted(execution, failed));
        }

        startStep(execution, rerunFailedStep ? index : index + 1, 1);
        return execution;
    }

    // ------------------------------------------------------------------
    // Derived state
    // ------------------------------------------------------------------

    public synchronized Optional<PipelineExecution> currentExecution() {
        return Optional.ofNullable(current);
    }

    public synchronized boolean isExecuting() {
        return executing;
    }

    /** First running or pending step of the current execution. */
    public synchronized Optional<PipelineStep> currentStep() {
        return current == null ? Optional.empty() : current.currentStep();
    }

    /** Completed steps of the current execution as a percentage, 0 without one. */
    public synchronized int executionProgress() {
        return current == null ? 0 : current.progressPercent();
    }

    /** Snapshots of terminal executions, oldest first. */
    public List<PipelineExecution> executionHistory() {
        return history.findAll();
    }

    public Optional<PipelineExecution> lastExecution() {
        return history.findLast();
    }

    /** The live current execution, or the latest history snapshot for {@code id}. */
    public synchronized Optional<PipelineExecution> findExecution(String id) {
        if (current != null && current.getId().equals(id)) {
            return Optional.of(current);
        }
        return history.findById(id);
    }

    /**
     * Apply {@code view} to {@code execution} under this engine's monitor.
     * The view never observes a transition halfway, e.g. a completed step
     * whose progress is not yet 100.
     */
    public synchronized <T> T inspect(PipelineExecution execution, Function<PipelineExecution, T> view) {
        return view.apply(execution);
    }

    /** {@link #findExecution} and {@link #inspect} in one step. */
    public synchronized <T> Optional<T> snapshot(String id, Function<PipelineExecution, T> view) {
        return findExecution(id).map(view);
    }

    public void clearHistory() {
        history.clear();
        log.info("Execution history cleared");
    }

    public List<Dataset> datasets() {
        return catalog.findAll();
    }

    // ------------------------------------------------------------------
    // Step lifecycle (monitor held)
    // ------------------------------------------------------------------

    private void startStep(PipelineExecution execution, int index, int maxAttempts) {
        List<PipelineStep> steps = execution.getSteps();
        if (index >= steps.size()) {
            completeExecution(execution);
            return;
        }
        PipelineStep step = steps.get(index);
        JsonNode input = inputFor(execution, index);
        StepProcessor processor = processors.get(step.getType());

        try {
            putMdc(execution, step);
            processor.validateInput(input);
        } catch (StepInputException e) {
            step.fail(input, e.getMessage(), timers.now());
            log.error("Step {} rejected its input: {}", step.getId(), e.getMessage());
            meterRegistry.counter("livepipe.pipeline.step.rejected", "step", step.getType().wireName()).increment();
            notifyListeners(l -> l.stepFailed(execution, step));
            abort(execution, e.getMessage());
            return;
        } finally {
            clearMdc();
        }
        runAttempt(execution, index, input, maxAttempts);
    }

    private void runAttempt(PipelineExecution execution, int index, JsonNode input, int maxAttempts) {
        PipelineStep step = execution.getSteps().get(index);
        step.markRunning(input, timers.now());

        StepRun run = new StepRun(execution, index, input, maxAttempts, Timer.start(meterRegistry));
        activeRun = run;

        try {
            putMdc(execution, step);
            log.info("Step {} started (attempt {}/{})", step.getId(), step.getAttempt(), maxAttempts);
            notifyListeners(l -> l.stepStarted(execution, step));
        } finally {
            clearMdc();
        }

        Duration duration = step.getType().estimatedDuration();
        Duration tick     = duration.dividedBy(TICKS_PER_STEP);
        run.ticker     = timers.scheduleAtFixedRate(() -> onTick(run), tick, tick);
        run.deadline   = timers.schedule(() -> onTimeout(run), execution.getConfig().timeout());
        run.completion = timers.schedule(() -> onBodyFinished(run), duration);
    }

    private synchronized void onTick(StepRun run) {
        if (!isLive(run)) {
            return;
        }
        PipelineStep step = run.step();
        step.advanceProgress(PROGRESS_INCREMENT, PROGRESS_CEILING);
        notifyListeners(l -> l.stepProgress(run.execution, step));
    }

    private synchronized void onTimeout(StepRun run) {
        if (!isLive(run)) {
            return;
        }
        run.cancelTimers();
        attemptFailed(run, new StepTimeoutException(run.step().getName(), run.execution.getConfig().timeout()));
    }

    private synchronized void onBodyFinished(StepRun run) {
        if (!isLive(run)) {
            return;
        }
        run.cancelTimers();
        PipelineStep step = run.step();

        JsonNode output;
        try {
            putMdc(run.execution, step);
            if (failurePolicy.shouldFail(step.getType(), step.getAttempt())) {
                throw new StepException("Simulated failure in " + step.getName() + " step");
            }
            output = processors.get(step.getType()).process(run.input, timers.now());
        } catch (StepException e) {
            attemptFailed(run, e);
            return;
        } catch (RuntimeException e) {
            log.error("Step {} threw unexpectedly", step.getId(), e);
            attemptFailed(run, new StepException("Step execution failed: " + e.getMessage(), e));
            return;
        } finally {
            clearMdc();
        }

        step.complete(output, timers.now());
        activeRun = null;
        run.sample.stop(meterRegistry.timer("livepipe.pipeline.step.duration",
                "step", step.getType().wireName(), "status", "completed"));
        log.info("Step {} completed in {} ms", step.getId(), step.duration().toMillis());
        notifyListeners(l -> l.stepCompleted(run.execution, step));

        startStep(run.execution, run.index + 1, run.maxAttempts);
    }

    private synchronized void onRetryDue(StepRun run) {
        if (!isLive(run)) {
            return;
        }
        run.retry = null;
        runAttempt(run.execution, run.index, run.input, run.maxAttempts);
    }

    private void attemptFailed(StepRun run, StepException error) {
        PipelineStep step = run.step();
        int attempt = step.getAttempt();
        run.sample.stop(meterRegistry.timer("livepipe.pipeline.step.duration",
                "step", step.getType().wireName(), "status", "failed"));

        try {
            putMdc(run.execution, step);
            if (error.isRetryable() && attempt < run.maxAttempts) {
                Duration delay = retryDelay(attempt);
                step.awaitRetry("Retry " + attempt + "/" + (run.maxAttempts - 1) + ": " + error.getMessage());
                meterRegistry.counter("livepipe.pipeline.step.retries", "step", step.getType().wireName()).increment();
                log.warn("Step {} failed (attempt {}/{}), retrying in {} ms. Reason: {}",
                        step.getId(), attempt, run.maxAttempts, delay.toMillis(), error.getMessage());
                run.retry = timers.schedule(() -> onRetryDue(run), delay);
                notifyListeners(l -> l.stepRetrying(run.execution, step, delay));
                return;
            }

            String message = error.isRetryable()
                    ? "Step failed after " + attempt + " attempts: " + error.getMessage()
                    : error.getMessage();
            step.fail(run.input, message, timers.now());
            activeRun = null;
            log.error("Step {} permanently failed: {}", step.getId(), message);
            notifyListeners(l -> l.stepFailed(run.execution, step));
            abort(run.execution, message);
        } finally {
            clearMdc();
        }
    }

    // ------------------------------------------------------------------
    // Execution transitions (monitor held)
    // ------------------------------------------------------------------

    private void completeExecution(PipelineExecution execution) {
        List<PipelineStep> steps = execution.getSteps();
        execution.markCompleted(steps.get(steps.size() - 1).getOutputData(), timers.now());
        log.info("Execution {} completed in {} ms", execution.getId(), execution.getExecutionTimeMs());
        finish(execution);
    }

    private void abort(PipelineExecution execution, String message) {
        execution.markFailed(message, timers.now());
        log.error("Execution {} failed: {}", execution.getId(), message);
        finish(execution);
    }

    private void finish(PipelineExecution execution) {
        if (current == execution) {
            executing = false;
        }
        activeRun = null;
        history.append(execution.snapshot());
        meterRegistry.counter("livepipe.pipeline.executions", "status", execution.getStatus().wireName()).increment();

        if (log.isDebugEnabled()) {
            List<String> violations = ExecutionInvariants.check(execution);
            if (!violations.isEmpty()) {
                log.debug("Execution {} ended with inconsistencies: {}", execution.getId(), violations);
            }
        }
        notifyListeners(l -> l.executionFinished(execution));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The dataset's records for step 0, the previous step's output after that. */
    private JsonNode inputFor(PipelineExecution execution, int index) {
        if (index == 0) {
            return objectMapper.valueToTree(execution.getDataset().records());
        }
        return execution.getSteps().get(index - 1).getOutputData();
    }

    /** Wait before the retry that follows attempt {@code attempt}: base × 2^(attempt−1). */
    Duration retryDelay(int attempt) {
        return retryBackoff.delayFor(attempt);
    }

    private boolean isLive(StepRun run) {
        return activeRun == run && run.execution.getStatus() == ExecutionStatus.RUNNING;
    }

    private String nextId() {
        return "exec-" + timers.now().toEpochMilli() + "-" + (++sequence);
    }

    private void notifyListeners(Consumer<ExecutionListener> event) {
        for (ExecutionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Execution listener {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private static void putMdc(PipelineExecution execution, PipelineStep step) {
        MDC.put("executionId", execution.getId());
        MDC.put("stepId",      step.getId());
        MDC.put("stepType",    step.getType().wireName());
        MDC.put("attempt",     String.valueOf(step.getAttempt()));
    }

    private static void clearMdc() {
        MDC.remove("executionId");
        MDC.remove("stepId");
        MDC.remove("stepType");
        MDC.remove("attempt");
    }

    /** Timers of one step attempt, including the wait before its retry. */
    private static final class StepRun {

        final PipelineExecution execution;
        final int               index;
        final JsonNode          input;
        final int               maxAttempts;
        final Timer.Sample      sample;

        TimerHandle ticker;
        TimerHandle deadline;
        TimerHandle completion;
        TimerHandle retry;

        StepRun(PipelineExecution execution, int index, JsonNode input, int maxAttempts, Timer.Sample sample) {
            this.execution   = execution;
            this.index       = index;
            this.input       = input;
            this.maxAttempts = maxAttempts;
            this.sample      = sample;
        }

        PipelineStep step() {
            return execution.getSteps().get(index);
        }

        void cancelTimers() {
            TimerService.cancel(ticker);
            TimerService.cancel(deadline);
            TimerService.cancel(completion);
            TimerService.cancel(retry);
        }
    }
}
