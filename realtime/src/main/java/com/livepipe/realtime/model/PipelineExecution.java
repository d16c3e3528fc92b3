package com.livepipe.realtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One run of the three-step pipeline against one dataset.
 *
 * Created by the engine only after every precondition passed, so an
 * execution object always refers to a real dataset. Steps are fixed at
 * construction, one per {@link StepType}, in declaration order.
 */
public class PipelineExecution {

    public static final String PIPELINE_ID = "demo-elt-pipeline";

    private final String             id;
    private final String             pipelineId;
    private final Dataset            dataset;
    private final PipelineConfig     config;
    private final Instant            startTime;
    private final List<PipelineStep> steps;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant         endTime;
    private JsonNode        outputData;
    private String          errorMessage;
    private Long            executionTimeMs;

    public PipelineExecution(String id, Dataset dataset, PipelineConfig config, Instant startTime) {
        this.id         = id;
        this.pipelineId = PIPELINE_ID;
        this.dataset    = dataset;
        this.config     = config;
        this.startTime  = startTime;
        this.steps      = Arrays.stream(StepType.values()).map(PipelineStep::new).toList();
    }

    private PipelineExecution(PipelineExecution source) {
        this.id              = source.id;
        this.pipelineId      = source.pipelineId;
        this.dataset         = source.dataset;
        this.config          = source.config;
        this.startTime       = source.startTime;
        this.steps           = source.steps.stream().map(PipelineStep::copy).toList();
        this.status          = source.status;
        this.endTime         = source.endTime;
        this.outputData      = source.outputData;
        this.errorMessage    = source.errorMessage;
        this.executionTimeMs = source.executionTimeMs;
    }

    /**
     * Detached copy of this execution and its steps. Later transitions of
     * this object, including recovery re-entering it, do not reach the copy.
     */
    public PipelineExecution snapshot() {
        return new PipelineExecution(this);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning() {
        this.status          = ExecutionStatus.RUNNING;
        this.endTime         = null;
        this.errorMessage    = null;
        this.executionTimeMs = null;
    }

    public void markCompleted(JsonNode output, Instant now) {
        this.status          = ExecutionStatus.COMPLETED;
        this.outputData      = output;
        this.errorMessage    = null;
        finish(now);
    }

    public void markFailed(String message, Instant now) {
        this.status       = ExecutionStatus.FAILED;
        this.errorMessage = message;
        finish(now);
    }

    public void markCancelled(Instant now) {
        this.status = ExecutionStatus.CANCELLED;
        finish(now);
    }

    private void finish(Instant now) {
        this.endTime         = now;
        this.executionTimeMs = Duration.between(startTime, now).toMillis();
    }

    // ------------------------------------------------------------------
    // Derived
    // ------------------------------------------------------------------

    /** The first step that is running or still pending. */
    public Optional<PipelineStep> currentStep() {
        return steps.stream()
                .filter(s -> s.getStatus() == StepStatus.RUNNING || s.getStatus() == StepStatus.PENDING)
                .findFirst();
    }

    public Optional<PipelineStep> failedStep() {
        return steps.stream().filter(s -> s.getStatus() == StepStatus.FAILED).findFirst();
    }

    public int indexOf(PipelineStep step) {
        return steps.indexOf(step);
    }

    /** Completed steps as a percentage of all steps. */
    public int progressPercent() {
        long completed = steps.stream().filter(s -> s.getStatus() == StepStatus.COMPLETED).count();
        return (int) Math.round(completed * 100.0 / steps.size());
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String             getId()              { return id; }
    public String             getPipelineId()      { return pipelineId; }
    public Dataset            getDataset()         { return dataset; }
    public PipelineConfig     getConfig()          { return config; }
    public Instant            getStartTime()       { return startTime; }
    public List<PipelineStep> getSteps()           { return steps; }
    public ExecutionStatus    getStatus()          { return status; }
    public Instant            getEndTime()         { return endTime; }
    public JsonNode           getOutputData()      { return outputData; }
    public String             getErrorMessage()    { return errorMessage; }
    public Long               getExecutionTimeMs() { return executionTimeMs; }
}
