package com.livepipe.realtime.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * One step of a {@link PipelineExecution}.
 *
 * Read and mutated under the engine's monitor while its execution is live.
 * Progress is kept in [0, 100]; a completed step always reports 100.
 */
public class PipelineStep {

    public static final String SKIPPED_MESSAGE = "Step was skipped due to error recovery";

    private final StepType type;

    private StepStatus status = StepStatus.PENDING;
    private int        progress;
    private Instant    startTime;
    private Instant    endTime;
    private JsonNode   inputData;
    private JsonNode   outputData;
    private String     errorMessage;

    // Attempts started since the step was created or last reset by recovery.
    private int attempt;

    // Set when recovery skipped this step; its output is then its input.
    private boolean skipped;

    public PipelineStep(StepType type) {
        this.type = type;
    }

    /** Field-by-field copy; the JSON payloads are shared and never modified. */
    public PipelineStep copy() {
        PipelineStep copy = new PipelineStep(type);
        copy.status       = status;
        copy.progress     = progress;
        copy.startTime    = startTime;
        copy.endTime      = endTime;
        copy.inputData    = inputData;
        copy.outputData   = outputData;
        copy.errorMessage = errorMessage;
        copy.attempt      = attempt;
        copy.skipped      = skipped;
        return copy;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning(JsonNode input, Instant now) {
        this.status       = StepStatus.RUNNING;
        this.startTime    = now;
        this.endTime      = null;
        this.progress     = 0;
        this.inputData    = input;
        this.outputData   = null;
        this.errorMessage = null;
        this.attempt++;
    }

    /** Add {@code delta} to progress without passing {@code ceiling}. */
    public void advanceProgress(int delta, int ceiling) {
        this.progress = clamp(Math.min(progress + delta, ceiling));
    }

    public void complete(JsonNode output, Instant now) {
        this.status     = StepStatus.COMPLETED;
        this.progress   = 100;
        this.outputData = output;
        this.endTime    = now;
    }

    /** Attempt failed and another one follows: back to pending with an annotated message. */
    public void awaitRetry(String message) {
        this.status       = StepStatus.PENDING;
        this.progress     = 0;
        this.endTime      = null;
        this.errorMessage = message;
    }

    public void fail(JsonNode input, String message, Instant now) {
        if (inputData == null) {
            this.inputData = input;
        }
        this.status       = StepStatus.FAILED;
        this.progress     = 0;
        this.endTime      = now;
        this.errorMessage = message;
    }

    public void markSkipped(Instant now) {
        this.status       = StepStatus.COMPLETED;
        this.progress     = 100;
        this.outputData   = inputData;
        this.endTime      = now;
        this.errorMessage = SKIPPED_MESSAGE;
        this.skipped      = true;
    }

    /** Clear everything an attempt left behind, as retry recovery does. */
    public void reset() {
        this.status       = StepStatus.PENDING;
        this.progress     = 0;
        this.startTime    = null;
        this.endTime      = null;
        this.outputData   = null;
        this.errorMessage = null;
        this.attempt      = 0;
        this.skipped      = false;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String     getId()           { return type.stepId(); }
    public String     getName()         { return type.displayName(); }
    public String     getDescription()  { return type.description(); }
    public StepType   getType()         { return type; }
    public StepStatus getStatus()       { return status; }
    public int        getProgress()     { return progress; }
    public Instant    getStartTime()    { return startTime; }
    public Instant    getEndTime()      { return endTime; }
    public JsonNode   getInputData()    { return inputData; }
    public JsonNode   getOutputData()   { return outputData; }
    public String     getErrorMessage() { return errorMessage; }
    public int        getAttempt()      { return attempt; }
    public boolean    isSkipped()       { return skipped; }

    /** Wall time of the last attempt, zero while it has not ended. */
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
