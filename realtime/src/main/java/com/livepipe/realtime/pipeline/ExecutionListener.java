package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;

import java.time.Duration;

/**
 * Observer of engine transitions. Called on the scheduler thread while the
 * engine holds its monitor, so implementations must not block.
 */
public interface ExecutionListener {

    default void executionStarted(PipelineExecution execution) {}

    default void stepStarted(PipelineExecution execution, PipelineStep step) {}

    default void stepProgress(PipelineExecution execution, PipelineStep step) {}

    default void stepRetrying(PipelineExecution execution, PipelineStep step, Duration delay) {}

    default void stepCompleted(PipelineExecution execution, PipelineStep step) {}

    default void stepFailed(PipelineExecution execution, PipelineStep step) {}

    /** The execution reached COMPLETED, FAILED or CANCELLED. */
    default void executionFinished(PipelineExecution execution) {}
}
