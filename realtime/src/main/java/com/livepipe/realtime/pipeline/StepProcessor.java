package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.livepipe.realtime.model.StepType;

import java.time.Instant;

/**
 * Body of one pipeline step.
 *
 * The engine calls {@link #validateInput} before the step starts and
 * {@link #process} once the simulated work time has elapsed.
 */
public interface StepProcessor {

    StepType type();

    /**
     * @throws StepInputException if {@code input} does not meet this step's
     *         input contract
     */
    void validateInput(JsonNode input);

    /**
     * Produce this step's output, {@code {data: [...], metadata: {...}}}.
     *
     * @throws StepException on a failure a retry might fix
     */
    JsonNode process(JsonNode input, Instant now);
}
