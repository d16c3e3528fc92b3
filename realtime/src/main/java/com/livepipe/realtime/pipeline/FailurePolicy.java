package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.StepType;

/**
 * Decides whether a step attempt fails on purpose, to exercise the retry
 * and recovery paths in the demo.
 */
@FunctionalInterface
public interface FailurePolicy {

    FailurePolicy NEVER = (type, attempt) -> false;

    /** @param attempt 1-based attempt number of the step */
    boolean shouldFail(StepType type, int attempt);
}
