package com.livepipe.realtime.pipeline;

/**
 * Upstream output does not satisfy a step's input contract. Fails the step
 * on the spot: a retry would see the same input.
 */
public class StepInputException extends StepException {

    public StepInputException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
