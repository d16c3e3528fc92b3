package com.livepipe.realtime.pipeline;

/**
 * Business failure inside a step body. Retried per the execution's config.
 */
public class StepException extends RuntimeException {

    public StepException(String message) {
        super(message);
    }

    public StepException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether another attempt with the same input could succeed. */
    public boolean isRetryable() {
        return true;
    }
}
