package com.livepipe.realtime.pipeline;

import java.time.Duration;

public class StepTimeoutException extends StepException {

    public StepTimeoutException(String stepName, Duration timeout) {
        super("Step " + stepName + " timed out after " + timeout.toMillis() + "ms");
    }
}
