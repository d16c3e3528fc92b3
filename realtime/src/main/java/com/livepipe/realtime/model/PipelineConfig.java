package com.livepipe.realtime.model;

import java.time.Duration;

/**
 * Per-execution settings.
 *
 * @param timeout       hard deadline of one step attempt
 * @param retryAttempts total attempts per step, so 3 means one try plus two retries
 */
public record PipelineConfig(Duration timeout, int retryAttempts) {

    public static final Duration DEFAULT_TIMEOUT        = Duration.ofSeconds(30);
    public static final int      DEFAULT_RETRY_ATTEMPTS = 3;

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_TIMEOUT, DEFAULT_RETRY_ATTEMPTS);
    }

    /** Overlay the non-null fields of a caller's partial config on this one. */
    public PipelineConfig merge(Duration timeoutOverride, Integer retryAttemptsOverride) {
        return new PipelineConfig(
                timeoutOverride != null ? timeoutOverride : timeout,
                retryAttemptsOverride != null ? retryAttemptsOverride : retryAttempts);
    }

    public boolean isValid() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative() && retryAttempts >= 1;
    }
}
