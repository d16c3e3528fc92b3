package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.PipelineConfig;

import java.time.Duration;

/**
 * Settings of the pipeline engine ({@code livepipe.pipeline.*}).
 *
 * @param timeout              default per-step deadline
 * @param retryAttempts        default total attempts per step
 * @param retryBaseDelay       wait before the first retry; doubles per retry
 * @param simulatedFailureRate chance in [0, 1] that an attempt fails on purpose
 */
public record PipelineProperties(
        Duration timeout,
        int      retryAttempts,
        Duration retryBaseDelay,
        double   simulatedFailureRate
) {
    public PipelineProperties {
        if (retryBaseDelay == null || retryBaseDelay.isNegative() || retryBaseDelay.isZero()) {
            throw new IllegalArgumentException("retryBaseDelay must be positive");
        }
        if (simulatedFailureRate < 0.0 || simulatedFailureRate > 1.0) {
            throw new IllegalArgumentException("simulatedFailureRate must be within [0, 1]");
        }
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(PipelineConfig.DEFAULT_TIMEOUT,
                PipelineConfig.DEFAULT_RETRY_ATTEMPTS, Duration.ofSeconds(2), 0.05);
    }

    public PipelineConfig defaultConfig() {
        return new PipelineConfig(timeout, retryAttempts);
    }
}
