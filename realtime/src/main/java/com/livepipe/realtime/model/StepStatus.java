package com.livepipe.realtime.model;

import java.util.Locale;

/**
 * Execution state of a single {@link PipelineStep}.
 *
 * Transitions:
 *   PENDING   → RUNNING   (engine starts an attempt)
 *   RUNNING   → COMPLETED (body finished, progress forced to 100)
 *   RUNNING   → PENDING   (attempt failed, another one is scheduled)
 *   RUNNING   → FAILED    (attempts exhausted, timeout on the last attempt, bad input)
 *   FAILED    → PENDING   (retry recovery)
 *   FAILED    → COMPLETED (skip recovery)
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
