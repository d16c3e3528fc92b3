package com.livepipe.realtime.model;

import java.util.Locale;

/**
 * Lifecycle of a {@link PipelineExecution}.
 *
 * Transitions:
 *   RUNNING → COMPLETED (all three steps completed)
 *   RUNNING → FAILED    (a step exhausted its attempts or had malformed input)
 *   RUNNING → CANCELLED (cancelExecution)
 *   FAILED  → RUNNING   (retry / skip recovery, in place)
 *
 * PENDING only exists between construction and the engine starting the run.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
