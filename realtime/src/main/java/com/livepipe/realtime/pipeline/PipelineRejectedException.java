package com.livepipe.realtime.pipeline;

/**
 * Synchronous refusal of {@link PipelineEngine#executePipeline}.
 *
 * Thrown before any execution object exists, so nothing needs undoing.
 */
public class PipelineRejectedException extends RuntimeException {

    public enum Kind { NOT_FOUND, INVALID_INPUT, CONFLICT }

    private final Kind   kind;
    private final String reason;

    public PipelineRejectedException(Kind kind, String reason) {
        super("[" + kind + "] " + reason);
        this.kind   = kind;
        this.reason = reason;
    }

    public Kind getKind() { return kind; }

    /** The human-readable part of the message, without the kind prefix. */
    public String getReason() { return reason; }
}
