package com.livepipe.realtime.model;

/** One way out of a failed execution, as offered to the UI. */
public record RecoveryOption(
        RecoveryStrategy strategy,
        RiskLevel        risk,
        String           label,
        String           description
) {}
