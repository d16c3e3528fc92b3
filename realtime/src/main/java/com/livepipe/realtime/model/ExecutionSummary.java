package com.livepipe.realtime.model;

import java.time.Instant;
import java.util.List;

/**
 * Display-ready digest of an execution: record counts and per-step timings.
 */
public record ExecutionSummary(
        String            id,
        String            status,
        long              durationMs,
        Instant           startTime,
        Instant           endTime,
        int               inputRecords,
        int               outputRecords,
        List<StepSummary> steps
) {
    public record StepSummary(String name, String status, int progress, long durationMs, boolean skipped) {}

    public static ExecutionSummary of(PipelineExecution execution) {
        int output = 0;
        if (execution.getOutputData() != null && execution.getOutputData().path("data").isArray()) {
            output = execution.getOutputData().path("data").size();
        }
        return new ExecutionSummary(
                execution.getId(),
                execution.getStatus().wireName(),
                execution.getExecutionTimeMs() != null ? execution.getExecutionTimeMs() : 0L,
                execution.getStartTime(),
                execution.getEndTime(),
                execution.getDataset().recordCount(),
                output,
                execution.getSteps().stream()
                        .map(s -> new StepSummary(s.getName(), s.getStatus().wireName(),
                                s.getProgress(), s.duration().toMillis(), s.isSkipped()))
                        .toList());
    }
}
