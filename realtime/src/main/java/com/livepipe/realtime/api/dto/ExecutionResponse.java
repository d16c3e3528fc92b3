package com.livepipe.realtime.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.livepipe.realtime.model.PipelineExecution;

import java.time.Instant;
import java.util.List;

/**
 * Response body for execute, status, cancel and recovery.
 * progress is the share of completed steps, 0–100.
 */
public record ExecutionResponse(
        String             id,
        String             pipelineId,
        String             datasetId,
        String             status,
        int                progress,
        Instant            startTime,
        Instant            endTime,
        Long               executionTime,
        String             errorMessage,
        List<StepResponse> steps,
        JsonNode           outputData
) {
    public static ExecutionResponse from(PipelineExecution e) {
        return new ExecutionResponse(
                e.getId(),
                e.getPipelineId(),
                e.getDataset().id(),
                e.getStatus().wireName(),
                e.progressPercent(),
                e.getStartTime(),
                e.getEndTime(),
                e.getExecutionTimeMs(),
                e.getErrorMessage(),
                e.getSteps().stream().map(StepResponse::from).toList(),
                e.getOutputData()
        );
    }
}
