package com.livepipe.realtime.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.livepipe.realtime.model.PipelineStep;

import java.time.Instant;

/**
 * View of one pipeline step. outputData is the step's {data, metadata}
 * result and stays null until the step completes.
 */
public record StepResponse(
        String   id,
        String   name,
        String   stepType,
        String   status,
        int      progress,
        int      attempt,
        boolean  skipped,
        Instant  startTime,
        Instant  endTime,
        String   errorMessage,
        JsonNode outputData
) {
    public static StepResponse from(PipelineStep s) {
        return new StepResponse(
                s.getId(),
                s.getName(),
                s.getType().wireName(),
                s.getStatus().wireName(),
                s.getProgress(),
                s.getAttempt(),
                s.isSkipped(),
                s.getStartTime(),
                s.getEndTime(),
                s.getErrorMessage(),
                s.getOutputData()
        );
    }
}
