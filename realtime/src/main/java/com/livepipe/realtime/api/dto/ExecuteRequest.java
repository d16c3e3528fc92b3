package com.livepipe.realtime.api.dto;

/**
 * Request body for POST /api/demo/elt/execute.
 *
 * Required: datasetId
 * Optional: config; any field left out falls back to livepipe.pipeline.*
 */
public record ExecuteRequest(String datasetId, Config config) {

    /**
     * @param timeout       per-step deadline in milliseconds
     * @param retryAttempts total attempts per step
     */
    public record Config(Long timeout, Integer retryAttempts) {}
}
