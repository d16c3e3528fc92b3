package com.livepipe.realtime.api;

import com.livepipe.realtime.api.dto.DatasetResponse;
import com.livepipe.realtime.api.dto.ExecuteRequest;
import com.livepipe.realtime.api.dto.ExecutionResponse;
import com.livepipe.realtime.api.dto.RecoveryOptionResponse;
import com.livepipe.realtime.api.dto.RecoveryRequest;
import com.livepipe.realtime.model.ExecutionSummary;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.RecoveryStrategy;
import com.livepipe.realtime.pipeline.PipelineEngine;
import com.livepipe.realtime.pipeline.PipelineRejectedException;
import com.livepipe.realtime.recovery.RecoveryCoordinator;
import com.livepipe.realtime.recovery.RecoveryException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;

/**
 * REST API for the demo ELT pipeline.
 *
 * GET    /api/demo/elt/datasets      sample datasets
 * POST   /api/demo/elt/execute       start an execution
 * GET    /api/demo/elt/status/{id}   current or historical execution
 * GET    /api/demo/elt/status/{id}/summary  record counts and step timings
 * POST   /api/demo/elt/cancel        cancel the running execution
 * GET    /api/demo/elt/recovery      recovery options for the current execution
 * POST   /api/demo/elt/recovery      apply a recovery strategy
 * GET    /api/demo/elt/history       finished executions
 * DELETE /api/demo/elt/history       clear them
 *
 * Progress is pushed over the WebSocket channel; these endpoints only
 * start things and take snapshots. Responses are built through
 * {@link PipelineEngine#inspect} so they never see a half-applied transition.
 * History entries are already detached snapshots.
 */
@RestController
@RequestMapping("/api/demo/elt")
public class PipelineController {

    private final PipelineEngine      engine;
    private final RecoveryCoordinator recovery;

    public PipelineController(PipelineEngine engine, RecoveryCoordinator recovery) {
        this.engine   = engine;
        this.recovery = recovery;
    }

    @GetMapping("/datasets")
    public List<DatasetResponse> datasets() {
        return engine.datasets().stream().map(DatasetResponse::from).toList();
    }

    /**
     * Start an execution. Returns at once with status "running".
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/demo/elt/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"datasetId":"sales-data","config":{"timeout":30000,"retryAttempts":3}}'
     */
    @PostMapping("/execute")
    public ResponseEntity<ExecutionResponse> execute(@RequestBody ExecuteRequest req) {
        if (req.datasetId() == null || req.datasetId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "datasetId is required");
        }
        Duration timeout  = null;
        Integer  attempts = null;
        if (req.config() != null) {
            timeout  = req.config().timeout() != null ? Duration.ofMillis(req.config().timeout()) : null;
            attempts = req.config().retryAttempts();
        }
        try {
            PipelineExecution execution = engine.executePipeline(req.datasetId(), timeout, attempts);
            return ResponseEntity.status(HttpStatus.CREATED).body(engine.inspect(execution, ExecutionResponse::from));
        } catch (PipelineRejectedException e) {
            throw new ResponseStatusException(statusFor(e.getKind()), e.getReason());
        }
    }

    /** Returns 404 if the id is neither the current execution nor in history. */
    @GetMapping("/status/{id}")
    public ExecutionResponse status(@PathVariable String id) {
        return engine.snapshot(id, ExecutionResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Execution not found: " + id));
    }

    @GetMapping("/status/{id}/summary")
    public ExecutionSummary summary(@PathVariable String id) {
        return engine.snapshot(id, ExecutionSummary::of)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Execution not found: " + id));
    }

    @PostMapping("/cancel")
    public ExecutionResponse cancel() {
        return engine.cancelExecution()
                .map(execution -> engine.inspect(execution, ExecutionResponse::from))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No execution is running"));
    }

    @GetMapping("/recovery")
    public List<RecoveryOptionResponse> recoveryOptions() {
        return recovery.getRecoveryOptions().stream().map(RecoveryOptionResponse::from).toList();
    }

    /**
     * Apply a recovery strategy to the current (failed) execution.
     *
     * HTTP 200  recovery started; body is the execution now running
     * HTTP 400  unknown strategy
     * HTTP 409  nothing to recover, strategy not offered, or another run is active
     */
    @PostMapping("/recovery")
    public ExecutionResponse recover(@RequestBody RecoveryRequest req) {
        RecoveryStrategy strategy = RecoveryStrategy.fromWire(req.strategy())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Unknown recovery strategy: " + req.strategy()));
        try {
            return engine.inspect(recovery.applyRecovery(strategy), ExecutionResponse::from);
        } catch (RecoveryException | IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (PipelineRejectedException e) {
            throw new ResponseStatusException(statusFor(e.getKind()), e.getReason());
        }
    }

    @GetMapping("/history")
    public List<ExecutionResponse> history() {
        return engine.executionHistory().stream().map(ExecutionResponse::from).toList();
    }

    @DeleteMapping("/history")
    public ResponseEntity<Void> clearHistory() {
        engine.clearHistory();
        return ResponseEntity.noContent().build();
    }

    private static HttpStatus statusFor(PipelineRejectedException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND     -> HttpStatus.NOT_FOUND;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case CONFLICT      -> HttpStatus.CONFLICT;
        };
    }
}
