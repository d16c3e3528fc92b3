package com.livepipe.realtime.recovery;

import com.livepipe.realtime.model.ExecutionStatus;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.model.RecoveryOption;
import com.livepipe.realtime.model.RecoveryStrategy;
import com.livepipe.realtime.model.RiskLevel;
import com.livepipe.realtime.pipeline.PipelineEngine;
import com.livepipe.realtime.scheduling.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ways out of a failed execution.
 *
 *   retry   – re-run the failed step on the same upstream input, then the
 *             steps after it, one attempt each
 *   skip    – complete the failed step with its input as output, then run
 *             the steps after it (never offered for the last step)
 *   restart – a new execution over the same dataset and config
 *
 * Retry and skip reuse the failed execution object; the engine's single-run
 * lock still applies, so recovery never runs alongside another execution.
 */
@Service
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final PipelineEngine engine;
    private final TimerService   timers;

    public RecoveryCoordinator(PipelineEngine engine, TimerService timers) {
        this.engine = engine;
        this.timers = timers;
    }

    /** Options for the engine's current execution. */
    public List<RecoveryOption> getRecoveryOptions() {
        return engine.currentExecution()
                .map(execution -> engine.inspect(execution, this::getRecoveryOptions))
                .orElse(List.of());
    }

    /** Options for {@code execution}; empty unless it failed on a step. */
    public List<RecoveryOption> getRecoveryOptions(PipelineExecution execution) {
        if (execution == null || execution.getStatus() != ExecutionStatus.FAILED) {
            return List.of();
        }
        Optional<PipelineStep> failed = execution.failedStep();
        if (failed.isEmpty()) {
            return List.of();
        }
        PipelineStep step = failed.get();

        List<RecoveryOption> options = new ArrayList<>();
        options.add(new RecoveryOption(RecoveryStrategy.RETRY, RiskLevel.LOW,
                "Retry Failed Step", "Retry the " + step.getName() + " step that failed"));
        if (!isLast(execution, step)) {
            options.add(new RecoveryOption(RecoveryStrategy.SKIP, RiskLevel.HIGH,
                    "Skip Failed Step", "Skip the " + step.getName() + " step and continue with remaining steps"));
        }
        options.add(new RecoveryOption(RecoveryStrategy.RESTART, RiskLevel.MEDIUM,
                "Restart Pipeline", "Start the entire pipeline from the beginning"));
        return options;
    }

    /**
     * Apply {@code strategy} to the engine's current execution.
     *
     * @return the execution now running: the same object for retry and skip,
     *         a new one for restart
     * @throws RecoveryException if there is no failed execution or the
     *         strategy is not offered for it
     */
    public PipelineExecution applyRecovery(RecoveryStrategy strategy) {
        PipelineExecution execution = engine.currentExecution()
                .orElseThrow(() -> new RecoveryException("No current execution to recover from"));
        PipelineStep failed = engine.inspect(execution, RecoveryCoordinator::failedStepOf);

        log.info("Applying {} recovery to execution {} (failed step {})",
                strategy.wireName(), execution.getId(), failed.getId());

        return switch (strategy) {
            case RETRY -> engine.resume(execution, PipelineStep::reset, true);
            case SKIP -> {
                if (isLast(execution, failed)) {
                    throw new RecoveryException("Cannot skip " + failed.getName() + ": it is the last step");
                }
                yield engine.resume(execution, step -> step.markSkipped(timers.now()), false);
            }
            case RESTART -> engine.executePipeline(execution.getDataset().id(), execution.getConfig());
        };
    }

    private static PipelineStep failedStepOf(PipelineExecution execution) {
        if (execution.getStatus() != ExecutionStatus.FAILED) {
            throw new RecoveryException("Execution " + execution.getId() + " is "
                    + execution.getStatus().wireName() + ", only failed executions can be recovered");
        }
        return execution.failedStep()
                .orElseThrow(() -> new RecoveryException("No failed step found to recover from"));
    }

    private static boolean isLast(PipelineExecution execution, PipelineStep step) {
        return execution.indexOf(step) == execution.getSteps().size() - 1;
    }
}
