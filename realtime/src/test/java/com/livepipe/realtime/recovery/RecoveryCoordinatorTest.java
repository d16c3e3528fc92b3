package com.livepipe.realtime.recovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livepipe.realtime.model.ExecutionStatus;
import com.livepipe.realtime.model.PipelineConfig;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.model.RecoveryOption;
import com.livepipe.realtime.model.RecoveryStrategy;
import com.livepipe.realtime.model.RiskLevel;
import com.livepipe.realtime.model.StepStatus;
import com.livepipe.realtime.model.StepType;
import com.livepipe.realtime.pipeline.ExecutionInvariants;
import com.livepipe.realtime.pipeline.ExtractStepProcessor;
import com.livepipe.realtime.pipeline.LoadStepProcessor;
import com.livepipe.realtime.pipeline.PipelineEngine;
import com.livepipe.realtime.pipeline.PipelineProperties;
import com.livepipe.realtime.pipeline.TransformStepProcessor;
import com.livepipe.realtime.repository.InMemoryDatasetCatalog;
import com.livepipe.realtime.repository.InMemoryExecutionHistoryRepository;
import com.livepipe.realtime.scheduling.VirtualTimerService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for RecoveryCoordinator against a real engine on a virtual clock.
 *
 * Executions run with a single attempt per step so a failing step fails the
 * execution as soon as its body finishes: load at 3500 ms, transform at 6500 ms.
 */
class RecoveryCoordinatorTest {

    private static final PipelineConfig ONE_ATTEMPT = new PipelineConfig(Duration.ofSeconds(30), 1);

    VirtualTimerService timers;
    Set<StepType>       failing;
    PipelineEngine      engine;
    RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        timers  = new VirtualTimerService();
        failing = EnumSet.noneOf(StepType.class);
        engine  = new PipelineEngine(new InMemoryDatasetCatalog(), new InMemoryExecutionHistoryRepository(),
                List.of(new ExtractStepProcessor(), new LoadStepProcessor(), new TransformStepProcessor()),
                (type, attempt) -> failing.contains(type),
                timers, PipelineProperties.defaults(), new SimpleMeterRegistry(), new ObjectMapper(), List.of());
        coordinator = new RecoveryCoordinator(engine, timers);
    }

    // ------------------------------------------------------------------
    // getRecoveryOptions()
    // ------------------------------------------------------------------

    @Test
    void options_failedMiddleStep_allThreeStrategies() {
        failLoad();

        List<RecoveryOption> options = coordinator.getRecoveryOptions();

        assertThat(options).extracting(RecoveryOption::strategy)
                .containsExactly(RecoveryStrategy.RETRY, RecoveryStrategy.SKIP, RecoveryStrategy.RESTART);
        assertThat(options).extracting(RecoveryOption::risk)
                .containsExactly(RiskLevel.LOW, RiskLevel.HIGH, RiskLevel.MEDIUM);
        assertThat(options.get(0).description()).isEqualTo("Retry the Load Data step that failed");
    }

    @Test
    void options_failedLastStep_noSkip() {
        failTransform();

        assertThat(coordinator.getRecoveryOptions()).extracting(RecoveryOption::strategy)
                .containsExactly(RecoveryStrategy.RETRY, RecoveryStrategy.RESTART);
    }

    @Test
    void options_noFailure_empty() {
        assertThat(coordinator.getRecoveryOptions()).isEmpty();

        engine.executePipeline("sales-data");
        assertThat(coordinator.getRecoveryOptions()).isEmpty();

        timers.advanceMillis(6500);
        assertThat(coordinator.getRecoveryOptions()).isEmpty();
    }

    // ------------------------------------------------------------------
    // applyRecovery()
    // ------------------------------------------------------------------

    @Test
    void retry_rerunsFailedStepOnSameExecution() {
        PipelineExecution failed = failLoad();
        PipelineStep extract = failed.getSteps().get(0);
        failing.clear();

        PipelineExecution resumed = coordinator.applyRecovery(RecoveryStrategy.RETRY);

        assertThat(resumed).isSameAs(failed);
        assertThat(resumed.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(resumed.getErrorMessage()).isNull();
        assertThat(resumed.getSteps().get(1).getStatus()).isEqualTo(StepStatus.RUNNING);
        assertThat(resumed.getSteps().get(1).getAttempt()).isEqualTo(1);
        assertThat(resumed.getSteps().get(1).getInputData()).isEqualTo(extract.getOutputData());
        assertThat(engine.executionHistory()).extracting(PipelineExecution::getStatus)
                .containsExactly(ExecutionStatus.FAILED);

        timers.advanceMillis(4500);

        assertThat(resumed.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(extract.getAttempt()).isEqualTo(1);
        assertThat(ExecutionInvariants.check(resumed)).isEmpty();
        assertThat(engine.executionHistory())
                .extracting(PipelineExecution::getId, PipelineExecution::getStatus)
                .containsExactly(tuple(failed.getId(), ExecutionStatus.FAILED),
                                 tuple(failed.getId(), ExecutionStatus.COMPLETED));
        assertThat(engine.findExecution(failed.getId())).containsSame(resumed);
    }

    @Test
    void retry_failureRecordSurvivesRecovery() {
        PipelineExecution failed = failLoad();
        failing.clear();

        coordinator.applyRecovery(RecoveryStrategy.RETRY);
        timers.advanceMillis(4500);

        PipelineExecution failureRecord = engine.executionHistory().get(0);
        assertThat(failureRecord).isNotSameAs(failed);
        assertThat(failureRecord.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failureRecord.getErrorMessage())
                .isEqualTo("Step failed after 1 attempts: Simulated failure in Load Data step");
        assertThat(failureRecord.getEndTime()).isNotNull();
        assertThat(failureRecord.getSteps()).extracting(PipelineStep::getStatus)
                .containsExactly(StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.PENDING);
        assertThat(failureRecord.getSteps().get(1).getAttempt()).isEqualTo(1);
        assertThat(failureRecord.getSteps().get(1).getErrorMessage()).isEqualTo(failureRecord.getErrorMessage());
    }

    @Test
    void retry_stillFailing_failsAgainAfterOneAttempt() {
        PipelineExecution failed = failLoad();

        coordinator.applyRecovery(RecoveryStrategy.RETRY);
        timers.advanceMillis(1500);

        assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Step failed after 1 attempts: Simulated failure in Load Data step");
        assertThat(coordinator.getRecoveryOptions()).isNotEmpty();
    }

    @Test
    void skip_completesStepWithItsInputAndDownstreamRejectsIt() {
        PipelineExecution failed = failLoad();
        PipelineStep load = failed.getSteps().get(1);

        PipelineExecution resumed = coordinator.applyRecovery(RecoveryStrategy.SKIP);

        assertThat(resumed).isSameAs(failed);
        assertThat(load.isSkipped()).isTrue();
        assertThat(load.getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(load.getProgress()).isEqualTo(100);
        assertThat(load.getErrorMessage()).isEqualTo(PipelineStep.SKIPPED_MESSAGE);
        assertThat(load.getOutputData()).isEqualTo(load.getInputData());

        // extract output carries no loadedAt, so transform refuses it outright
        PipelineStep transform = failed.getSteps().get(2);
        assertThat(transform.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Transform step requires metadata from load step");
        assertThat(engine.isExecuting()).isFalse();

        List<PipelineExecution> records = engine.executionHistory();
        assertThat(records).extracting(PipelineExecution::getStatus)
                .containsExactly(ExecutionStatus.FAILED, ExecutionStatus.FAILED);
        assertThat(records.get(0).getSteps().get(1).getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(records.get(0).getSteps().get(1).isSkipped()).isFalse();
        assertThat(records.get(1).getSteps().get(1).isSkipped()).isTrue();
    }

    @Test
    void skip_lastStep_refused() {
        failTransform();

        assertThatThrownBy(() -> coordinator.applyRecovery(RecoveryStrategy.SKIP))
                .isInstanceOf(RecoveryException.class)
                .hasMessageContaining("last step");
    }

    @Test
    void restart_startsNewExecutionWithSameDatasetAndConfig() {
        PipelineExecution failed = failLoad();
        failing.clear();

        PipelineExecution restarted = coordinator.applyRecovery(RecoveryStrategy.RESTART);

        assertThat(restarted.getId()).isNotEqualTo(failed.getId());
        assertThat(restarted.getDataset()).isEqualTo(failed.getDataset());
        assertThat(restarted.getConfig()).isEqualTo(ONE_ATTEMPT);
        assertThat(restarted.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(failed.getStatus()).isEqualTo(ExecutionStatus.FAILED);

        timers.advanceMillis(6500);
        assertThat(restarted.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void apply_withoutFailedExecution_refused() {
        assertThatThrownBy(() -> coordinator.applyRecovery(RecoveryStrategy.RETRY))
                .isInstanceOf(RecoveryException.class)
                .hasMessage("No current execution to recover from");

        engine.executePipeline("sales-data");
        assertThatThrownBy(() -> coordinator.applyRecovery(RecoveryStrategy.RESTART))
                .isInstanceOf(RecoveryException.class)
                .hasMessageContaining("only failed executions can be recovered");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineExecution failLoad() {
        failing.add(StepType.LOAD);
        PipelineExecution execution = engine.executePipeline("sales-data", ONE_ATTEMPT);
        timers.advanceMillis(3500);
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        return execution;
    }

    private PipelineExecution failTransform() {
        failing.add(StepType.TRANSFORM);
        PipelineExecution execution = engine.executePipeline("sales-data", ONE_ATTEMPT);
        timers.advanceMillis(6500);
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        return execution;
    }
}
