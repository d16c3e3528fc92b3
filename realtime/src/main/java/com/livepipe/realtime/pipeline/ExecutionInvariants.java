package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.ExecutionStatus;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.model.StepStatus;
import com.livepipe.realtime.model.StepType;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks over an execution snapshot. Used by tests and by the
 * engine's debug logging on terminal transitions.
 */
public final class ExecutionInvariants {

    private ExecutionInvariants() {}

    /** @return every violated invariant, empty if the execution is consistent */
    public static List<String> check(PipelineExecution execution) {
        List<String> errors = new ArrayList<>();
        if (execution.getId() == null)         errors.add("Execution ID is required");
        if (execution.getPipelineId() == null) errors.add("Pipeline ID is required");
        if (execution.getStartTime() == null)  errors.add("Start time is required");
        if (execution.getDataset() == null)    errors.add("Input dataset is required");

        List<PipelineStep> steps = execution.getSteps();
        StepType[] order = StepType.values();
        if (steps.size() != order.length) {
            errors.add("Execution must have exactly " + order.length + " steps");
        } else {
            for (int i = 0; i < order.length; i++) {
                if (steps.get(i).getType() != order[i]) {
                    errors.add("Step " + i + " must be " + order[i].wireName());
                }
            }
        }

        for (PipelineStep step : steps) {
            if (step.getProgress() < 0 || step.getProgress() > 100) {
                errors.add("Step " + step.getId() + " progress out of range: " + step.getProgress());
            }
            if (step.getStatus() == StepStatus.COMPLETED && step.getProgress() != 100) {
                errors.add("Completed step " + step.getId() + " must report progress 100");
            }
        }

        ExecutionStatus status = execution.getStatus();
        if (status == ExecutionStatus.COMPLETED) {
            if (execution.getEndTime() == null) {
                errors.add("Completed execution must have end time");
            } else if (execution.getEndTime().isBefore(execution.getStartTime())) {
                errors.add("End time must not precede start time");
            }
            if (steps.stream().anyMatch(s -> s.getStatus() != StepStatus.COMPLETED)) {
                errors.add("Completed execution must have all steps completed");
            }
        }
        if (status == ExecutionStatus.FAILED
                && execution.getErrorMessage() == null
                && execution.failedStep().isEmpty()) {
            errors.add("Failed execution must have error message or failed step");
        }
        return errors;
    }
}
