package com.livepipe.realtime.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.pipeline.ExecutionListener;
import com.livepipe.realtime.scheduling.TimerService;
import com.livepipe.realtime.transport.Message;
import com.livepipe.realtime.transport.MessageCodec;
import com.livepipe.realtime.transport.MessageType;
import com.livepipe.realtime.transport.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Mirrors engine transitions onto the {@value #CHANNEL} channel as
 * {@code pipeline_update} messages.
 *
 * Payload: {@code {pipelineId, executionId, stepId, progress, status, data?}}.
 * {@code data} is the step output on completion and {@code {error}} on
 * failure. Execution-level updates carry {@code stepId = null}. While the
 * transport is down updates are dropped, not queued.
 */
@Component
public class PipelineUpdatePublisher implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(PipelineUpdatePublisher.class);

    public static final String CHANNEL = "pipeline";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final TransportClient transport;
    private final MessageCodec    codec;
    private final TimerService    timers;

    public PipelineUpdatePublisher(TransportClient transport, MessageCodec codec, TimerService timers) {
        this.transport = transport;
        this.codec     = codec;
        this.timers    = timers;
    }

    @Override
    public void executionStarted(PipelineExecution execution) {
        publish(execution, null, execution.progressPercent(), execution.getStatus().wireName(), null);
    }

    @Override
    public void stepStarted(PipelineExecution execution, PipelineStep step) {
        publishStep(execution, step, null);
    }

    @Override
    public void stepProgress(PipelineExecution execution, PipelineStep step) {
        publishStep(execution, step, null);
    }

    @Override
    public void stepRetrying(PipelineExecution execution, PipelineStep step, Duration delay) {
        ObjectNode data = error(step.getErrorMessage());
        data.put("retryInMs", delay.toMillis());
        publishStep(execution, step, data);
    }

    @Override
    public void stepCompleted(PipelineExecution execution, PipelineStep step) {
        publishStep(execution, step, step.getOutputData());
    }

    @Override
    public void stepFailed(PipelineExecution execution, PipelineStep step) {
        publishStep(execution, step, error(step.getErrorMessage()));
    }

    @Override
    public void executionFinished(PipelineExecution execution) {
        JsonNode data = switch (execution.getStatus()) {
            case COMPLETED -> execution.getOutputData();
            case FAILED    -> error(execution.getErrorMessage());
            default        -> null;
        };
        publish(execution, null, execution.progressPercent(), execution.getStatus().wireName(), data);
    }

    private void publishStep(PipelineExecution execution, PipelineStep step, JsonNode data) {
        publish(execution, step.getId(), step.getProgress(), step.getStatus().wireName(), data);
    }

    private void publish(PipelineExecution execution, String stepId, int progress, String status, JsonNode data) {
        ObjectNode payload = nodes.objectNode();
        payload.put("pipelineId", execution.getPipelineId());
        payload.put("executionId", execution.getId());
        payload.put("stepId", stepId);
        payload.put("progress", progress);
        payload.put("status", status);
        if (data != null) {
            payload.set("data", data);
        }

        Message message = new Message(MessageType.PIPELINE_UPDATE.wireName(), payload,
                timers.now(), UUID.randomUUID().toString());
        if (!transport.send(codec.encode(message, CHANNEL))) {
            log.debug("Transport down, pipeline update for {} / {} not sent", execution.getId(), stepId);
        }
    }

    private static ObjectNode error(String message) {
        ObjectNode node = nodes.objectNode();
        node.put("error", message);
        return node;
    }
}
