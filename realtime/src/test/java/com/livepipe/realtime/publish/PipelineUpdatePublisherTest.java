package com.livepipe.realtime.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livepipe.realtime.model.PipelineConfig;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.model.PipelineStep;
import com.livepipe.realtime.pipeline.ExtractStepProcessor;
import com.livepipe.realtime.pipeline.FailurePolicy;
import com.livepipe.realtime.pipeline.LoadStepProcessor;
import com.livepipe.realtime.pipeline.PipelineEngine;
import com.livepipe.realtime.pipeline.PipelineProperties;
import com.livepipe.realtime.pipeline.TransformStepProcessor;
import com.livepipe.realtime.repository.InMemoryDatasetCatalog;
import com.livepipe.realtime.repository.InMemoryExecutionHistoryRepository;
import com.livepipe.realtime.scheduling.VirtualTimerService;
import com.livepipe.realtime.transport.MessageCodec;
import com.livepipe.realtime.transport.TransportClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PipelineUpdatePublisher. The transport is a Mockito mock;
 * every frame handed to it is parsed back and checked.
 */
@ExtendWith(MockitoExtension.class)
class PipelineUpdatePublisherTest {

    @Mock TransportClient transport;

    ObjectMapper            json   = new ObjectMapper();
    VirtualTimerService     timers = new VirtualTimerService();
    PipelineUpdatePublisher publisher;
    PipelineExecution       execution;

    @BeforeEach
    void setUp() {
        publisher = new PipelineUpdatePublisher(transport, new MessageCodec(json), timers);
        execution = new PipelineExecution("exec-1",
                new InMemoryDatasetCatalog().findById("sales-data").orElseThrow(),
                PipelineConfig.defaults(), timers.now());
        execution.markRunning();
    }

    @Test
    void stepProgress_sendsPipelineUpdateOnPipelineChannel() throws Exception {
        when(transport.send(any())).thenReturn(true);
        PipelineStep extract = execution.getSteps().get(0);
        extract.markRunning(json.createArrayNode(), timers.now());
        extract.advanceProgress(5, 95);

        publisher.stepProgress(execution, extract);

        JsonNode frame = lastFrame();
        assertThat(frame.get("type").asText()).isEqualTo("pipeline_update");
        assertThat(frame.get("channel").asText()).isEqualTo("pipeline");
        assertThat(frame.get("timestamp").asText()).isEqualTo("2024-01-20T10:00:00Z");
        assertThat(frame.get("id").asText()).isNotBlank();
        JsonNode data = frame.get("data");
        assertThat(data.get("pipelineId").asText()).isEqualTo("demo-elt-pipeline");
        assertThat(data.get("executionId").asText()).isEqualTo("exec-1");
        assertThat(data.get("stepId").asText()).isEqualTo("extract-step");
        assertThat(data.get("progress").asInt()).isEqualTo(5);
        assertThat(data.get("status").asText()).isEqualTo("running");
        assertThat(data.has("data")).isFalse();
    }

    @Test
    void executionStarted_hasNullStepId() throws Exception {
        when(transport.send(any())).thenReturn(true);

        publisher.executionStarted(execution);

        JsonNode data = lastFrame().get("data");
        assertThat(data.get("stepId").isNull()).isTrue();
        assertThat(data.get("status").asText()).isEqualTo("running");
        assertThat(data.get("progress").asInt()).isZero();
    }

    @Test
    void stepFailedAndRetrying_carryTheError() throws Exception {
        when(transport.send(any())).thenReturn(true);
        PipelineStep load = execution.getSteps().get(1);
        load.markRunning(json.createObjectNode(), timers.now());
        load.awaitRetry("Retry 1/2: boom");

        publisher.stepRetrying(execution, load, Duration.ofSeconds(2));
        JsonNode retrying = lastFrame().get("data");

        load.fail(null, "Step failed after 3 attempts: boom", timers.now());
        publisher.stepFailed(execution, load);
        JsonNode failed = lastFrame().get("data");

        assertThat(retrying.get("status").asText()).isEqualTo("pending");
        assertThat(retrying.at("/data/error").asText()).isEqualTo("Retry 1/2: boom");
        assertThat(retrying.at("/data/retryInMs").asLong()).isEqualTo(2000L);
        assertThat(failed.get("status").asText()).isEqualTo("failed");
        assertThat(failed.at("/data/error").asText()).isEqualTo("Step failed after 3 attempts: boom");
    }

    @Test
    void transportDown_updateDroppedSilently() {
        when(transport.send(any())).thenReturn(false);

        assertThatCode(() -> publisher.executionStarted(execution)).doesNotThrowAnyException();
    }

    @Test
    void engineRun_publishesEveryTransitionEndingWithCompletedExecution() throws Exception {
        when(transport.send(any())).thenReturn(true);
        PipelineEngine engine = new PipelineEngine(new InMemoryDatasetCatalog(),
                new InMemoryExecutionHistoryRepository(),
                List.of(new ExtractStepProcessor(), new LoadStepProcessor(), new TransformStepProcessor()),
                FailurePolicy.NEVER, timers, PipelineProperties.defaults(), new SimpleMeterRegistry(), json,
                List.of(publisher));

        PipelineExecution run = engine.executePipeline("sales-data");
        timers.advanceMillis(6500);

        List<JsonNode> updates = new ArrayList<>();
        for (String frame : captureFrames()) {
            updates.add(json.readTree(frame).get("data"));
        }
        assertThat(updates).allSatisfy(u -> assertThat(u.get("executionId").asText()).isEqualTo(run.getId()));
        assertThat(updates.get(0).get("stepId").isNull()).isTrue();

        JsonNode last = updates.get(updates.size() - 1);
        assertThat(last.get("stepId").isNull()).isTrue();
        assertThat(last.get("status").asText()).isEqualTo("completed");
        assertThat(last.get("progress").asInt()).isEqualTo(100);
        assertThat(last.at("/data/transformedRecords").asInt()).isEqualTo(3);

        assertThat(updates).filteredOn(u -> "completed".equals(u.get("status").asText())
                        && !u.get("stepId").isNull())
                .extracting(u -> u.get("stepId").asText())
                .containsExactly("extract-step", "load-step", "transform-step");
    }

    private JsonNode lastFrame() throws Exception {
        List<String> frames = captureFrames();
        return json.readTree(frames.get(frames.size() - 1));
    }

    private List<String> captureFrames() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(transport, atLeastOnce()).send(captor.capture());
        List<String> frames = new ArrayList<>();
        for (Object value : captor.getAllValues()) {
            frames.add((String) value);
        }
        return frames;
    }
}
