package com.livepipe.realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livepipe.realtime.pipeline.FailurePolicy;
import com.livepipe.realtime.pipeline.PipelineProperties;
import com.livepipe.realtime.pipeline.RandomFailurePolicy;
import com.livepipe.realtime.scheduling.TaskSchedulerTimerService;
import com.livepipe.realtime.scheduling.TimerService;
import com.livepipe.realtime.transport.MessageCodec;
import com.livepipe.realtime.transport.MessageDispatcher;
import com.livepipe.realtime.transport.ReconnectingTransportClient;
import com.livepipe.realtime.transport.SocketConnector;
import com.livepipe.realtime.transport.SpringWebSocketConnector;
import com.livepipe.realtime.transport.TransportClient;
import com.livepipe.realtime.transport.TransportProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the transport client and the engine's collaborators from
 * {@code livepipe.*} in application.yml.
 *
 * Engine, recovery and publisher are plain @Service/@Component beans; this
 * class only builds what needs settings or a choice of implementation.
 */
@Configuration
public class RealtimeConfig {

    /**
     * The one scheduler thread every engine and transport timer runs on.
     * A single thread keeps step transitions and socket bookkeeping strictly
     * sequential.
     */
    @Bean
    public ThreadPoolTaskScheduler livepipeTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("livepipe-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public TimerService timerService(ThreadPoolTaskScheduler livepipeTaskScheduler) {
        return new TaskSchedulerTimerService(livepipeTaskScheduler, Clock.systemUTC());
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    @Bean
    public TransportProperties transportProperties(
            @Value("${livepipe.transport.url}") URI url,
            @Value("${livepipe.transport.reconnect-interval:3s}") Duration reconnectInterval,
            @Value("${livepipe.transport.reconnect-max-delay:30s}") Duration reconnectMaxDelay,
            @Value("${livepipe.transport.max-reconnect-attempts:10}") int maxReconnectAttempts,
            @Value("${livepipe.transport.heartbeat-interval:30s}") Duration heartbeatInterval,
            @Value("${livepipe.transport.pong-timeout:0s}") Duration pongTimeout,
            @Value("${livepipe.transport.channels:pipeline}") List<String> channels) {
        return new TransportProperties(url, reconnectInterval, reconnectMaxDelay,
                maxReconnectAttempts, heartbeatInterval, pongTimeout, channels);
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public MessageDispatcher messageDispatcher() {
        return new MessageDispatcher();
    }

    @Bean
    public SocketConnector socketConnector() {
        return new SpringWebSocketConnector(new StandardWebSocketClient());
    }

    @Bean
    public TransportClient transportClient(SocketConnector socketConnector,
                                           TimerService timerService,
                                           MessageDispatcher messageDispatcher,
                                           MessageCodec messageCodec,
                                           TransportProperties transportProperties,
                                           MeterRegistry meterRegistry) {
        return new ReconnectingTransportClient(socketConnector, timerService, messageDispatcher,
                messageCodec, transportProperties, meterRegistry);
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    @Bean
    public PipelineProperties pipelineProperties(
            @Value("${livepipe.pipeline.timeout:30s}") Duration timeout,
            @Value("${livepipe.pipeline.retry-attempts:3}") int retryAttempts,
            @Value("${livepipe.pipeline.retry-base-delay:2s}") Duration retryBaseDelay,
            @Value("${livepipe.pipeline.simulated-failure-rate:0.05}") double simulatedFailureRate) {
        return new PipelineProperties(timeout, retryAttempts, retryBaseDelay, simulatedFailureRate);
    }

    @Bean
    public FailurePolicy failurePolicy(PipelineProperties pipelineProperties) {
        return new RandomFailurePolicy(pipelineProperties.simulatedFailureRate());
    }
}
