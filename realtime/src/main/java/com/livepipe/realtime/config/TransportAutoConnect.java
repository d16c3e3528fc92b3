package com.livepipe.realtime.config;

import com.livepipe.realtime.transport.MessageHandler;
import com.livepipe.realtime.transport.MessageType;
import com.livepipe.realtime.transport.TransportClient;
import com.livepipe.realtime.transport.TransportProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Opens the broadcaster connection once the application has started and
 * closes it on shutdown.
 *
 * Set {@code livepipe.transport.auto-connect=false} to run without a
 * broadcaster; engine updates are then simply not published.
 */
@Component
public class TransportAutoConnect implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TransportAutoConnect.class);

    private final TransportClient     transport;
    private final TransportProperties props;
    private final boolean             autoConnect;

    private final MessageHandler updateLogger = message ->
            log.debug("pipeline_update from broadcaster: {}", message.data());

    private final MessageHandler errorLogger = message ->
            log.warn("Broadcaster reported an error: {}", message.data());

    public TransportAutoConnect(TransportClient transport,
                                TransportProperties props,
                                @Value("${livepipe.transport.auto-connect:true}") boolean autoConnect) {
        this.transport   = transport;
        this.props       = props;
        this.autoConnect = autoConnect;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!autoConnect) {
            log.info("Transport auto-connect disabled; not connecting to {}", props.url());
            return;
        }
        transport.on(MessageType.PIPELINE_UPDATE, updateLogger);
        transport.on(MessageType.ERROR, errorLogger);
        transport.onConnectionStatus(status -> log.info("Transport status: {}", status.wireName()));

        props.channels().forEach(transport::subscribe);
        transport.connect();
    }

    @PreDestroy
    public void shutdown() {
        transport.off(MessageType.PIPELINE_UPDATE, updateLogger);
        transport.off(MessageType.ERROR, errorLogger);
        transport.disconnect();
    }
}
