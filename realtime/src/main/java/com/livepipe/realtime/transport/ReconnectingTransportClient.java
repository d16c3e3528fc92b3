package com.livepipe.realtime.transport;

import com.livepipe.realtime.scheduling.Backoff;
import com.livepipe.realtime.scheduling.TimerHandle;
import com.livepipe.realtime.scheduling.TimerService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link TransportClient} that keeps one socket open to the broadcaster and
 * reconnects with exponential backoff when it drops.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #connect()} starts an attempt; status = CONNECTING.</li>
 *   <li>On open: counter reset, status = CONNECTED, heartbeat started, every
 *       retained subscription replayed.</li>
 *   <li>On an unexpected close: status = DISCONNECTED and a reconnect is
 *       scheduled after {@code min(base × 2^(attempt−1), cap)}. When the
 *       counter reaches the maximum, status = ERROR and only a manual
 *       {@link #connect()} resumes.</li>
 *   <li>{@link #disconnect()} is terminal for the session: no auto-retry.</li>
 * </ol>
 *
 * <p>Socket callbacks may arrive on connector threads. Each attempt carries a
 * generation number; events from a superseded attempt are ignored. Client
 * state is guarded by {@code lock}; inbound dispatch and status notification
 * happen outside it so handlers may call back into the client.
 */
public class ReconnectingTransportClient implements TransportClient {

    private static final Logger log = LoggerFactory.getLogger(ReconnectingTransportClient.class);

    static final int NORMAL_CLOSURE       = 1000;
    static final int ABNORMAL_CLOSURE     = 1006;
    static final int PONG_TIMEOUT_CLOSURE = 4000;

    private final SocketConnector     connector;
    private final TimerService        timers;
    private final MessageDispatcher   dispatcher;
    private final MessageCodec        codec;
    private final TransportProperties props;
    private final Backoff             backoff;
    private final MeterRegistry       meterRegistry;

    private final List<ConnectionStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    // ---- guarded by lock ----
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private SocketSession    session;
    private int              generation;
    private int              reconnectAttempts;
    private boolean          manualClose;
    private boolean          exhausted;
    private Duration         lastReconnectDelay;
    private TimerHandle      reconnectTimer;
    private TimerHandle      heartbeatTimer;
    private TimerHandle      pongDeadline;
    private final Set<String> subscriptions = new LinkedHashSet<>();

    public ReconnectingTransportClient(SocketConnector connector,
                                       TimerService timers,
                                       MessageDispatcher dispatcher,
                                       MessageCodec codec,
                                       TransportProperties props,
                                       MeterRegistry meterRegistry) {
        this.connector     = connector;
        this.timers        = timers;
        this.dispatcher    = dispatcher;
        this.codec         = codec;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.backoff       = Backoff.exponential(props.reconnectInterval(), props.reconnectMaxDelay());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public void connect() {
        List<ConnectionStatus> changes = new ArrayList<>();
        int attempt;
        synchronized (lock) {
            if (session != null || status == ConnectionStatus.CONNECTING) {
                log.debug("connect() ignored, status is {}", status);
                return;
            }
            manualClose = false;
            if (exhausted) {
                exhausted = false;
                reconnectAttempts = 0;
            }
            TimerService.cancel(reconnectTimer);
            reconnectTimer = null;
            attempt = startAttemptLocked(changes);
        }
        publish(changes);
        openAttempt(attempt);
    }

    @Override
    public void disconnect() {
        List<ConnectionStatus> changes = new ArrayList<>();
        SocketSession toClose;
        synchronized (lock) {
            manualClose = true;
            generation++;
            clearTimersLocked();
            toClose = session;
            session = null;
            reconnectAttempts = 0;
            exhausted = false;
            subscriptions.clear();
            transitionLocked(ConnectionStatus.DISCONNECTED, changes);
        }
        if (toClose != null) {
            toClose.close(NORMAL_CLOSURE, "Manual disconnect");
        }
        log.info("Disconnected from {} (manual)", props.url());
        publish(changes);
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    @Override
    public void subscribe(String channel) {
        requireChannel(channel);
        synchronized (lock) {
            if (subscriptions.add(channel) && session != null) {
                sendLocked(codec.subscribe(channel));
            }
        }
    }

    @Override
    public void unsubscribe(String channel) {
        requireChannel(channel);
        synchronized (lock) {
            if (subscriptions.remove(channel) && session != null) {
                sendLocked(codec.unsubscribe(channel));
            }
        }
    }

    @Override
    public Set<String> subscriptions() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(subscriptions));
        }
    }

    // ------------------------------------------------------------------
    // Handlers
    // ------------------------------------------------------------------

    @Override public void on(MessageType type, MessageHandler handler)  { dispatcher.on(type, handler); }
    @Override public void off(MessageType type, MessageHandler handler) { dispatcher.off(type, handler); }
    @Override public void onAny(MessageHandler handler)                 { dispatcher.onAny(handler); }
    @Override public void offAny(MessageHandler handler)                { dispatcher.offAny(handler); }

    @Override
    public void onConnectionStatus(ConnectionStatusListener listener) {
        statusListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void offConnectionStatus(ConnectionStatusListener listener) {
        statusListeners.remove(listener);
    }

    // ------------------------------------------------------------------
    // Sending and state
    // ------------------------------------------------------------------

    @Override
    public boolean send(Object payload) {
        String text;
        try {
            text = codec.write(payload);
        } catch (TransportException e) {
            log.error("Dropping outbound payload: {}", e.getMessage());
            return false;
        }
        synchronized (lock) {
            if (session == null) {
                log.debug("Not connected, dropping outbound frame");
                return false;
            }
            return sendLocked(text);
        }
    }

    @Override
    public ConnectionStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    @Override
    public boolean isConnected() {
        synchronized (lock) {
            return session != null && status == ConnectionStatus.CONNECTED;
        }
    }

    /** Reconnects scheduled since the last successful open. */
    public int reconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    /** Delay used for the most recently scheduled reconnect, null if none yet. */
    public Duration lastReconnectDelay() {
        synchronized (lock) {
            return lastReconnectDelay;
        }
    }

    // ------------------------------------------------------------------
    // Attempt handling
    // ------------------------------------------------------------------

    private int startAttemptLocked(List<ConnectionStatus> changes) {
        generation++;
        transitionLocked(ConnectionStatus.CONNECTING, changes);
        return generation;
    }

    private void openAttempt(int attempt) {
        AttemptListener listener = new AttemptListener(attempt);
        log.info("Connecting to {}", props.url());
        try {
            connector.open(props.url(), listener);
        } catch (RuntimeException e) {
            listener.onError(e);
            listener.onClose(ABNORMAL_CLOSURE, e.getMessage());
        }
    }

    private void reconnect() {
        List<ConnectionStatus> changes = new ArrayList<>();
        int attempt;
        synchronized (lock) {
            reconnectTimer = null;
            if (manualClose || session != null || status == ConnectionStatus.CONNECTING) {
                return;
            }
            attempt = startAttemptLocked(changes);
        }
        publish(changes);
        openAttempt(attempt);
    }

    /** Socket gone: reset state and apply the reconnect policy. Bumps the generation. */
    private void handleClosedLocked(int code, String reason, List<ConnectionStatus> changes) {
        generation++;
        session = null;
        clearTimersLocked();
        transitionLocked(ConnectionStatus.DISCONNECTED, changes);
        log.info("Connection closed: {} {}", code, reason);

        if (manualClose) {
            return;
        }
        if (reconnectAttempts < props.maxReconnectAttempts()) {
            scheduleReconnectLocked();
        } else {
            exhausted = true;
            transitionLocked(ConnectionStatus.ERROR, changes);
            log.error("Giving up after {} reconnect attempts; call connect() to resume",
                    reconnectAttempts);
        }
    }

    private void scheduleReconnectLocked() {
        TimerService.cancel(reconnectTimer);
        reconnectAttempts++;
        Duration delay = backoff.delayFor(reconnectAttempts);
        lastReconnectDelay = delay;
        log.info("Scheduling reconnect attempt {}/{} in {} ms",
                reconnectAttempts, props.maxReconnectAttempts(), delay.toMillis());
        meterRegistry.counter("livepipe.transport.reconnects").increment();
        reconnectTimer = timers.schedule(this::reconnect, delay);
    }

    private void startHeartbeatLocked(int attempt) {
        TimerService.cancel(heartbeatTimer);
        heartbeatTimer = timers.scheduleAtFixedRate(() -> heartbeat(attempt),
                props.heartbeatInterval(), props.heartbeatInterval());
    }

    private void heartbeat(int attempt) {
        synchronized (lock) {
            if (attempt != generation || session == null) {
                return;
            }
            sendLocked(codec.ping());
            if (props.pongTimeoutEnabled() && pongDeadline == null) {
                pongDeadline = timers.schedule(() -> pongTimedOut(attempt), props.pongTimeout());
            }
        }
    }

    private void pongTimedOut(int attempt) {
        List<ConnectionStatus> changes = new ArrayList<>();
        SocketSession toClose;
        synchronized (lock) {
            if (attempt != generation || session == null) {
                return;
            }
            pongDeadline = null;
            log.warn("No frame from {} within {} ms of a ping, forcing reconnect",
                    props.url(), props.pongTimeout().toMillis());
            toClose = session;
            handleClosedLocked(PONG_TIMEOUT_CLOSURE, "Pong timeout", changes);
        }
        toClose.close(PONG_TIMEOUT_CLOSURE, "Pong timeout");
        publish(changes);
    }

    private void clearTimersLocked() {
        TimerService.cancel(heartbeatTimer);
        TimerService.cancel(pongDeadline);
        TimerService.cancel(reconnectTimer);
        heartbeatTimer = null;
        pongDeadline   = null;
        reconnectTimer = null;
    }

    private boolean sendLocked(String text) {
        try {
            session.sendText(text);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Send failed on {}: {}", props.url(), e.getMessage());
            return false;
        }
    }

    private void transitionLocked(ConnectionStatus next, List<ConnectionStatus> changes) {
        if (status != next) {
            status = next;
            changes.add(next);
        }
    }

    /** Notify listeners and dispatch a client-local connection_status message per change. */
    private void publish(List<ConnectionStatus> changes) {
        for (ConnectionStatus changed : changes) {
            for (ConnectionStatusListener listener : statusListeners) {
                try {
                    listener.onStatus(changed);
                } catch (RuntimeException e) {
                    log.error("Connection status listener failed: {}", e.getMessage(), e);
                }
            }
            dispatcher.dispatch(Message.of(MessageType.CONNECTION_STATUS,
                    codec.toTree(Map.of("status", changed.wireName(), "source", "client")),
                    timers.now()));
        }
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
    }

    // ------------------------------------------------------------------
    // Per-attempt socket callbacks
    // ------------------------------------------------------------------

    private final class AttemptListener implements SocketListener {

        private final int attempt;

        AttemptListener(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen(SocketSession opened) {
            List<ConnectionStatus> changes = new ArrayList<>();
            synchronized (lock) {
                if (attempt != generation || manualClose) {
                    opened.close(NORMAL_CLOSURE, "Superseded");
                    return;
                }
                session = opened;
                reconnectAttempts = 0;
                exhausted = false;
                transitionLocked(ConnectionStatus.CONNECTED, changes);
                startHeartbeatLocked(attempt);
                for (String channel : subscriptions) {
                    sendLocked(codec.subscribe(channel));
                }
            }
            log.info("Connected to {}", props.url());
            publish(changes);
        }

        @Override
        public void onMessage(String text) {
            synchronized (lock) {
                if (attempt != generation) {
                    return;
                }
                TimerService.cancel(pongDeadline);
                pongDeadline = null;
            }
            Message message;
            try {
                message = codec.decode(text, timers.now());
            } catch (TransportException e) {
                log.warn("Dropping inbound frame: {}", e.getMessage());
                meterRegistry.counter("livepipe.transport.frames.dropped").increment();
                return;
            }
            dispatcher.dispatch(message);
        }

        @Override
        public void onClose(int code, String reason) {
            List<ConnectionStatus> changes = new ArrayList<>();
            synchronized (lock) {
                if (attempt != generation) {
                    return;
                }
                handleClosedLocked(code, reason, changes);
            }
            publish(changes);
        }

        @Override
        public void onError(Throwable error) {
            List<ConnectionStatus> changes = new ArrayList<>();
            synchronized (lock) {
                if (attempt != generation) {
                    return;
                }
                transitionLocked(ConnectionStatus.ERROR, changes);
            }
            log.error("Transport error on {}: {}", props.url(), error.getMessage());
            publish(changes);
        }
    }
}
