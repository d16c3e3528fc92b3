package com.livepipe.realtime.transport;

import java.util.Set;

/**
 * One logical duplex connection to the broadcaster.
 *
 * Nothing here throws on transport trouble: failures show up only as
 * {@link ConnectionStatus} changes.
 */
public interface TransportClient {

    /** Open the connection; no-op while already connected or connecting. */
    void connect();

    /** Close for good: no auto-reconnect, timers cleared, subscriptions dropped. */
    void disconnect();

    void subscribe(String channel);

    void unsubscribe(String channel);

    void on(MessageType type, MessageHandler handler);

    void off(MessageType type, MessageHandler handler);

    /** Register for every inbound message regardless of type ({@code *}). */
    void onAny(MessageHandler handler);

    void offAny(MessageHandler handler);

    void onConnectionStatus(ConnectionStatusListener listener);

    void offConnectionStatus(ConnectionStatusListener listener);

    /**
     * Send a payload (serialised to JSON unless it is already a String).
     *
     * @return false if the payload was dropped because the client is not connected
     */
    boolean send(Object payload);

    ConnectionStatus getStatus();

    boolean isConnected();

    /** Snapshot of the retained subscription set. */
    Set<String> subscriptions();
}
