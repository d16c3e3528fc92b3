package com.livepipe.realtime.transport;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Settings of the transport client ({@code livepipe.transport.*}).
 *
 * @param url                  broadcaster endpoint, e.g. ws://localhost:3001/ws
 * @param reconnectInterval    backoff base for the first reconnect
 * @param reconnectMaxDelay    backoff cap
 * @param maxReconnectAttempts consecutive reconnects before status=error
 * @param heartbeatInterval    period of the ping frame while connected
 * @param pongTimeout          silence after a ping that forces a reconnect;
 *                             zero disables the check
 * @param channels             channels subscribed by the startup runner
 */
public record TransportProperties(
        URI          url,
        Duration     reconnectInterval,
        Duration     reconnectMaxDelay,
        int          maxReconnectAttempts,
        Duration     heartbeatInterval,
        Duration     pongTimeout,
        List<String> channels
) {
    public TransportProperties {
        requirePositive(reconnectInterval, "reconnectInterval");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        if (reconnectMaxDelay == null || reconnectMaxDelay.compareTo(reconnectInterval) < 0) {
            throw new IllegalArgumentException("reconnectMaxDelay must be at least reconnectInterval");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
        }
        if (pongTimeout == null) pongTimeout = Duration.ZERO;
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public static TransportProperties defaults(URI url) {
        return new TransportProperties(url,
                Duration.ofSeconds(3), Duration.ofSeconds(30), 10,
                Duration.ofSeconds(30), Duration.ZERO, List.of("pipeline"));
    }

    public boolean pongTimeoutEnabled() {
        return !pongTimeout.isZero() && !pongTimeout.isNegative();
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
