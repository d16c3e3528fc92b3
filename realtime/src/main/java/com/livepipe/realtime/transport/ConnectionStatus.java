package com.livepipe.realtime.transport;

import java.util.Locale;

/**
 * Status of the client's logical connection.
 *
 * Transitions:
 *   DISCONNECTED → CONNECTING   (connect() or backoff timer fired)
 *   CONNECTING   → CONNECTED    (socket open)
 *   CONNECTED    → DISCONNECTED (close, manual or not)
 *   any          → ERROR        (socket error, or reconnect budget exhausted)
 */
public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
