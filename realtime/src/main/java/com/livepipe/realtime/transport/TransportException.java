package com.livepipe.realtime.transport;

/**
 * Failure inside the transport layer.
 *
 * Never crosses the {@link TransportClient} boundary: the client logs it and
 * reflects it in {@link ConnectionStatus}.
 */
public class TransportException extends RuntimeException {

    public enum Kind { CONNECT_FAILED, MALFORMED_FRAME, SEND_FAILED }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
