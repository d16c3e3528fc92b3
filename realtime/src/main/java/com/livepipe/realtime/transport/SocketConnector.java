package com.livepipe.realtime.transport;

import java.net.URI;

/**
 * Opens sockets for the {@link ReconnectingTransportClient}.
 *
 * Implementations return immediately and report the outcome through the
 * listener, possibly from another thread.
 */
public interface SocketConnector {

    /**
     * Start one connection attempt.
     *
     * @throws TransportException of kind CONNECT_FAILED if the attempt cannot
     *         even be started (bad URI, client shut down)
     */
    void open(URI uri, SocketListener listener);
}
