package com.livepipe.realtime.transport;

@FunctionalInterface
public interface ConnectionStatusListener {
    void onStatus(ConnectionStatus status);
}
