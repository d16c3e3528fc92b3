package com.livepipe.realtime.transport;

/**
 * Callback for inbound messages. Runs synchronously on the dispatching
 * thread and must not block.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(Message message);
}
