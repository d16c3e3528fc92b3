package com.livepipe.realtime.transport;

/**
 * Socket events for one connection attempt.
 *
 * A failed attempt reports {@link #onError} followed by {@link #onClose};
 * {@link #onOpen} is never called for it.
 */
public interface SocketListener {

    void onOpen(SocketSession session);

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
