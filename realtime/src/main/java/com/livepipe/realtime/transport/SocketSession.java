package com.livepipe.realtime.transport;

import java.io.IOException;

/**
 * An open duplex text socket, as handed to {@link SocketListener#onOpen}.
 */
public interface SocketSession {

    void sendText(String text) throws IOException;

    void close(int code, String reason);

    boolean isOpen();
}
