package com.livepipe.realtime.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;

/**
 * {@link SocketConnector} on Spring's WebSocket client (JSR-356 under the hood
 * when given a {@code StandardWebSocketClient}).
 */
public class SpringWebSocketConnector implements SocketConnector {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketConnector.class);

    private static final int SEND_TIME_LIMIT_MS  = 5_000;
    private static final int BUFFER_SIZE_LIMIT   = 64 * 1024;
    private static final int HANDSHAKE_FAILED    = 1006;

    private final WebSocketClient client;

    public SpringWebSocketConnector(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public void open(URI uri, SocketListener listener) {
        try {
            client.execute(new ListenerAdapter(listener), new WebSocketHttpHeaders(), uri)
                    .whenComplete((session, error) -> {
                        if (error != null) {
                            listener.onError(error);
                            listener.onClose(HANDSHAKE_FAILED, "Handshake failed: " + error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            throw new TransportException(TransportException.Kind.CONNECT_FAILED,
                    "Cannot open " + uri + ": " + e.getMessage(), e);
        }
    }

    private static final class ListenerAdapter extends TextWebSocketHandler {

        private final SocketListener listener;

        ListenerAdapter(SocketListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen(new SpringSocketSession(
                    new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT)));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode(), status.getReason());
        }
    }

    private record SpringSocketSession(WebSocketSession session) implements SocketSession {

        @Override
        public void sendText(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public void close(int code, String reason) {
            try {
                session.close(new CloseStatus(code, reason));
            } catch (IOException e) {
                log.warn("Closing session {} failed: {}", session.getId(), e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
