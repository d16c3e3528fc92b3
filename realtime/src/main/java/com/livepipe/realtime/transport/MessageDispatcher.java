package com.livepipe.realtime.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Routes inbound messages to the handlers registered for their
 * {@link MessageType}, then to the wildcard handlers.
 *
 * Delivery is synchronous and in registration order. Each handler call is
 * isolated, so a throwing handler cannot block the ones after it.
 * Registration may happen from any thread; dispatch iterates a snapshot.
 */
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final Map<MessageType, Set<MessageHandler>> handlers = new EnumMap<>(MessageType.class);
    private final Set<MessageHandler> wildcardHandlers = new CopyOnWriteArraySet<>();

    public MessageDispatcher() {
        for (MessageType type : MessageType.values()) {
            handlers.put(type, new CopyOnWriteArraySet<>());
        }
    }

    public void on(MessageType type, MessageHandler handler) {
        handlers.get(type).add(handler);
    }

    public void off(MessageType type, MessageHandler handler) {
        handlers.get(type).remove(handler);
    }

    public void onAny(MessageHandler handler) {
        wildcardHandlers.add(handler);
    }

    public void offAny(MessageHandler handler) {
        wildcardHandlers.remove(handler);
    }

    public void dispatch(Message message) {
        message.kind().ifPresent(kind -> {
            for (MessageHandler handler : handlers.get(kind)) {
                invoke(handler, message, kind.wireName());
            }
        });
        for (MessageHandler handler : wildcardHandlers) {
            invoke(handler, message, "*");
        }
    }

    /** Number of handlers registered for {@code type}, not counting wildcards. */
    public int handlerCount(MessageType type) {
        return handlers.get(type).size();
    }

    private static void invoke(MessageHandler handler, Message message, String registration) {
        try {
            handler.handle(message);
        } catch (RuntimeException e) {
            log.error("Handler for '{}' failed on {} message: {}",
                    registration, message.type(), e.getMessage(), e);
        }
    }
}
