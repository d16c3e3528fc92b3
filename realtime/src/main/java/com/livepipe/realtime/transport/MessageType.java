package com.livepipe.realtime.transport;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of server → client messages the client knows how to route.
 *
 * Handlers are registered per kind; the wildcard ({@code *}) has its own
 * registration list in {@link MessageDispatcher}.
 */
public enum MessageType {
    PIPELINE_UPDATE("pipeline_update"),
    TEST_UPDATE("test_update"),
    ERROR("error"),
    CONNECTION_STATUS("connection_status");   // also synthesised locally on status changes

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String type) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(type))
                .findFirst();
    }
}
