package com.livepipe.realtime.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One envelope on the wire: {@code {type, data, timestamp, id?}}.
 *
 * {@code type} keeps the raw wire string so messages of kinds this client
 * does not know still reach wildcard handlers.
 */
public record Message(String type, JsonNode data, Instant timestamp, String id) {

    public Message {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (data == null) data = NullNode.getInstance();
    }

    public static Message of(MessageType type, JsonNode data, Instant timestamp) {
        return new Message(type.wireName(), data, timestamp, null);
    }

    /** The routed kind, empty for types this client does not know. */
    public Optional<MessageType> kind() {
        return MessageType.fromWire(type);
    }
}
