package com.livepipe.realtime.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * JSON encoding of the wire envelope and of client control frames.
 *
 * Timestamps travel as ISO-8601 strings. An inbound frame without a
 * timestamp is stamped with the receipt time; one with an unparsable
 * timestamp is malformed.
 */
public class MessageCodec {

    private final ObjectMapper json;

    public MessageCodec(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * Parse an inbound text frame.
     *
     * @throws TransportException of kind MALFORMED_FRAME for anything that is
     *         not a JSON object with a textual {@code type}
     */
    public Message decode(String frame, Instant receivedAt) {
        JsonNode root;
        try {
            root = json.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new TransportException(TransportException.Kind.MALFORMED_FRAME,
                    "Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new TransportException(TransportException.Kind.MALFORMED_FRAME,
                    "Frame is not a JSON object");
        }
        JsonNode type = root.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new TransportException(TransportException.Kind.MALFORMED_FRAME,
                    "Frame has no message type");
        }

        Instant timestamp = receivedAt;
        JsonNode ts = root.get("timestamp");
        if (ts != null && !ts.isNull()) {
            try {
                timestamp = Instant.parse(ts.asText());
            } catch (DateTimeException e) {
                throw new TransportException(TransportException.Kind.MALFORMED_FRAME,
                        "Bad timestamp '" + ts.asText() + "'", e);
            }
        }

        JsonNode id = root.get("id");
        return new Message(
                type.asText(),
                root.get("data"),
                timestamp,
                id != null && id.isTextual() ? id.asText() : null);
    }

    /** Serialise an envelope; {@code channel} is added when non-null. */
    public String encode(Message message, String channel) {
        ObjectNode node = json.createObjectNode();
        node.put("type", message.type());
        if (channel != null) node.put("channel", channel);
        node.set("data", message.data());
        node.put("timestamp", message.timestamp().toString());
        if (message.id() != null) node.put("id", message.id());
        return write(node);
    }

    public String subscribe(String channel) {
        return control("subscribe", channel);
    }

    public String unsubscribe(String channel) {
        return control("unsubscribe", channel);
    }

    public String ping() {
        return control("ping", null);
    }

    /** Serialise an arbitrary payload for {@link TransportClient#send(Object)}. */
    public String write(Object payload) {
        if (payload instanceof String s) {
            return s;
        }
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TransportException(TransportException.Kind.SEND_FAILED,
                    "Payload is not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private String control(String type, String channel) {
        ObjectNode node = json.createObjectNode();
        node.put("type", type);
        if (channel != null) node.put("channel", channel);
        return write(node);
    }

    public JsonNode toTree(Object value) {
        return json.valueToTree(value);
    }
}
