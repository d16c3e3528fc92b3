package com.livepipe.realtime.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private static final Instant RECEIVED = Instant.parse("2024-01-20T10:00:00Z");

    ObjectMapper json  = new ObjectMapper();
    MessageCodec codec = new MessageCodec(json);

    @Test
    void decode_fullEnvelope() {
        Message m = codec.decode("""
                {"type":"pipeline_update","data":{"progress":40},
                 "timestamp":"2024-01-20T10:30:00Z","id":"abc"}
                """, RECEIVED);

        assertThat(m.type()).isEqualTo("pipeline_update");
        assertThat(m.kind()).contains(MessageType.PIPELINE_UPDATE);
        assertThat(m.data().get("progress").asInt()).isEqualTo(40);
        assertThat(m.timestamp()).isEqualTo(Instant.parse("2024-01-20T10:30:00Z"));
        assertThat(m.id()).isEqualTo("abc");
    }

    @Test
    void decode_missingTimestampUsesReceiptTime() {
        Message m = codec.decode("{\"type\":\"error\",\"data\":\"oops\"}", RECEIVED);

        assertThat(m.timestamp()).isEqualTo(RECEIVED);
        assertThat(m.id()).isNull();
    }

    @Test
    void decode_unknownTypeIsKeptRaw() {
        Message m = codec.decode("{\"type\":\"custom_event\"}", RECEIVED);

        assertThat(m.type()).isEqualTo("custom_event");
        assertThat(m.kind()).isEmpty();
        assertThat(m.data().isNull()).isTrue();
    }

    @Test
    void decode_rejectsNonJson() {
        assertThatThrownBy(() -> codec.decode("not json", RECEIVED))
                .isInstanceOf(TransportException.class)
                .extracting(e -> ((TransportException) e).getKind())
                .isEqualTo(TransportException.Kind.MALFORMED_FRAME);
    }

    @Test
    void decode_rejectsMissingTypeAndBadTimestamp() {
        assertThatThrownBy(() -> codec.decode("{\"data\":1}", RECEIVED))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("no message type");
        assertThatThrownBy(() -> codec.decode("[1,2]", RECEIVED))
                .isInstanceOf(TransportException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"error\",\"timestamp\":\"yesterday\"}", RECEIVED))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Bad timestamp");
    }

    @Test
    void controlFrames() throws Exception {
        JsonNode subscribe = json.readTree(codec.subscribe("pipeline"));
        JsonNode ping      = json.readTree(codec.ping());

        assertThat(subscribe.get("type").asText()).isEqualTo("subscribe");
        assertThat(subscribe.get("channel").asText()).isEqualTo("pipeline");
        assertThat(codec.unsubscribe("pipeline")).isEqualTo("{\"type\":\"unsubscribe\",\"channel\":\"pipeline\"}");
        assertThat(ping.get("type").asText()).isEqualTo("ping");
        assertThat(ping.has("channel")).isFalse();
    }

    @Test
    void encode_addsChannelAndIsoTimestamp() throws Exception {
        Message m = new Message("pipeline_update", codec.toTree(Map.of("progress", 100)),
                Instant.parse("2024-01-20T10:30:00Z"), "id-1");

        JsonNode node = json.readTree(codec.encode(m, "pipeline"));

        assertThat(node.get("type").asText()).isEqualTo("pipeline_update");
        assertThat(node.get("channel").asText()).isEqualTo("pipeline");
        assertThat(node.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
        assertThat(node.get("id").asText()).isEqualTo("id-1");
        assertThat(node.at("/data/progress").asInt()).isEqualTo(100);
    }

    @Test
    void write_passesStringsThrough() {
        assertThat(codec.write("{\"raw\":true}")).isEqualTo("{\"raw\":true}");
        assertThat(codec.write(Map.of("a", 1))).isEqualTo("{\"a\":1}");
    }
}
