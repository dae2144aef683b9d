package com.chatsync.core.codec;

import com.chatsync.core.error.MalformedEnvelopeException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.model.HeartbeatRecord;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.MessageKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00.250Z");

    private final MessageCodec codec = new MessageCodec(ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void writesPublicFieldNames() throws Exception {
        Message message = Message.builder()
                .kind(MessageKind.PUBLIC)
                .senderId("alice")
                .senderName("Alice")
                .body("hi")
                .timestamp(T0)
                .build();

        JsonNode json = objectMapper.readTree(codec.encode(message));

        assertThat(json.get("type").asText()).isEqualTo("public");
        assertThat(json.get("user_id").asText()).isEqualTo("alice");
        assertThat(json.get("username").asText()).isEqualTo("Alice");
        assertThat(json.get("message").asText()).isEqualTo("hi");
        assertThat(json.get("message_type").asText()).isEqualTo("text");
        assertThat(json.has("target_id")).isFalse();
        assertThat(codec.decode(codec.encode(message))).isEqualTo(message);
    }

    @Test
    void writesPrivateFieldNamesAndAttachment() throws Exception {
        FileRef fileRef = FileRef.builder()
                .filename("20240601_100000_alice_abcdef12.png")
                .originalName("cat.png")
                .fileType("image")
                .fileSize(42)
                .relativePath("images/20240601_100000_alice_abcdef12.png")
                .build();
        Message message = Message.builder()
                .kind(MessageKind.PRIVATE)
                .senderId("alice")
                .senderName("Alice")
                .targetId("bob")
                .body("[image] cat.png")
                .timestamp(T0)
                .attachment(fileRef)
                .build();

        JsonNode json = objectMapper.readTree(codec.encode(message));

        assertThat(json.get("type").asText()).isEqualTo("private");
        assertThat(json.get("sender_id").asText()).isEqualTo("alice");
        assertThat(json.get("sender_name").asText()).isEqualTo("Alice");
        assertThat(json.get("target_id").asText()).isEqualTo("bob");
        assertThat(json.get("message_type").asText()).isEqualTo("file");
        assertThat(json.get("file_info").get("original_name").asText()).isEqualTo("cat.png");

        Message decoded = codec.decode(codec.encode(message));
        assertThat(decoded.getAttachment()).isEqualTo(fileRef);
        assertThat(decoded.getTargetId()).isEqualTo("bob");
    }

    @Test
    void ignoresUnknownFields() {
        String json = "{\"type\":\"public\",\"user_id\":\"carol\",\"username\":\"Carol\","
                + "\"message\":\"hello\",\"timestamp\":\"2024-06-01T10:00:00Z\","
                + "\"reactions\":[\"+1\"],\"client\":{\"version\":7}}";

        Message message = codec.decode(bytes(json));

        assertThat(message.getSenderId()).isEqualTo("carol");
        assertThat(message.getBody()).isEqualTo("hello");
    }

    @Test
    void readsTimestampsWithoutOffsetInConfiguredZone() {
        MessageCodec shanghai = new MessageCodec(ZoneId.of("Asia/Shanghai"));
        String json = "{\"type\":\"private\",\"sender_id\":\"a\",\"sender_name\":\"A\",\"target_id\":\"b\","
                + "\"message\":\"x\",\"timestamp\":\"2024-06-01T18:00:00.123456\"}";

        Message message = shanghai.decode(bytes(json));

        assertThat(message.getTimestamp()).isEqualTo(Instant.parse("2024-06-01T10:00:00.123456Z"));
    }

    @Test
    void missingTypeIsMalformed() {
        String json = "{\"user_id\":\"a\",\"message\":\"x\",\"timestamp\":\"2024-06-01T10:00:00Z\"}";

        assertThatThrownBy(() -> codec.decode(bytes(json)))
                .isInstanceOf(MalformedEnvelopeException.class)
                .hasMessageContaining("type");
    }

    @Test
    void rejectsBrokenEnvelopes() {
        assertThatThrownBy(() -> codec.decode(bytes("not json")))
                .isInstanceOf(MalformedEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(bytes("[1,2]")))
                .isInstanceOf(MalformedEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(bytes("{\"type\":\"broadcast\",\"user_id\":\"a\","
                + "\"timestamp\":\"2024-06-01T10:00:00Z\"}")))
                .isInstanceOf(MalformedEnvelopeException.class)
                .hasMessageContaining("broadcast");
        assertThatThrownBy(() -> codec.decode(bytes("{\"type\":\"private\",\"sender_id\":\"a\","
                + "\"timestamp\":\"2024-06-01T10:00:00Z\"}")))
                .isInstanceOf(MalformedEnvelopeException.class)
                .hasMessageContaining("target");
        assertThatThrownBy(() -> codec.decode(bytes("{\"type\":\"public\",\"user_id\":\"a\","
                + "\"timestamp\":\"yesterday\"}")))
                .isInstanceOf(MalformedEnvelopeException.class);
    }

    @Test
    void heartbeatDefaultsStatusToOnline() {
        HeartbeatRecord record = codec.decodeHeartbeat(bytes(
                "{\"user_id\":\"bob\",\"username\":\"Bob\",\"last_active\":\"2024-06-01T10:00:00Z\"}"));

        assertThat(record.getStatus()).isEqualTo(HeartbeatRecord.STATUS_ONLINE);
        assertThat(record.getLastActive()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));

        HeartbeatRecord offline = HeartbeatRecord.builder()
                .userId("bob")
                .displayName("Bob")
                .lastActive(T0)
                .status(HeartbeatRecord.STATUS_OFFLINE)
                .build();
        assertThat(codec.decodeHeartbeat(codec.encodeHeartbeat(offline))).isEqualTo(offline);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
