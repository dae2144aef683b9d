package com.chatsync.core.codec;

import com.chatsync.core.error.MalformedEnvelopeException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.model.HeartbeatRecord;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.MessageKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * JSON codec for the files written to shared storage: messages and heartbeat records.
 *
 * <p>Decoding ignores fields it does not know. A missing or unknown {@code type}, a missing
 * sender or an unreadable timestamp is a {@link MalformedEnvelopeException}. Timestamps written
 * without an offset are read in the configured zone.</p>
 */
public class MessageCodec {

    static final String TYPE = "type";
    static final String USER_ID = "user_id";
    static final String USERNAME = "username";
    static final String SENDER_ID = "sender_id";
    static final String SENDER_NAME = "sender_name";
    static final String TARGET_ID = "target_id";
    static final String MESSAGE = "message";
    static final String TIMESTAMP = "timestamp";
    static final String MESSAGE_TYPE = "message_type";
    static final String FILE_INFO = "file_info";
    static final String LAST_ACTIVE = "last_active";
    static final String STATUS = "status";

    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public MessageCodec(ObjectMapper objectMapper, ZoneId zone) {
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    public MessageCodec(ZoneId zone) {
        this(ChatJson.newObjectMapper(), zone);
    }

    public byte[] encode(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE, message.getKind().getWireName());
        if (message.isPrivate()) {
            node.put(SENDER_ID, message.getSenderId());
            node.put(SENDER_NAME, message.getSenderName());
            node.put(TARGET_ID, message.getTargetId());
        } else {
            node.put(USER_ID, message.getSenderId());
            node.put(USERNAME, message.getSenderName());
        }
        node.put(MESSAGE, message.getBody());
        node.put(TIMESTAMP, formatTimestamp(message.getTimestamp()));
        node.put(MESSAGE_TYPE, message.hasAttachment() ? "file" : "text");
        if (message.hasAttachment()) {
            node.set(FILE_INFO, objectMapper.valueToTree(message.getAttachment()));
        }
        return write(node);
    }

    public Message decode(byte[] content) {
        JsonNode node = read(content);

        String type = text(node, TYPE);
        if (type == null) {
            throw new MalformedEnvelopeException("Message has no type");
        }
        MessageKind kind = MessageKind.fromWireName(type);
        if (kind == null) {
            throw new MalformedEnvelopeException("Unknown message type: " + type);
        }

        String senderId = firstText(node, SENDER_ID, USER_ID);
        if (senderId == null || senderId.isEmpty()) {
            throw new MalformedEnvelopeException("Message has no sender");
        }
        String targetId = text(node, TARGET_ID);
        if (kind == MessageKind.PRIVATE && (targetId == null || targetId.isEmpty())) {
            throw new MalformedEnvelopeException("Private message has no target");
        }

        String senderName = firstText(node, SENDER_NAME, USERNAME);
        String body = text(node, MESSAGE);

        FileRef attachment = null;
        JsonNode fileInfo = node.get(FILE_INFO);
        if (fileInfo != null && fileInfo.isObject()) {
            try {
                attachment = objectMapper.treeToValue(fileInfo, FileRef.class);
            } catch (JsonProcessingException e) {
                throw new MalformedEnvelopeException("Unreadable file_info: " + e.getOriginalMessage(), e);
            }
        }

        return Message.builder()
                .kind(kind)
                .senderId(senderId)
                .senderName(senderName != null ? senderName : senderId)
                .targetId(kind == MessageKind.PRIVATE ? targetId : null)
                .body(body != null ? body : "")
                .timestamp(requireTimestamp(node, TIMESTAMP))
                .attachment(attachment)
                .build();
    }

    public byte[] encodeHeartbeat(HeartbeatRecord record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(USER_ID, record.getUserId());
        node.put(USERNAME, record.getDisplayName());
        node.put(LAST_ACTIVE, formatTimestamp(record.getLastActive()));
        node.put(STATUS, record.getStatus());
        return write(node);
    }

    public HeartbeatRecord decodeHeartbeat(byte[] content) {
        JsonNode node = read(content);

        String userId = text(node, USER_ID);
        if (userId == null || userId.isEmpty()) {
            throw new MalformedEnvelopeException("Heartbeat has no user_id");
        }
        String username = text(node, USERNAME);
        String status = text(node, STATUS);

        return HeartbeatRecord.builder()
                .userId(userId)
                .displayName(username != null ? username : userId)
                .lastActive(requireTimestamp(node, LAST_ACTIVE))
                .status(status != null ? status : HeartbeatRecord.STATUS_ONLINE)
                .build();
    }

    public String formatTimestamp(Instant timestamp) {
        return OffsetDateTime.ofInstant(timestamp, zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    /**
     * Accepts ISO-8601 with or without an offset.
     */
    public Instant parseTimestamp(String text) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }

    private Instant requireTimestamp(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isEmpty()) {
            throw new MalformedEnvelopeException("Missing " + field);
        }
        try {
            return parseTimestamp(value);
        } catch (DateTimeParseException e) {
            throw new MalformedEnvelopeException("Invalid " + field + ": " + value, e);
        }
    }

    private JsonNode read(byte[] content) {
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                throw new MalformedEnvelopeException("Expected a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private byte[] write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // Only plain text nodes are written, so this is a programming error
            throw new IllegalStateException("Failed to serialize " + node, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String firstText(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value != null ? value : text(node, fallback);
    }
}
