package com.chatsync.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A chat message as written to shared storage. Never mutated once written.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    /** Storage identity; null until the message has been written or read back. */
    MessageId id;

    MessageKind kind;

    String senderId;

    String senderName;

    /** Recipient of a private message, null for public ones. */
    String targetId;

    String body;

    Instant timestamp;

    FileRef attachment;

    public boolean isPrivate() {
        return kind == MessageKind.PRIVATE;
    }

    public boolean hasAttachment() {
        return attachment != null;
    }

    /**
     * Public messages are visible to everyone; private ones only to their two parties.
     */
    public boolean isVisibleTo(String userId) {
        if (!isPrivate()) {
            return true;
        }
        return userId.equals(senderId) || userId.equals(targetId);
    }
}
