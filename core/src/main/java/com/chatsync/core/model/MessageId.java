package com.chatsync.core.model;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

/**
 * Storage name of a message ({@code msg_<yyyyMMdd_HHmmss_SSS>_<senderId>}) together with the
 * instant and sender it encodes. Ordered by time first, then by name.
 */
@Value
public class MessageId implements Comparable<MessageId> {

    public static final String PREFIX = "msg_";
    public static final String SUFFIX = ".json";

    private static final Comparator<MessageId> ORDER = Comparator
            .comparing(MessageId::getTimestamp)
            .thenComparing(MessageId::getName);

    @NonNull
    String name;

    @NonNull
    Instant timestamp;

    @NonNull
    String senderId;

    public String getFileName() {
        return name + SUFFIX;
    }

    @Override
    public int compareTo(MessageId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name;
    }
}
