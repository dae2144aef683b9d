package com.chatsync.core.codec;

import com.chatsync.core.model.MessageId;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Formats and parses message storage names. The stamp is always rendered in UTC so that names
 * sort lexicographically in time order, also across daylight saving transitions.
 */
public class MessageIdFormat {

    private static final String STAMP_PATTERN = "uuuuMMdd_HHmmss_SSS";
    private static final int STAMP_LENGTH = 19;

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern(STAMP_PATTERN).withZone(ZoneOffset.UTC);

    public MessageId create(Instant timestamp, String senderId) {
        Instant millis = timestamp.truncatedTo(ChronoUnit.MILLIS);
        String name = MessageId.PREFIX + FORMATTER.format(millis) + "_" + senderId;
        return new MessageId(name, millis, senderId);
    }

    /**
     * Parses a file name such as {@code msg_20240101_120000_123_alice.json}.
     *
     * @return empty if the name is not a message name
     */
    public Optional<MessageId> parse(String fileName) {
        if (!fileName.startsWith(MessageId.PREFIX) || !fileName.endsWith(MessageId.SUFFIX)) {
            return Optional.empty();
        }
        String name = fileName.substring(0, fileName.length() - MessageId.SUFFIX.length());
        String rest = name.substring(MessageId.PREFIX.length());
        if (rest.length() < STAMP_LENGTH + 2 || rest.charAt(STAMP_LENGTH) != '_') {
            return Optional.empty();
        }

        try {
            LocalDateTime stamp = LocalDateTime.parse(rest.substring(0, STAMP_LENGTH), FORMATTER);
            Instant timestamp = stamp.toInstant(ZoneOffset.UTC);
            return Optional.of(new MessageId(name, timestamp, rest.substring(STAMP_LENGTH + 1)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
