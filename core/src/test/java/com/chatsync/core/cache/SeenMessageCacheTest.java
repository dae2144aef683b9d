package com.chatsync.core.cache;

import com.chatsync.core.codec.MessageIdFormat;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeenMessageCacheTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private final MessageIdFormat idFormat = new MessageIdFormat();

    @Test
    void returnsUnseenMessagesSortedByTimestamp() {
        SeenMessageCache cache = new SeenMessageCache(100);
        Message m1 = message("alice", "t1", 1);
        Message m2 = message("bob", "t2", 2);
        Message m3 = message("carol", "t3", 3);

        List<Message> delivered = cache.filterNew(List.of(m3, m1, m2));

        assertThat(bodies(delivered)).containsExactly("t1", "t2", "t3");
    }

    @Test
    void neverDeliversTheSameIdTwice() {
        SeenMessageCache cache = new SeenMessageCache(100);
        Message m1 = message("alice", "hello", 1);

        assertThat(cache.filterNew(List.of(m1, m1))).hasSize(1);
        assertThat(cache.filterNew(List.of(m1))).isEmpty();
        assertThat(cache.contains(m1.getId())).isTrue();
    }

    @Test
    void trimmingKeepsEvictedIdsSeen() {
        SeenMessageCache cache = new SeenMessageCache(10);
        List<Message> batch = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            batch.add(message("u" + i, "m" + i, i));
        }

        assertThat(cache.filterNew(batch)).hasSize(25);

        assertThat(cache.size()).isLessThanOrEqualTo(10);
        assertThat(cache.getLowWaterMark()).isNotNull();
        assertThat(cache.filterNew(batch)).isEmpty();
        for (Message message : batch) {
            assertThat(cache.contains(message.getId())).isTrue();
        }
    }

    @Test
    void markSeenTrimsOldestHalf() {
        SeenMessageCache cache = new SeenMessageCache(4);
        for (int i = 0; i < 5; i++) {
            assertThat(cache.markSeen(message("u", "m" + i, i).getId())).isTrue();
        }

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.markSeen(message("u", "m0", 0).getId())).isFalse();
        assertThat(cache.markSeen(message("u", "m9", 9).getId())).isTrue();
    }

    @Test
    void rejectsTinyCapacity() {
        assertThatThrownBy(() -> new SeenMessageCache(1)).isInstanceOf(IllegalArgumentException.class);
    }

    private Message message(String sender, String body, int offsetSeconds) {
        Instant timestamp = T0.plusSeconds(offsetSeconds);
        return Message.builder()
                .id(idFormat.create(timestamp, sender))
                .kind(MessageKind.PUBLIC)
                .senderId(sender)
                .senderName(sender)
                .body(body)
                .timestamp(timestamp)
                .build();
    }

    private static List<String> bodies(List<Message> messages) {
        return messages.stream().map(Message::getBody).collect(Collectors.toList());
    }
}
