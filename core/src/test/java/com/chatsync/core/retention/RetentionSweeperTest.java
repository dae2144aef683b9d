package com.chatsync.core.retention;

import com.chatsync.core.MutableClock;
import com.chatsync.core.channel.ShareChannelStore;
import com.chatsync.core.codec.ChatJson;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.codec.MessageIdFormat;
import com.chatsync.core.presence.HeartbeatPresenceRegistry;
import com.chatsync.core.storage.FileSystemObjectStore;
import com.chatsync.core.storage.ObjectStore;
import com.chatsync.core.storage.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetentionSweeperTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    @TempDir
    Path root;

    private MutableClock clock;
    private ObjectStore store;
    private MessageCodec codec;
    private MessageIdFormat idFormat;
    private ShareChannelStore channelStore;
    private HeartbeatPresenceRegistry presence;
    private RetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new FileSystemObjectStore(root);
        codec = new MessageCodec(ZoneOffset.UTC);
        idFormat = new MessageIdFormat();
        channelStore = new ShareChannelStore(store, codec, idFormat, clock);
        presence = new HeartbeatPresenceRegistry(store, codec, clock);
        sweeper = new RetentionSweeper(store, codec, idFormat,
                new SweepHistory(store, ChatJson.newObjectMapper()), clock);
    }

    @Test
    void removesEverythingOlderThanTheCutoff() throws IOException {
        channelStore.sendPublic("alice", "Alice", "old public");
        channelStore.sendPrivate("alice", "Alice", "bob", "old private");
        channelStore.sendPrivate("carol", "Carol", "dave", "old private 2");
        presence.heartbeat("alice", "Alice");

        clock.advance(Duration.ofHours(30));
        channelStore.sendPublic("bob", "Bob", "new public");
        channelStore.sendPrivate("bob", "Bob", "alice", "new private");
        presence.heartbeat("bob", "Bob");

        Instant cutoff = T0.plus(Duration.ofHours(24));
        SweepReport report = sweeper.sweep(cutoff);

        assertThat(report.getPublicDeleted()).isEqualTo(1);
        assertThat(report.getPrivateDeleted()).isEqualTo(2);
        assertThat(report.getHeartbeatsDeleted()).isEqualTo(1);
        assertThat(report.getDeleted()).isEqualTo(4);
        assertThat(report.getDirectoriesRemoved()).isEqualTo(1);
        assertThat(report.getFailed()).isZero();

        assertThat(root.resolve("private/carol_dave")).doesNotExist();
        assertThat(root.resolve("private/alice_bob")).isDirectory();
        for (StoredObject object : store.list("public")) {
            assertThat(idFormat.parse(object.getName()).orElseThrow().getTimestamp()).isAfterOrEqualTo(cutoff);
        }
        assertThat(store.list("users")).extracting(StoredObject::getName).containsExactly("bob_heartbeat.json");
    }

    @Test
    void sweepingTwiceDeletesNothingMore() {
        channelStore.sendPublic("alice", "Alice", "old");
        channelStore.sendPrivate("alice", "Alice", "bob", "old");
        presence.heartbeat("alice", "Alice");
        clock.advance(Duration.ofDays(2));
        channelStore.sendPublic("alice", "Alice", "fresh");

        Instant cutoff = clock.instant().minus(Duration.ofDays(1));

        assertThat(sweeper.sweep(cutoff).getDeleted()).isEqualTo(3);
        SweepReport second = sweeper.sweep(cutoff);
        assertThat(second.getDeleted()).isZero();
        assertThat(second.getDirectoriesRemoved()).isZero();
    }

    @Test
    void continuesPastEntriesThatCannotBeDeleted() throws IOException {
        ObjectStore flaky = mock(ObjectStore.class);
        Instant old = T0.minus(Duration.ofDays(3));
        StoredObject first = object("public", idFormat.create(old, "a").getFileName(), old);
        StoredObject second = object("public", idFormat.create(old.plusSeconds(1), "b").getFileName(), old);
        when(flaky.list("public")).thenReturn(List.of(first, second));
        when(flaky.list("users")).thenThrow(new IOException("permission denied"));
        when(flaky.listDirectories("private")).thenReturn(List.of());
        when(flaky.delete(first.getKey())).thenThrow(new IOException("locked"));
        when(flaky.delete(second.getKey())).thenReturn(true);
        when(flaky.describe()).thenReturn("flaky");

        RetentionSweeper flakySweeper = new RetentionSweeper(flaky, codec, idFormat,
                new SweepHistory(flaky, ChatJson.newObjectMapper()), clock);
        SweepReport report = flakySweeper.sweep(T0);

        assertThat(report.getPublicDeleted()).isEqualTo(1);
        assertThat(report.getFailed()).isEqualTo(2);
    }

    @Test
    void heartbeatsFallBackToModificationTime() throws IOException {
        Files.createDirectories(root.resolve("users"));
        Path broken = root.resolve("users/ghost_heartbeat.json");
        Files.writeString(broken, "garbage");
        Files.setLastModifiedTime(broken, FileTime.from(T0.minus(Duration.ofDays(5))));

        assertThat(sweeper.sweep(T0.minus(Duration.ofDays(1))).getHeartbeatsDeleted()).isEqualTo(1);
        assertThat(broken).doesNotExist();
    }

    @Test
    void recordsRunsAndKeepsTheLastThirty() throws IOException {
        SweepHistory history = new SweepHistory(store, ChatJson.newObjectMapper());
        channelStore.sendPublic("alice", "Alice", "old");
        clock.advance(Duration.ofDays(2));

        SweepReport report = sweeper.sweepOlderThan(Duration.ofDays(1));

        assertThat(report.getDeleted()).isEqualTo(1);
        List<SweepHistory.Entry> entries = history.read();
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getDeletedFiles()).isEqualTo(1);
        assertThat(entries.get(0).getDaysKept()).isEqualTo(1.0);

        for (int i = 0; i < 35; i++) {
            sweeper.sweepOlderThan(Duration.ofDays(1));
        }
        assertThat(history.read()).hasSize(SweepHistory.MAX_ENTRIES);
        assertThat(store.list("logs")).extracting(StoredObject::getName).containsExactly("cleanup_stats.json");
    }

    private static StoredObject object(String directory, String name, Instant modified) {
        return new StoredObject(directory + "/" + name, name, modified, 10);
    }
}
