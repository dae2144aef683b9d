package com.chatsync.client;

import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.config.StorageKind;
import com.chatsync.core.sync.ShareChatRoom;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ChatClientApplicationTest {

    @TempDir
    Path root;

    private final StringWriter out = new StringWriter();

    @Test
    void storageOptionsMapOntoShareConfig() {
        StorageOptions options = new StorageOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(
                "--storage", "s3", "--bucket", "team-chat", "--endpoint", "http://localhost:9000",
                "--path-style", "--sync-interval", "5", "--presence-ttl", "120", "--cache-capacity", "50");

        ShareConfig config = options.toShareConfig();

        assertThat(config.getStorageKind()).isEqualTo(StorageKind.S3);
        assertThat(config.getBucket()).isEqualTo("team-chat");
        assertThat(config.getPrefix()).isEqualTo("chat-room");
        assertThat(config.getEndpoint()).isEqualTo("http://localhost:9000");
        assertThat(config.isPathStyleAccess()).isTrue();
        assertThat(config.getSyncInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getPresenceTtl()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.getCacheCapacity()).isEqualTo(50);
    }

    @Test
    void statsCountsTheRoom() {
        ShareChatRoom room = ShareChatRoom.open(ShareConfig.builder().rootPath(root).zone(ZoneOffset.UTC).build());
        room.getChannelStore().sendPublic("alice", "Alice", "hi");
        room.getChannelStore().sendPrivate("alice", "Alice", "bob", "secret");
        room.getPresence().heartbeat("alice", "Alice");

        int exitCode = run("stats", "--root", root.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Public messages:  1")
                .contains("Private messages: 1")
                .contains("Heartbeats:       1")
                .contains("Online users:     1");
    }

    @Test
    void sweepRemovesOldFilesAndRecordsTheRun() throws Exception {
        Path oldMessage = root.resolve("public/msg_20200101_000000_000_alice.json");
        Files.createDirectories(oldMessage.getParent());
        Files.writeString(oldMessage, "{\"type\":\"public\",\"user_id\":\"alice\",\"username\":\"Alice\","
                + "\"message\":\"old\",\"timestamp\":\"2020-01-01T00:00:00Z\"}");

        int exitCode = run("sweep", "--root", root.toString(), "--days", "1");

        assertThat(exitCode).isZero();
        assertThat(oldMessage).doesNotExist();
        assertThat(out.toString()).contains("Removed 1 files");
        assertThat(root.resolve("logs/cleanup_stats.json")).exists();
    }

    @Test
    void missingRootIsReported() {
        int exitCode = run("stats");

        assertThat(exitCode).isNotZero();
    }

    private int run(String... args) {
        CommandLine commandLine = ChatClientApplication.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
        return commandLine.execute(args);
    }
}
