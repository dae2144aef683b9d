package com.chatsync.core.attachment;

import com.chatsync.core.MutableClock;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.error.AttachmentRejectedException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.storage.FileSystemObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentStoreTest {

    @TempDir
    Path root;

    @TempDir
    Path local;

    private AttachmentStore attachments;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
        attachments = new AttachmentStore(new FileSystemObjectStore(root), new MessageCodec(ZoneOffset.UTC),
                clock);
    }

    @Test
    void imagesAndDocumentsGoToSeparateDirectories() throws Exception {
        Path image = Files.writeString(local.resolve("Cat.PNG"), "fake png");
        Path report = Files.writeString(local.resolve("report.pdf"), "fake pdf");

        FileRef imageRef = attachments.upload(image, "alice", "Alice");
        FileRef reportRef = attachments.upload(report, "alice", "Alice");

        assertThat(imageRef.getFileType()).isEqualTo("image");
        assertThat(imageRef.getRelativePath()).startsWith("images/20240601_100000_alice_").endsWith(".png");
        assertThat(imageRef.getFileHash()).hasSize(32);
        assertThat(imageRef.getFileSize()).isEqualTo(8);
        assertThat(imageRef.getOriginalName()).isEqualTo("Cat.PNG");
        assertThat(reportRef.getFileType()).isEqualTo("file");
        assertThat(root.resolve(reportRef.getRelativePath())).exists();
    }

    @Test
    void downloadRestoresTheOriginalName() throws Exception {
        Path notes = Files.writeString(local.resolve("notes.txt"), "remember the milk");
        FileRef ref = attachments.upload(notes, "bob", "Bob");
        Path downloads = local.resolve("downloads");

        Path downloaded = attachments.download(ref, downloads);

        assertThat(downloaded.getFileName().toString()).isEqualTo("notes.txt");
        assertThat(Files.readString(downloaded)).isEqualTo("remember the milk");
    }

    @Test
    void tamperedContentFailsTheChecksum() throws Exception {
        Path notes = Files.writeString(local.resolve("notes.txt"), "original");
        FileRef ref = attachments.upload(notes, "bob", "Bob");
        Files.writeString(root.resolve(ref.getRelativePath()), "changed");

        assertThatThrownBy(() -> attachments.download(ref, local.resolve("out")))
                .isInstanceOf(AttachmentRejectedException.class)
                .hasMessageContaining("Checksum");
    }

    @Test
    void rejectsUnsupportedAndMissingFiles() throws Exception {
        Path script = Files.writeString(local.resolve("run.sh"), "echo hi");

        assertThatThrownBy(() -> attachments.upload(script, "alice", "Alice"))
                .isInstanceOf(AttachmentRejectedException.class)
                .hasMessageContaining(".sh");
        assertThatThrownBy(() -> attachments.upload(local.resolve("nope.txt"), "alice", "Alice"))
                .isInstanceOf(AttachmentRejectedException.class);
    }
}
