package com.chatsync.core.attachment;

import com.chatsync.core.channel.StorageLayout;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.error.AttachmentRejectedException;
import com.chatsync.core.error.StorageReadException;
import com.chatsync.core.error.StorageWriteException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.storage.ObjectStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

/**
 * Stores files shared in the chat under {@code images/} or {@code files/} and hands out
 * {@link FileRef}s to embed in messages.
 */
@Slf4j
public class AttachmentStore {

    public static final long MAX_FILE_SIZE = 50L * 1024 * 1024;

    static final Set<String> IMAGE_TYPES = Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp");
    static final Set<String> FILE_TYPES = Set.of(
            ".txt", ".doc", ".docx", ".pdf", ".xls", ".xlsx", ".ppt", ".pptx",
            ".zip", ".rar", ".7z", ".tar", ".gz", ".mp3", ".mp4", ".avi", ".mov");

    private static final DateTimeFormatter NAME_STAMP =
            DateTimeFormatter.ofPattern("uuuuMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectStore store;
    private final MessageCodec codec;
    private final Clock clock;

    public AttachmentStore(ObjectStore store, MessageCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Copies a local file into shared storage.
     *
     * @throws AttachmentRejectedException if the file is missing, too large or of an unsupported type
     * @throws StorageWriteException if the upload fails
     */
    public FileRef upload(Path localFile, String userId, String username) {
        StorageLayout.requireValidUserId(userId, "userId");
        if (!Files.isRegularFile(localFile)) {
            throw new AttachmentRejectedException("File not found: " + localFile);
        }

        String originalName = localFile.getFileName().toString();
        String extension = extensionOf(originalName);
        String fileType;
        String directory;
        if (IMAGE_TYPES.contains(extension)) {
            fileType = "image";
            directory = StorageLayout.IMAGES_DIR;
        } else if (FILE_TYPES.contains(extension)) {
            fileType = "file";
            directory = StorageLayout.FILES_DIR;
        } else {
            throw new AttachmentRejectedException("Unsupported file type: " + (extension.isEmpty() ? originalName : extension));
        }

        byte[] content;
        try {
            long size = Files.size(localFile);
            if (size > MAX_FILE_SIZE) {
                throw new AttachmentRejectedException(String.format(Locale.ROOT,
                        "File too large: %.1fMB (limit 50MB)", size / 1024.0 / 1024.0));
            }
            content = Files.readAllBytes(localFile);
        } catch (IOException e) {
            throw new AttachmentRejectedException("Cannot read " + localFile + ": " + e.getMessage());
        }

        String hash = md5Hex(content);
        Instant now = clock.instant();
        String storedName = NAME_STAMP.format(now) + "_" + userId + "_" + hash.substring(0, 8) + extension;
        String key = directory + "/" + storedName;

        try {
            store.put(key, content);
        } catch (IOException e) {
            throw new StorageWriteException(key, e);
        }
        log.info("Uploaded attachment {} ({} bytes) as {}", originalName, content.length, key);

        String mimeType = null;
        try {
            mimeType = Files.probeContentType(localFile);
        } catch (IOException e) {
            log.debug("Could not probe content type of {}: {}", localFile, e.getMessage());
        }

        return FileRef.builder()
                .filename(storedName)
                .originalName(originalName)
                .fileType(fileType)
                .fileSize(content.length)
                .fileHash(hash)
                .mimeType(mimeType != null ? mimeType : "application/octet-stream")
                .uploadTime(codec.formatTimestamp(now))
                .uploaderId(userId)
                .uploaderName(username)
                .relativePath(key)
                .build();
    }

    /**
     * Copies an attachment into {@code targetDirectory} under its original name and verifies
     * the checksum.
     *
     * @return path of the downloaded file
     */
    public Path download(FileRef fileRef, Path targetDirectory) {
        String key = fileRef.getRelativePath();
        if (key == null || key.isBlank()) {
            throw new AttachmentRejectedException("Attachment has no storage path");
        }

        byte[] content;
        try {
            content = store.get(key);
        } catch (IOException e) {
            throw new StorageReadException(key, e);
        }

        if (fileRef.getFileHash() != null && !fileRef.getFileHash().equalsIgnoreCase(md5Hex(content))) {
            throw new AttachmentRejectedException("Checksum mismatch for " + fileRef.getOriginalName());
        }

        String name = fileRef.getOriginalName() != null ? fileRef.getOriginalName() : fileRef.getFilename();
        Path target = targetDirectory.resolve(Path.of(name).getFileName().toString());
        try {
            Files.createDirectories(targetDirectory);
            Files.write(target, content);
        } catch (IOException e) {
            throw new StorageWriteException(target.toString(), e);
        }
        log.info("Downloaded attachment {} to {}", key, target);
        return target;
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String md5Hex(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
