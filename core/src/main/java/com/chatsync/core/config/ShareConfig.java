package com.chatsync.core.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings for the shared-storage transport: where the chat room lives and how often clients
 * poll it.
 */
@Value
@Builder(toBuilder = true)
public class ShareConfig {

    @Builder.Default
    StorageKind storageKind = StorageKind.LOCAL;

    /** Root directory of the chat room when {@link StorageKind#LOCAL}. */
    Path rootPath;

    /** Bucket name when {@link StorageKind#S3}. */
    String bucket;

    /** Key prefix of the chat room inside the bucket. */
    @Builder.Default
    String prefix = "chat-room";

    @Builder.Default
    String region = "us-east-1";

    /** Endpoint override for S3-compatible services; null means AWS. */
    String endpoint;

    String accessKeyId;

    String secretAccessKey;

    @Builder.Default
    boolean pathStyleAccess = false;

    @Builder.Default
    Duration syncInterval = Duration.ofSeconds(3);

    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(30);

    @Builder.Default
    Duration presenceTtl = Duration.ofSeconds(300);

    @Builder.Default
    Duration stopTimeout = Duration.ofSeconds(1);

    @Builder.Default
    int cacheCapacity = 100;

    /** Zone for reading message timestamps written without an offset. Storage names are always UTC. */
    @Builder.Default
    ZoneId zone = ZoneId.systemDefault();

    public void validate() {
        if (storageKind == StorageKind.LOCAL && rootPath == null) {
            throw new IllegalStateException("rootPath is required for local storage");
        }
        if (storageKind == StorageKind.S3 && (bucket == null || bucket.isBlank())) {
            throw new IllegalStateException("bucket is required for S3 storage");
        }
        if (syncInterval.isNegative() || syncInterval.isZero()) {
            throw new IllegalStateException("syncInterval must be positive");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalStateException("heartbeatInterval must be positive");
        }
        if (cacheCapacity < 2) {
            throw new IllegalStateException("cacheCapacity must be at least 2");
        }
    }
}
