package com.chatsync.client;

import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.config.StorageKind;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Where the shared chat room lives and how clients poll it.
 */
public class StorageOptions {

    @Option(names = {"--storage"}, description = "Backend: ${COMPLETION-CANDIDATES}", defaultValue = "LOCAL")
    StorageKind kind;

    @Option(names = {"--root"}, description = "Shared directory (local storage)")
    Path root;

    @Option(names = {"--bucket"}, description = "Bucket name (s3 storage)")
    String bucket;

    @Option(names = {"--prefix"}, description = "Key prefix inside the bucket", defaultValue = "chat-room")
    String prefix;

    @Option(names = {"--region"}, defaultValue = "us-east-1")
    String region;

    @Option(names = {"--endpoint"}, description = "Endpoint of an S3-compatible service")
    String endpoint;

    @Option(names = {"--path-style"}, description = "Use path-style bucket addressing")
    boolean pathStyle;

    @Option(names = {"--access-key"}, defaultValue = "${env:CHATSYNC_ACCESS_KEY}")
    String accessKey;

    @Option(names = {"--secret-key"}, defaultValue = "${env:CHATSYNC_SECRET_KEY}")
    String secretKey;

    @Option(names = {"--sync-interval"}, description = "Seconds between polls", defaultValue = "3")
    long syncSeconds;

    @Option(names = {"--heartbeat-interval"}, description = "Seconds between heartbeats", defaultValue = "30")
    long heartbeatSeconds;

    @Option(names = {"--presence-ttl"}, description = "Seconds a heartbeat counts as online", defaultValue = "300")
    long presenceTtlSeconds;

    @Option(names = {"--cache-capacity"}, description = "Message ids remembered per client", defaultValue = "100")
    int cacheCapacity;

    public ShareConfig toShareConfig() {
        ShareConfig config = ShareConfig.builder()
                .storageKind(kind)
                .rootPath(root)
                .bucket(bucket)
                .prefix(prefix)
                .region(region)
                .endpoint(endpoint)
                .pathStyleAccess(pathStyle)
                .accessKeyId(accessKey)
                .secretAccessKey(secretKey)
                .syncInterval(Duration.ofSeconds(syncSeconds))
                .heartbeatInterval(Duration.ofSeconds(heartbeatSeconds))
                .presenceTtl(Duration.ofSeconds(presenceTtlSeconds))
                .cacheCapacity(cacheCapacity)
                .build();
        config.validate();
        return config;
    }
}
