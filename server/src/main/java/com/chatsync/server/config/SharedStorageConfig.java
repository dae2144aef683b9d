package com.chatsync.server.config;

import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.config.StorageKind;
import com.chatsync.core.sync.ShareChatRoom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens the shared-storage chat room the server sweeps. Only created when retention is enabled.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "chatsync.retention.enabled", havingValue = "true")
public class SharedStorageConfig {

    @Value("${chatsync.storage.kind:local}")
    private String kind;

    @Value("${chatsync.storage.root:./chat-share}")
    private String root;

    @Value("${chatsync.storage.bucket:}")
    private String bucket;

    @Value("${chatsync.storage.prefix:chat-room}")
    private String prefix;

    @Value("${chatsync.storage.region:us-east-1}")
    private String region;

    @Value("${chatsync.storage.endpoint:}")
    private String endpoint;

    @Value("${chatsync.storage.path-style:false}")
    private boolean pathStyle;

    @Bean
    public ShareConfig shareConfig() {
        ShareConfig config = ShareConfig.builder()
                .storageKind(StorageKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)))
                .rootPath(Path.of(root))
                .bucket(bucket.isBlank() ? null : bucket)
                .prefix(prefix)
                .region(region)
                .endpoint(endpoint.isBlank() ? null : endpoint)
                .pathStyleAccess(pathStyle)
                .build();
        config.validate();
        return config;
    }

    @Bean
    public ShareChatRoom shareChatRoom(ShareConfig shareConfig) {
        log.info("Opening shared chat room: kind={}, location={}", shareConfig.getStorageKind(),
                shareConfig.getStorageKind() == StorageKind.S3
                        ? shareConfig.getBucket() + "/" + shareConfig.getPrefix()
                        : shareConfig.getRootPath().toAbsolutePath());
        return ShareChatRoom.open(shareConfig);
    }
}
