package com.chatsync.core.storage;

import com.chatsync.core.config.ShareConfig;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Builds the configured {@link ObjectStore} backend.
 */
@Slf4j
public final class ObjectStores {

    private ObjectStores() {
    }

    public static ObjectStore create(ShareConfig config) {
        config.validate();

        switch (config.getStorageKind()) {
            case LOCAL:
                log.info("Using shared directory {}", config.getRootPath());
                return new FileSystemObjectStore(config.getRootPath());
            case S3:
                log.info("Using bucket {} with prefix {} (endpoint={})",
                        config.getBucket(), config.getPrefix(),
                        config.getEndpoint() != null ? config.getEndpoint() : "aws");
                return new S3ObjectStore(createS3Client(config), config.getBucket(), config.getPrefix());
            default:
                throw new IllegalStateException("Unsupported storage kind: " + config.getStorageKind());
        }
    }

    static S3Client createS3Client(ShareConfig config) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(config.getRegion()))
                .credentialsProvider(credentials(config))
                .forcePathStyle(config.isPathStyleAccess());

        if (config.getEndpoint() != null && !config.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(config.getEndpoint()));
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentials(ShareConfig config) {
        if (config.getAccessKeyId() != null && config.getSecretAccessKey() != null) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.getAccessKeyId(), config.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
