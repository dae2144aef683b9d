package com.chatsync.core.storage;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Object store backed by an S3-compatible bucket. Every key is placed below a fixed prefix so
 * several chat rooms can share one bucket.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private static final String DELIMITER = "/";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3ObjectStore(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = trimSlashes(prefix == null ? "" : prefix);
    }

    @Override
    public void put(String key, byte[] content) throws IOException {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(fullKey(key))
                    .contentType("application/json; charset=utf-8")
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException("putObject " + fullKey(key) + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(String key) throws IOException {
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(fullKey(key))
                    .build();
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new NoSuchFileException(fullKey(key));
        } catch (SdkException e) {
            throw new IOException("getObject " + fullKey(key) + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) throws IOException {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(fullKey(key)).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            throw new IOException("headObject " + fullKey(key) + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoredObject> list(String directory) throws IOException {
        String listPrefix = directoryPrefix(directory);
        List<StoredObject> objects = new ArrayList<>();

        for (ListObjectsV2Response page : listPages(listPrefix)) {
            for (S3Object object : page.contents()) {
                String name = object.key().substring(listPrefix.length());
                if (name.isEmpty() || name.contains(DELIMITER)) {
                    continue;
                }
                objects.add(new StoredObject(
                        relativeKey(object.key()),
                        name,
                        object.lastModified(),
                        object.size() == null ? 0L : object.size()));
            }
        }
        objects.sort(Comparator.comparing(StoredObject::getName));
        return objects;
    }

    @Override
    public List<String> listDirectories(String directory) throws IOException {
        String listPrefix = directoryPrefix(directory);
        List<String> names = new ArrayList<>();

        for (ListObjectsV2Response page : listPages(listPrefix)) {
            for (CommonPrefix commonPrefix : page.commonPrefixes()) {
                String name = trimSlashes(commonPrefix.prefix().substring(listPrefix.length()));
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
        names.sort(null);
        return names;
    }

    @Override
    public boolean delete(String key) throws IOException {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(fullKey(key)).build());
            return true;
        } catch (SdkException e) {
            throw new IOException("deleteObject " + fullKey(key) + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Buckets have no directories: a prefix disappears with its last object.
     */
    @Override
    public boolean deleteDirectoryIfEmpty(String directory) throws IOException {
        return false;
    }

    @Override
    public String describe() {
        return "s3://" + bucket + "/" + prefix;
    }

    private List<ListObjectsV2Response> listPages(String listPrefix) throws IOException {
        List<ListObjectsV2Response> pages = new ArrayList<>();
        String continuationToken = null;

        try {
            do {
                ListObjectsV2Request request = ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(listPrefix)
                        .delimiter(DELIMITER)
                        .maxKeys(1000)
                        .continuationToken(continuationToken)
                        .build();
                ListObjectsV2Response response = s3Client.listObjectsV2(request);
                pages.add(response);
                continuationToken = Boolean.TRUE.equals(response.isTruncated())
                        ? response.nextContinuationToken()
                        : null;
            } while (continuationToken != null);
        } catch (SdkException e) {
            throw new IOException("listObjectsV2 " + listPrefix + " failed: " + e.getMessage(), e);
        }

        log.trace("Listed {} page(s) under s3://{}/{}", pages.size(), bucket, listPrefix);
        return pages;
    }

    String fullKey(String key) {
        return prefix.isEmpty() ? key : prefix + DELIMITER + key;
    }

    private String directoryPrefix(String directory) {
        String dir = trimSlashes(directory);
        String full = dir.isEmpty() ? prefix : fullKey(dir);
        return full.isEmpty() ? "" : full + DELIMITER;
    }

    private String relativeKey(String key) {
        return prefix.isEmpty() ? key : key.substring(prefix.length() + 1);
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
