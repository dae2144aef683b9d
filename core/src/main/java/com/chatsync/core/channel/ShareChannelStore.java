package com.chatsync.core.channel;

import com.chatsync.core.cache.SeenMessageCache;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.codec.MessageIdFormat;
import com.chatsync.core.error.MalformedEnvelopeException;
import com.chatsync.core.error.StorageReadException;
import com.chatsync.core.error.StorageWriteException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.MessageId;
import com.chatsync.core.model.MessageKind;
import com.chatsync.core.storage.ObjectStore;
import com.chatsync.core.storage.StoredObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only message store on top of a shared directory or bucket.
 *
 * <p>Public messages go to {@code public/}, private ones to {@code private/<pairKey>/}. Every
 * message is a separate object named after its timestamp and sender, so writers never contend
 * and readers detect new messages by listing.</p>
 */
@Slf4j
public class ShareChannelStore {

    private final ObjectStore store;
    private final MessageCodec codec;
    private final MessageIdFormat idFormat;
    private final Clock clock;

    private Instant lastIssued = Instant.EPOCH;

    public ShareChannelStore(ObjectStore store, MessageCodec codec, MessageIdFormat idFormat, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.idFormat = idFormat;
        this.clock = clock;
    }

    public ObjectStore getStore() {
        return store;
    }

    public MessageIdFormat getIdFormat() {
        return idFormat;
    }

    public Message sendPublic(String senderId, String senderName, String body) {
        return sendPublic(senderId, senderName, body, null);
    }

    public Message sendPublic(String senderId, String senderName, String body, FileRef attachment) {
        return send(Message.builder()
                .kind(MessageKind.PUBLIC)
                .senderId(senderId)
                .senderName(senderName)
                .body(body)
                .attachment(attachment)
                .build());
    }

    public Message sendPrivate(String senderId, String senderName, String targetId, String body) {
        return sendPrivate(senderId, senderName, targetId, body, null);
    }

    public Message sendPrivate(String senderId, String senderName, String targetId, String body,
            FileRef attachment) {
        StorageLayout.requireValidUserId(targetId, "targetId");
        return send(Message.builder()
                .kind(MessageKind.PRIVATE)
                .senderId(senderId)
                .senderName(senderName)
                .targetId(targetId)
                .body(body)
                .attachment(attachment)
                .build());
    }

    /**
     * Stamps the draft with a fresh timestamp and id and writes it.
     *
     * @return the message as written
     * @throws StorageWriteException if the object could not be written
     */
    public Message send(Message draft) {
        StorageLayout.requireValidUserId(draft.getSenderId(), "senderId");
        if (draft.getBody() == null) {
            throw new IllegalArgumentException("body is required");
        }

        Instant timestamp = nextTimestamp();
        MessageId id = idFormat.create(timestamp, draft.getSenderId());
        Message message = draft.toBuilder()
                .id(id)
                .timestamp(timestamp)
                .senderName(draft.getSenderName() != null ? draft.getSenderName() : draft.getSenderId())
                .build();

        String key = message.isPrivate()
                ? StorageLayout.privateKey(PairKeys.pairKey(message.getSenderId(), message.getTargetId()), id)
                : StorageLayout.publicKey(id);

        try {
            store.put(key, codec.encode(message));
        } catch (IOException e) {
            log.error("Failed to write {} message {}: {}", message.getKind(), key, e.getMessage());
            throw new StorageWriteException(key, e);
        }

        log.debug("Wrote {} message {}", message.getKind(), key);
        return message;
    }

    /**
     * Reads every message visible to {@code consumerId} that the cache has not seen yet: the
     * public channel plus each private channel the consumer is a party to. The result is not
     * marked seen; pass it through {@link SeenMessageCache#filterNew(List)} for that.
     *
     * <p>Malformed entries are logged and marked seen so they are not read again.</p>
     *
     * @throws StorageReadException if a directory cannot be listed
     */
    public List<Message> listNew(String consumerId, SeenMessageCache cache) {
        List<Message> found = new ArrayList<>();

        scanDirectory(StorageLayout.PUBLIC_DIR, consumerId, cache, found);

        List<String> pairs;
        try {
            pairs = store.listDirectories(StorageLayout.PRIVATE_DIR);
        } catch (IOException e) {
            throw new StorageReadException(StorageLayout.PRIVATE_DIR, e);
        }
        for (String pair : pairs) {
            if (PairKeys.involves(pair, consumerId)) {
                scanDirectory(StorageLayout.privateDirectory(pair), consumerId, cache, found);
            }
        }
        return found;
    }

    private void scanDirectory(String directory, String consumerId, SeenMessageCache cache, List<Message> found) {
        List<StoredObject> objects;
        try {
            objects = store.list(directory);
        } catch (IOException e) {
            throw new StorageReadException(directory, e);
        }

        for (StoredObject object : objects) {
            Optional<MessageId> parsed = idFormat.parse(object.getName());
            if (parsed.isEmpty()) {
                continue;
            }
            MessageId id = parsed.get();
            if (cache.contains(id)) {
                continue;
            }

            Message message;
            try {
                message = codec.decode(store.get(object.getKey())).toBuilder().id(id).build();
            } catch (MalformedEnvelopeException e) {
                log.warn("Skipping malformed message {}: {}", object.getKey(), e.getMessage());
                cache.markSeen(id);
                continue;
            } catch (IOException e) {
                // Usually removed by a retention sweep after listing
                log.debug("Could not read {}: {}", object.getKey(), e.getMessage());
                continue;
            }

            if (!message.isVisibleTo(consumerId)) {
                cache.markSeen(id);
                continue;
            }
            found.add(message);
        }
    }

    /**
     * Writes and removes a marker object to verify the root is usable.
     */
    public boolean checkAccess() {
        String marker = "test_" + UUID.randomUUID().toString().substring(0, 8) + ".tmp";
        try {
            store.put(marker, "test".getBytes(StandardCharsets.UTF_8));
            store.delete(marker);
            return true;
        } catch (IOException e) {
            log.error("Storage access check failed for {}: {}", store.describe(), e.getMessage());
            return false;
        }
    }

    public StorageStats storageStats() {
        try {
            int publicCount = countMessages(StorageLayout.PUBLIC_DIR);
            int privateCount = 0;
            for (String pair : store.listDirectories(StorageLayout.PRIVATE_DIR)) {
                privateCount += countMessages(StorageLayout.privateDirectory(pair));
            }
            int heartbeatCount = (int) store.list(StorageLayout.USERS_DIR).stream()
                    .filter(object -> StorageLayout.isHeartbeatName(object.getName()))
                    .count();
            return new StorageStats(publicCount, privateCount, heartbeatCount);
        } catch (IOException e) {
            throw new StorageReadException(store.describe(), e);
        }
    }

    private int countMessages(String directory) throws IOException {
        return (int) store.list(directory).stream()
                .filter(object -> idFormat.parse(object.getName()).isPresent())
                .count();
    }

    /**
     * Strictly increasing millisecond timestamps, so one process never produces two messages
     * with the same storage name.
     */
    private synchronized Instant nextTimestamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (!now.isAfter(lastIssued)) {
            now = lastIssued.plusMillis(1);
        }
        lastIssued = now;
        return now;
    }
}
