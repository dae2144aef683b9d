package com.chatsync.core.presence;

import com.chatsync.core.channel.StorageLayout;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.error.MalformedEnvelopeException;
import com.chatsync.core.error.StorageReadException;
import com.chatsync.core.error.StorageWriteException;
import com.chatsync.core.model.HeartbeatRecord;
import com.chatsync.core.model.OnlineUser;
import com.chatsync.core.model.PresenceState;
import com.chatsync.core.storage.ObjectStore;
import com.chatsync.core.storage.StoredObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Presence for the pull transport: every client upserts {@code users/<id>_heartbeat.json} on an
 * interval and readers treat records younger than the TTL as online. Registration never
 * rejects, because two clients cannot coordinate through the shared storage.
 */
@Slf4j
public class HeartbeatPresenceRegistry implements PresenceRegistry {

    private final ObjectStore store;
    private final MessageCodec codec;
    private final Clock clock;

    public HeartbeatPresenceRegistry(ObjectStore store, MessageCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    public void register(String userId, String displayName) {
        heartbeat(userId, displayName);
    }

    /**
     * Upserts the user's heartbeat with the current time.
     *
     * @throws StorageWriteException if the record could not be written
     */
    public HeartbeatRecord heartbeat(String userId, String displayName) {
        return write(userId, displayName, HeartbeatRecord.STATUS_ONLINE);
    }

    /**
     * Publishes an offline heartbeat so peers drop the user before the TTL runs out.
     */
    @Override
    public void deregister(String userId) {
        String displayName = find(userId).map(HeartbeatRecord::getDisplayName).orElse(userId);
        write(userId, displayName, HeartbeatRecord.STATUS_OFFLINE);
    }

    @Override
    public Set<OnlineUser> listOnline(Instant now, Duration ttl) {
        Set<OnlineUser> online = new LinkedHashSet<>();
        for (StoredObject object : listHeartbeatObjects()) {
            HeartbeatRecord record = readRecord(object);
            if (record == null || record.isOffline()) {
                continue;
            }
            if (record.ageAt(now).compareTo(ttl) < 0) {
                online.add(new OnlineUser(record.getUserId(), record.getDisplayName()));
            }
        }
        return online;
    }

    public PresenceState presenceOf(String userId, Instant now, Duration ttl) {
        Optional<HeartbeatRecord> record = find(userId);
        if (record.isEmpty() || record.get().isOffline()) {
            return PresenceState.OFFLINE;
        }
        Duration age = record.get().ageAt(now);
        if (age.compareTo(ttl) < 0) {
            return PresenceState.ONLINE;
        }
        if (age.compareTo(ttl.multipliedBy(2)) < 0) {
            return PresenceState.STALE;
        }
        return PresenceState.OFFLINE;
    }

    public Optional<HeartbeatRecord> find(String userId) {
        String key = StorageLayout.heartbeatKey(userId);
        try {
            return Optional.of(codec.decodeHeartbeat(store.get(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageReadException(key, e);
        } catch (MalformedEnvelopeException e) {
            log.warn("Ignoring malformed heartbeat {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private HeartbeatRecord write(String userId, String displayName, String status) {
        StorageLayout.requireValidUserId(userId, "userId");
        HeartbeatRecord record = HeartbeatRecord.builder()
                .userId(userId)
                .displayName(displayName != null ? displayName : userId)
                .lastActive(clock.instant())
                .status(status)
                .build();

        String key = StorageLayout.heartbeatKey(userId);
        try {
            store.put(key, codec.encodeHeartbeat(record));
        } catch (IOException e) {
            throw new StorageWriteException(key, e);
        }
        log.debug("Heartbeat {} for {} ({})", status, userId, displayName);
        return record;
    }

    private List<StoredObject> listHeartbeatObjects() {
        try {
            return store.list(StorageLayout.USERS_DIR).stream()
                    .filter(object -> StorageLayout.isHeartbeatName(object.getName()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageReadException(StorageLayout.USERS_DIR, e);
        }
    }

    private HeartbeatRecord readRecord(StoredObject object) {
        try {
            return codec.decodeHeartbeat(store.get(object.getKey()));
        } catch (MalformedEnvelopeException | IOException e) {
            log.warn("Failed to read heartbeat {}: {}", object.getKey(), e.getMessage());
            return null;
        }
    }
}
