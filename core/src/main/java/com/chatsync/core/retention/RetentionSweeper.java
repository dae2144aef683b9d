package com.chatsync.core.retention;

import com.chatsync.core.channel.StorageLayout;
import com.chatsync.core.codec.MessageCodec;
import com.chatsync.core.codec.MessageIdFormat;
import com.chatsync.core.error.MalformedEnvelopeException;
import com.chatsync.core.model.MessageId;
import com.chatsync.core.storage.ObjectStore;
import com.chatsync.core.storage.StoredObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deletes messages and heartbeat records older than a cutoff.
 *
 * <p>Best effort: a failure on one entry is logged and counted, and the sweep moves on. Running
 * it again with the same cutoff removes nothing further.</p>
 */
@Slf4j
public class RetentionSweeper {

    private final ObjectStore store;
    private final MessageCodec codec;
    private final MessageIdFormat idFormat;
    private final SweepHistory history;
    private final Clock clock;

    public RetentionSweeper(ObjectStore store, MessageCodec codec, MessageIdFormat idFormat,
            SweepHistory history, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.idFormat = idFormat;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Sweeps everything older than {@code keep} relative to now and records the run.
     */
    public SweepReport sweepOlderThan(Duration keep) {
        Instant now = clock.instant();
        SweepReport report = sweep(now.minus(keep));

        history.append(SweepHistory.Entry.builder()
                .cleanupTime(codec.formatTimestamp(now))
                .cutoff(codec.formatTimestamp(report.getCutoff()))
                .deletedFiles(report.getDeleted())
                .failedFiles(report.getFailed())
                .daysKept(keep.toMinutes() / (24.0 * 60))
                .sharePath(store.describe())
                .build());
        return report;
    }

    public SweepReport sweep(Instant cutoff) {
        log.info("Starting retention sweep of {} with cutoff {}", store.describe(), cutoff);
        AtomicInteger failed = new AtomicInteger(0);

        int publicDeleted = sweepMessages(StorageLayout.PUBLIC_DIR, cutoff, failed);

        int privateDeleted = 0;
        int directoriesRemoved = 0;
        for (String pair : listPairs(failed)) {
            String directory = StorageLayout.privateDirectory(pair);
            privateDeleted += sweepMessages(directory, cutoff, failed);
            try {
                if (store.deleteDirectoryIfEmpty(directory)) {
                    directoriesRemoved++;
                    log.debug("Removed empty private channel {}", directory);
                }
            } catch (IOException e) {
                failed.incrementAndGet();
                log.error("Failed to remove directory {}: {}", directory, e.getMessage());
            }
        }

        int heartbeatsDeleted = sweepHeartbeats(cutoff, failed);

        SweepReport report = SweepReport.builder()
                .cutoff(cutoff)
                .publicDeleted(publicDeleted)
                .privateDeleted(privateDeleted)
                .heartbeatsDeleted(heartbeatsDeleted)
                .directoriesRemoved(directoriesRemoved)
                .failed(failed.get())
                .build();

        log.info("Retention sweep complete: public={}, private={}, heartbeats={}, directories={}, failed={}",
                publicDeleted, privateDeleted, heartbeatsDeleted, directoriesRemoved, report.getFailed());
        return report;
    }

    private int sweepMessages(String directory, Instant cutoff, AtomicInteger failed) {
        int deleted = 0;
        for (StoredObject object : listObjects(directory, failed)) {
            Optional<MessageId> id = idFormat.parse(object.getName());
            if (id.isEmpty()) {
                continue;
            }
            if (id.get().getTimestamp().isBefore(cutoff) && deleteEntry(object, failed)) {
                deleted++;
            }
        }
        return deleted;
    }

    private int sweepHeartbeats(Instant cutoff, AtomicInteger failed) {
        int deleted = 0;
        for (StoredObject object : listObjects(StorageLayout.USERS_DIR, failed)) {
            if (!StorageLayout.isHeartbeatName(object.getName())) {
                continue;
            }
            if (heartbeatTime(object).isBefore(cutoff) && deleteEntry(object, failed)) {
                deleted++;
            }
        }
        return deleted;
    }

    private Instant heartbeatTime(StoredObject object) {
        try {
            return codec.decodeHeartbeat(store.get(object.getKey())).getLastActive();
        } catch (MalformedEnvelopeException | IOException e) {
            log.debug("Using modification time for heartbeat {}: {}", object.getKey(), e.getMessage());
            return object.getLastModified();
        }
    }

    private boolean deleteEntry(StoredObject object, AtomicInteger failed) {
        try {
            boolean deleted = store.delete(object.getKey());
            if (deleted) {
                log.debug("Deleted {}", object.getKey());
            }
            return deleted;
        } catch (IOException e) {
            failed.incrementAndGet();
            log.error("Failed to delete {}: {}", object.getKey(), e.getMessage());
            return false;
        }
    }

    private List<StoredObject> listObjects(String directory, AtomicInteger failed) {
        try {
            return store.list(directory);
        } catch (IOException e) {
            failed.incrementAndGet();
            log.error("Failed to list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private List<String> listPairs(AtomicInteger failed) {
        try {
            return store.listDirectories(StorageLayout.PRIVATE_DIR);
        } catch (IOException e) {
            failed.incrementAndGet();
            log.error("Failed to list private channels: {}", e.getMessage());
            return List.of();
        }
    }
}
