package com.chatsync.core.cache;

import com.chatsync.core.model.Message;
import com.chatsync.core.model.MessageId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Per-consumer record of message ids that have already been delivered.
 *
 * <p>The cache is bounded: once it holds more than {@code capacity} ids the oldest half is
 * evicted and the newest evicted id becomes a low-water mark. Ids at or below the mark are
 * still reported as seen, so trimming never causes a re-delivery.</p>
 *
 * <p>All methods are synchronized; the sync loop and a UI thread may share one instance.</p>
 */
@Slf4j
public class SeenMessageCache {

    private static final Comparator<Message> DELIVERY_ORDER = Comparator
            .comparing(Message::getTimestamp)
            .thenComparing(message -> message.getId() != null ? message.getId().getName() : "");

    private final int capacity;
    private final TreeSet<MessageId> seen = new TreeSet<>();
    private MessageId lowWaterMark;

    public SeenMessageCache(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be at least 2");
        }
        this.capacity = capacity;
    }

    public synchronized boolean contains(MessageId id) {
        if (lowWaterMark != null && id.compareTo(lowWaterMark) <= 0) {
            return true;
        }
        return seen.contains(id);
    }

    /**
     * @return true if the id was not seen before
     */
    public synchronized boolean markSeen(MessageId id) {
        if (contains(id)) {
            return false;
        }
        seen.add(id);
        trim();
        return true;
    }

    /**
     * Returns the candidates that were not delivered yet, sorted by timestamp, and marks them
     * seen. Candidates without an id are dropped.
     */
    public synchronized List<Message> filterNew(List<Message> candidates) {
        List<Message> fresh = new ArrayList<>();
        for (Message candidate : candidates) {
            if (candidate.getId() == null) {
                log.warn("Dropping message without storage id from {}", candidate.getSenderId());
                continue;
            }
            if (!contains(candidate.getId())) {
                seen.add(candidate.getId());
                fresh.add(candidate);
            }
        }
        trim();
        fresh.sort(DELIVERY_ORDER);
        return fresh;
    }

    public synchronized int size() {
        return seen.size();
    }

    public synchronized MessageId getLowWaterMark() {
        return lowWaterMark;
    }

    public synchronized void clear() {
        seen.clear();
        lowWaterMark = null;
    }

    private void trim() {
        while (seen.size() > capacity) {
            int toEvict = seen.size() / 2;
            for (int i = 0; i < toEvict; i++) {
                lowWaterMark = seen.pollFirst();
            }
            log.debug("Trimmed seen-message cache by {} entries, low-water mark now {}", toEvict, lowWaterMark);
        }
    }
}
