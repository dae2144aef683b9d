package com.chatsync.core.sync;

import com.chatsync.core.attachment.AttachmentStore;
import com.chatsync.core.cache.SeenMessageCache;
import com.chatsync.core.channel.ShareChannelStore;
import com.chatsync.core.channel.StorageLayout;
import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.error.ChatSyncException;
import com.chatsync.core.model.FileRef;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.OnlineUser;
import com.chatsync.core.presence.HeartbeatPresenceRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pull-transport client for one user.
 *
 * <p>Runs two background loops: message sync (list new objects, drop the ones already seen,
 * deliver the rest oldest first) and heartbeat. A failed iteration is logged and retried on the
 * next interval. {@link #stop()} cancels both loops and waits a bounded time for them.</p>
 */
@Slf4j
public class SyncClient implements AutoCloseable {

    private final ShareChannelStore channelStore;
    private final HeartbeatPresenceRegistry presence;
    private final AttachmentStore attachments;
    private final Clock clock;
    private final String userId;
    private final String displayName;
    private final SyncListener listener;
    private final SeenMessageCache cache;

    private final Duration syncInterval;
    private final Duration heartbeatInterval;
    private final Duration presenceTtl;
    private final Duration stopTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong syncFailures = new AtomicLong(0);
    private final AtomicLong heartbeatFailures = new AtomicLong(0);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> syncTask;
    private ScheduledFuture<?> heartbeatTask;

    public SyncClient(ShareChatRoom room, String userId, String displayName, SyncListener listener) {
        StorageLayout.requireValidUserId(userId, "userId");
        ShareConfig config = room.getConfig();

        this.channelStore = room.getChannelStore();
        this.presence = room.getPresence();
        this.attachments = room.getAttachments();
        this.clock = room.getClock();
        this.userId = userId;
        this.displayName = displayName != null && !displayName.isBlank() ? displayName : userId;
        this.listener = listener;
        this.cache = new SeenMessageCache(config.getCacheCapacity());

        this.syncInterval = config.getSyncInterval();
        this.heartbeatInterval = config.getHeartbeatInterval();
        this.presenceTtl = config.getPresenceTtl();
        this.stopTimeout = config.getStopTimeout();
    }

    /**
     * Announces the user and starts both loops.
     *
     * @throws com.chatsync.core.error.StorageWriteException if the first heartbeat cannot be written
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Sync client for {} already running", userId);
            return;
        }

        try {
            presence.register(userId, displayName);
        } catch (ChatSyncException e) {
            running.set(false);
            throw e;
        }

        scheduler = Executors.newScheduledThreadPool(2, new ThreadFactory() {
            private final AtomicLong threadCounter = new AtomicLong(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("share-sync-" + userId + "-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });

        syncTask = scheduler.scheduleWithFixedDelay(this::syncOnce,
                0, syncInterval.toMillis(), TimeUnit.MILLISECONDS);
        heartbeatTask = scheduler.scheduleWithFixedDelay(this::heartbeatOnce,
                heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Sync client started for {} ({}): sync every {}ms, heartbeat every {}ms",
                userId, displayName, syncInterval.toMillis(), heartbeatInterval.toMillis());
    }

    /**
     * Polls once and returns the new messages without notifying the listener.
     */
    public List<Message> poll() {
        List<Message> candidates = channelStore.listNew(userId, cache);
        return cache.filterNew(candidates);
    }

    public Set<OnlineUser> onlineUsers() {
        return presence.listOnline(clock.instant(), presenceTtl);
    }

    public Message sendPublic(String body) {
        return channelStore.sendPublic(userId, displayName, body);
    }

    public Message sendPrivate(String targetId, String body) {
        return channelStore.sendPrivate(userId, displayName, targetId, body);
    }

    /**
     * Uploads a file and announces it, privately when {@code targetId} is set.
     */
    public Message sendFile(Path file, String targetId) {
        FileRef fileRef = attachments.upload(file, userId, displayName);
        String body = "[" + fileRef.getFileType() + "] " + fileRef.getOriginalName();
        if (targetId == null) {
            return channelStore.sendPublic(userId, displayName, body, fileRef);
        }
        return channelStore.sendPrivate(userId, displayName, targetId, body, fileRef);
    }

    /**
     * Cancels both loops, waits at most the configured stop timeout, then publishes an offline
     * heartbeat.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping sync client for {}", userId);

        syncTask.cancel(true);
        heartbeatTask.cancel(true);
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sync loops for {} did not stop within {}ms", userId, stopTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            presence.deregister(userId);
        } catch (ChatSyncException e) {
            log.warn("Failed to publish offline heartbeat for {}: {}", userId, e.getMessage());
        }
        log.info("Sync client for {} stopped: delivered={}, syncFailures={}, heartbeatFailures={}",
                userId, messagesDelivered.get(), syncFailures.get(), heartbeatFailures.get());
    }

    @Override
    public void close() {
        stop();
    }

    void syncOnce() {
        if (!running.get()) {
            return;
        }
        try {
            List<Message> fresh = poll();
            if (!fresh.isEmpty() && running.get()) {
                messagesDelivered.addAndGet(fresh.size());
                listener.onMessages(fresh);
            }
            if (running.get()) {
                listener.onOnlineUsers(onlineUsers());
            }
        } catch (ChatSyncException e) {
            syncFailures.incrementAndGet();
            log.warn("Sync for {} failed, retrying in {}ms: {}", userId, syncInterval.toMillis(), e.getMessage());
            notifyError(e);
        } catch (RuntimeException e) {
            // Must not escape: an exception cancels the scheduled loop
            syncFailures.incrementAndGet();
            log.error("Unexpected error in sync loop for {}: {}", userId, e.getMessage(), e);
        }
    }

    private void notifyError(ChatSyncException error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            // Must not escape either: it would cancel the sync loop
            log.error("Sync listener for {} failed while handling an error: {}", userId, e.getMessage(), e);
        }
    }

    void heartbeatOnce() {
        if (!running.get()) {
            return;
        }
        try {
            presence.heartbeat(userId, displayName);
        } catch (RuntimeException e) {
            heartbeatFailures.incrementAndGet();
            log.warn("Heartbeat for {} failed: {}", userId, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getUserId() {
        return userId;
    }

    public SeenMessageCache getCache() {
        return cache;
    }

    public long getMessagesDelivered() {
        return messagesDelivered.get();
    }

    public long getSyncFailures() {
        return syncFailures.get();
    }

    public long getHeartbeatFailures() {
        return heartbeatFailures.get();
    }
}
