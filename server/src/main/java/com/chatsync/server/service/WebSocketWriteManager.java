package com.chatsync.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes writes per WebSocket session on a shared pool, so concurrent senders never call
 * {@link WebSocketSession#sendMessage} at the same time and a slow socket never blocks the others.
 */
@Service
@Slf4j
public class WebSocketWriteManager {

    private final ConcurrentHashMap<String, Outbox> outboxes = new ConcurrentHashMap<>();

    private ExecutorService writerExecutor;

    @Value("${websocket.writer.threads:8}")
    private int writerThreads;

    @Value("${websocket.writer.queue-capacity:1000}")
    private int queueCapacity;

    private final AtomicLong totalFramesSent = new AtomicLong(0);
    private final AtomicLong totalFramesQueued = new AtomicLong(0);
    private final AtomicLong totalFramesDropped = new AtomicLong(0);
    private final AtomicLong totalWriteErrors = new AtomicLong(0);

    /** Pending frames of one session plus its work-in-progress counter. */
    private static final class Outbox {
        final WebSocketSession session;
        final BlockingQueue<TextMessage> queue;
        final AtomicInteger wip = new AtomicInteger(0);
        final AtomicBoolean active = new AtomicBoolean(true);

        Outbox(WebSocketSession session, int capacity) {
            this.session = session;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }
    }

    @PostConstruct
    public void init() {
        log.info("Initializing WebSocketWriteManager with {} writer threads, queue capacity {}",
                writerThreads, queueCapacity);
        AtomicInteger threadCounter = new AtomicInteger(0);
        writerExecutor = Executors.newFixedThreadPool(writerThreads, r -> {
            Thread t = new Thread(r, "ws-writer-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void registerSession(WebSocketSession session) {
        Outbox previous = outboxes.putIfAbsent(session.getId(), new Outbox(session, queueCapacity));
        if (previous != null) {
            log.warn("Session {} already registered, skipping", session.getId());
            return;
        }
        log.debug("Registered session {}", session.getId());
    }

    public void unregisterSession(String sessionId) {
        Outbox outbox = outboxes.remove(sessionId);
        if (outbox == null) {
            return;
        }
        outbox.active.set(false);
        int pending = outbox.queue.size();
        if (pending > 0) {
            log.warn("Session {} unregistered with {} frames still queued", sessionId, pending);
            totalFramesDropped.addAndGet(pending);
        }
        log.debug("Unregistered session {}", sessionId);
    }

    /**
     * Queues a frame for the session. Never blocks.
     *
     * @return true if queued, false if the session is unknown, inactive or its queue is full
     */
    public boolean send(WebSocketSession session, String payload) {
        Outbox outbox = outboxes.get(session.getId());
        if (outbox == null || !outbox.active.get()) {
            log.debug("Session {} is not registered or inactive, dropping frame", session.getId());
            totalFramesDropped.incrementAndGet();
            return false;
        }

        if (!outbox.queue.offer(new TextMessage(payload))) {
            log.warn("Write queue full for session {}, dropping frame", session.getId());
            totalFramesDropped.incrementAndGet();
            return false;
        }

        totalFramesQueued.incrementAndGet();
        scheduleDrain(outbox);
        return true;
    }

    private void scheduleDrain(Outbox outbox) {
        if (outbox.wip.getAndIncrement() == 0) {
            try {
                writerExecutor.execute(() -> drain(outbox));
            } catch (RejectedExecutionException e) {
                log.error("Failed to submit write task for session {}: {}", outbox.session.getId(), e.getMessage());
                outbox.wip.decrementAndGet();
            }
        }
    }

    private void drain(Outbox outbox) {
        WebSocketSession session = outbox.session;
        int missed = 1;

        do {
            TextMessage frame;
            while ((frame = outbox.queue.poll()) != null) {
                if (!session.isOpen() || !outbox.active.get()) {
                    log.debug("Session {} closed while writing", session.getId());
                    unregisterSession(session.getId());
                    return;
                }
                try {
                    session.sendMessage(frame);
                    totalFramesSent.incrementAndGet();
                } catch (IOException e) {
                    log.error("Failed to send frame to session {}: {}", session.getId(), e.getMessage());
                    totalWriteErrors.incrementAndGet();
                    unregisterSession(session.getId());
                    closeQuietly(session);
                    return;
                } catch (RuntimeException e) {
                    log.error("Unexpected error sending to session {}: {}", session.getId(), e.getMessage());
                    totalWriteErrors.incrementAndGet();
                }
            }
            missed = outbox.wip.addAndGet(-missed);
        } while (missed != 0);
    }

    /**
     * Closing the socket makes the container call back into the handler, which deregisters the user.
     */
    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close after write failure also failed for session {}: {}", session.getId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down WebSocketWriteManager...");

        if (writerExecutor != null) {
            writerExecutor.shutdown();
            try {
                if (!writerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    writerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                writerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        outboxes.clear();

        log.info("WebSocketWriteManager shutdown complete: sent={}, dropped={}, errors={}",
                totalFramesSent.get(), totalFramesDropped.get(), totalWriteErrors.get());
    }

    public long getTotalFramesSent() {
        return totalFramesSent.get();
    }

    public long getTotalFramesQueued() {
        return totalFramesQueued.get();
    }

    public long getTotalFramesDropped() {
        return totalFramesDropped.get();
    }

    public long getTotalWriteErrors() {
        return totalWriteErrors.get();
    }

    public int getActiveSessionCount() {
        return outboxes.size();
    }

    public int getActiveWriterThreadCount() {
        if (writerExecutor instanceof ThreadPoolExecutor) {
            return ((ThreadPoolExecutor) writerExecutor).getActiveCount();
        }
        return 0;
    }
}
