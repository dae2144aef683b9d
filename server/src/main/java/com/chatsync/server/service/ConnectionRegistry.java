package com.chatsync.server.service;

import com.chatsync.core.error.DuplicateIdentityException;
import com.chatsync.core.error.TargetOfflineException;
import com.chatsync.core.model.OnlineUser;
import com.chatsync.core.presence.PresenceRegistry;
import com.chatsync.server.model.ServerFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Exact presence for the push transport: which user id is held by which live connection.
 */
@Service
@Slf4j
public class ConnectionRegistry implements PresenceRegistry {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WebSocketWriteManager writeManager;

    // userId -> live connection
    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();

    private final AtomicLong framesBroadcast = new AtomicLong(0);
    private final AtomicLong broadcastFailures = new AtomicLong(0);
    private final AtomicLong duplicateJoins = new AtomicLong(0);

    private static final class Connection {
        final String userId;
        final String displayName;
        final WebSocketSession session;

        Connection(String userId, String displayName, WebSocketSession session) {
            this.userId = userId;
            this.displayName = displayName;
            this.session = session;
        }
    }

    /**
     * Binds {@code userId} to the session and tells everyone about it.
     *
     * @throws DuplicateIdentityException if another live connection holds the id
     */
    public void register(String userId, String displayName, WebSocketSession session) {
        Connection existing = connections.putIfAbsent(userId, new Connection(userId, displayName, session));
        if (existing != null) {
            duplicateJoins.incrementAndGet();
            log.warn("Rejected join of {} from session {}: already held by session {}",
                    userId, session.getId(), existing.session.getId());
            throw new DuplicateIdentityException(userId);
        }

        log.info("User {} ({}) joined on session {}", displayName, userId, session.getId());
        broadcast(ServerFrame.userJoined(userId, displayName, onlineUserIds(), Instant.now()));
    }

    /**
     * Releases {@code userId} if it is still held by {@code session}. A stale close from an older
     * connection leaves the current holder alone.
     *
     * @return true if the user was removed
     */
    public boolean deregister(String userId, WebSocketSession session) {
        Connection current = connections.get(userId);
        if (current == null || !current.session.getId().equals(session.getId())) {
            return false;
        }
        if (!connections.remove(userId, current)) {
            return false;
        }
        announceLeft(userId);
        return true;
    }

    @Override
    public void deregister(String userId) {
        if (connections.remove(userId) != null) {
            announceLeft(userId);
        }
    }

    private void announceLeft(String userId) {
        log.info("User {} left", userId);
        broadcast(ServerFrame.userLeft(userId, onlineUserIds(), Instant.now()));
    }

    /**
     * Returns the connected users; {@code ttl} is ignored since connections are either open or closed.
     */
    @Override
    public Set<OnlineUser> listOnline(Instant now, Duration ttl) {
        return connections.values().stream()
                .sorted((a, b) -> a.userId.compareTo(b.userId))
                .map(c -> new OnlineUser(c.userId, c.displayName))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<String> onlineUserIds() {
        List<String> ids = new ArrayList<>(connections.keySet());
        Collections.sort(ids);
        return ids;
    }

    public boolean isOnline(String userId) {
        return connections.containsKey(userId);
    }

    /**
     * Sends to every joined connection.
     */
    public void broadcast(ServerFrame frame) {
        String payload = serialize(frame);
        if (payload == null) {
            return;
        }
        int delivered = 0;
        for (Connection connection : connections.values()) {
            if (writeManager.send(connection.session, payload)) {
                delivered++;
                framesBroadcast.incrementAndGet();
            } else {
                broadcastFailures.incrementAndGet();
            }
        }
        log.debug("Broadcast {} frame to {} connections", frame.getType(), delivered);
    }

    /**
     * Sends to the connection holding {@code userId}.
     *
     * @throws TargetOfflineException if nobody holds the id
     */
    public void sendTo(String userId, ServerFrame frame) {
        Connection connection = connections.get(userId);
        if (connection == null) {
            throw new TargetOfflineException(userId);
        }
        send(connection.session, frame);
    }

    public boolean send(WebSocketSession session, ServerFrame frame) {
        String payload = serialize(frame);
        return payload != null && writeManager.send(session, payload);
    }

    private String serialize(ServerFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame: {}", frame.getType(), e.getMessage());
            return null;
        }
    }

    public int getOnlineCount() {
        return connections.size();
    }

    public long getFramesBroadcast() {
        return framesBroadcast.get();
    }

    public long getBroadcastFailures() {
        return broadcastFailures.get();
    }

    public long getDuplicateJoins() {
        return duplicateJoins.get();
    }
}
