package com.chatsync.client;

import com.chatsync.client.model.PushMessage;
import com.chatsync.client.model.PushState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * WebSocket client of the push chat server.
 */
@Slf4j
public class PushChatClient extends WebSocketClient {

    private final ObjectMapper objectMapper;
    private final PushChatListener listener;
    private final AtomicReference<PushState> state = new AtomicReference<>(PushState.DISCONNECTED);

    private volatile String userId;
    private volatile String username;

    private final AtomicLong framesSent = new AtomicLong(0);
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong errorsReceived = new AtomicLong(0);

    public PushChatClient(URI serverUri, PushChatListener listener) {
        super(serverUri);
        this.listener = listener;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        log.info("Connected to {} (HTTP {})", getURI(), handshake.getHttpStatus());
    }

    /**
     * Asks the server to bind {@code userId} to this connection. The outcome arrives as
     * {@link PushChatListener#onJoined} or {@link PushChatListener#onError}.
     */
    public void join(String userId, String username) {
        if (!state.compareAndSet(PushState.DISCONNECTED, PushState.JOINING)) {
            throw new IllegalStateException("Cannot join while " + state.get());
        }
        this.userId = userId;
        this.username = username;

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "join");
        frame.put("user_id", userId);
        frame.put("username", username);
        transmit(frame);
    }

    public void sendPublic(String message) {
        requireJoined();
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "chat");
        frame.put("user_id", userId);
        frame.put("username", username);
        frame.put("message", message);
        transmit(frame);
    }

    public void sendPrivate(String targetUserId, String message) {
        requireJoined();
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "private_chat");
        frame.put("user_id", userId);
        frame.put("username", username);
        frame.put("target_user_id", targetUserId);
        frame.put("message", message);
        transmit(frame);
    }

    public void ping() {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "ping");
        transmit(frame);
    }

    private void requireJoined() {
        if (state.get() != PushState.JOINED) {
            throw new IllegalStateException("Join the chat room first");
        }
    }

    private void transmit(ObjectNode frame) {
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode frame: " + e.getMessage(), e);
        }
        transmit(json);
        framesSent.incrementAndGet();
    }

    void transmit(String json) {
        send(json);
    }

    @Override
    public void onMessage(String payload) {
        framesReceived.incrementAndGet();

        PushMessage message;
        try {
            message = objectMapper.readValue(payload, PushMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring undecodable frame: {}", e.getOriginalMessage());
            return;
        }
        if (message.getType() == null) {
            log.warn("Ignoring frame without type: {}", payload);
            return;
        }

        switch (message.getType()) {
            case "join_success":
                state.set(PushState.JOINED);
                listener.onJoined(message.getMessage());
                break;
            case "error":
                errorsReceived.incrementAndGet();
                state.compareAndSet(PushState.JOINING, PushState.DISCONNECTED);
                listener.onError(message.getMessage());
                break;
            case "chat":
                listener.onChat(message);
                break;
            case "private_chat":
                listener.onPrivateChat(message);
                break;
            case "user_joined":
            case "user_left":
                listener.onPresenceChanged(message.getType(), message.getUserId(), message.getOnlineUsers());
                break;
            case "pong":
                listener.onPong();
                break;
            default:
                log.debug("Ignoring frame of unknown type {}", message.getType());
        }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        state.set(PushState.DISCONNECTED);
        log.info("Connection closed: code={}, reason={}, remote={}", code, reason, remote);
        listener.onDisconnected(reason);
    }

    @Override
    public void onError(Exception ex) {
        log.error("WebSocket error for {}: {}", userId, ex.getMessage());
        listener.onError(ex.getMessage());
    }

    public PushState getState() {
        return state.get();
    }

    public String getUserId() {
        return userId;
    }

    public long getFramesSent() {
        return framesSent.get();
    }

    public long getFramesReceived() {
        return framesReceived.get();
    }

    public long getErrorsReceived() {
        return errorsReceived.get();
    }
}
