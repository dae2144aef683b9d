package com.chatsync.server.handler;

import com.chatsync.core.error.DuplicateIdentityException;
import com.chatsync.core.error.TargetOfflineException;
import com.chatsync.server.model.ChatFrame;
import com.chatsync.server.model.ClientFrame;
import com.chatsync.server.model.ConnectionState;
import com.chatsync.server.model.JoinFrame;
import com.chatsync.server.model.PingFrame;
import com.chatsync.server.model.PrivateChatFrame;
import com.chatsync.server.model.ServerFrame;
import com.chatsync.server.service.ConnectionRegistry;
import com.chatsync.server.service.WebSocketWriteManager;
import com.chatsync.server.validator.FrameValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Slf4j
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String USER_ID_ATTR = "userId";
    static final String USERNAME_ATTR = "username";
    static final String STATE_ATTR = "state";

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private WebSocketWriteManager writeManager;

    @Autowired
    private FrameValidator validator;

    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong chatsRelayed = new AtomicLong(0);
    private final AtomicLong privateChatsRelayed = new AtomicLong(0);
    private final AtomicLong errorsSent = new AtomicLong(0);

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        log.info("WebSocket connection established: sessionId={}, remoteAddress={}",
                session.getId(), session.getRemoteAddress());

        session.getAttributes().put(STATE_ATTR, ConnectionState.DISCONNECTED);
        writeManager.registerSession(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        framesReceived.incrementAndGet();

        ClientFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), ClientFrame.class);
        } catch (InvalidTypeIdException e) {
            log.warn("Unknown frame type from session {}: {}", session.getId(), e.getTypeId());
            sendError(session, e.getTypeId() == null ? "Missing message type" : "Unknown message type: " + e.getTypeId());
            return;
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame from session {}: {}", session.getId(), e.getOriginalMessage());
            sendError(session, "Invalid JSON format");
            return;
        }

        try {
            frame.accept(new SessionDispatcher(session));
        } catch (RuntimeException e) {
            log.error("Error processing {} frame from session {}: {}", frame.getType(), session.getId(), e.getMessage(), e);
            sendError(session, "Internal server error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        log.info("WebSocket connection closed: sessionId={}, userId={}, status={}",
                session.getId(), session.getAttributes().get(USER_ID_ATTR), status);
        release(session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    private void release(WebSocketSession session) {
        String userId = (String) session.getAttributes().remove(USER_ID_ATTR);
        session.getAttributes().put(STATE_ATTR, ConnectionState.DISCONNECTED);
        writeManager.unregisterSession(session.getId());
        if (userId != null) {
            registry.deregister(userId, session);
        }
    }

    static ConnectionState stateOf(WebSocketSession session) {
        Object state = session.getAttributes().get(STATE_ATTR);
        return state instanceof ConnectionState ? (ConnectionState) state : ConnectionState.DISCONNECTED;
    }

    private void sendError(WebSocketSession session, String message) {
        errorsSent.incrementAndGet();
        registry.send(session, ServerFrame.error(message));
    }

    /**
     * Handles the frames of one connection.
     */
    private final class SessionDispatcher implements ClientFrame.Visitor<Void> {

        private final WebSocketSession session;

        SessionDispatcher(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public Void visitJoin(JoinFrame frame) {
            if (stateOf(session) != ConnectionState.DISCONNECTED) {
                sendError(session, "Already joined as '" + session.getAttributes().get(USER_ID_ATTR) + "'");
                return null;
            }
            String error = validator.validate(frame);
            if (error != null) {
                sendError(session, error);
                return null;
            }

            session.getAttributes().put(STATE_ATTR, ConnectionState.JOINING);
            session.getAttributes().put(USER_ID_ATTR, frame.getUserId());
            try {
                registry.register(frame.getUserId(), frame.getUsername(), session);
            } catch (DuplicateIdentityException e) {
                session.getAttributes().remove(USER_ID_ATTR);
                session.getAttributes().put(STATE_ATTR, ConnectionState.DISCONNECTED);
                sendError(session, e.getMessage());
                return null;
            }

            session.getAttributes().put(USERNAME_ATTR, frame.getUsername());
            session.getAttributes().put(STATE_ATTR, ConnectionState.JOINED);
            registry.send(session, ServerFrame.joinSuccess("Joined the chat room"));
            return null;
        }

        @Override
        public Void visitChat(ChatFrame frame) {
            if (!requireJoined()) {
                return null;
            }
            String error = validator.validate(frame);
            if (error != null) {
                sendError(session, error);
                return null;
            }

            registry.broadcast(ServerFrame.chat(joinedUserId(), displayName(frame.getUsername()),
                    frame.getMessage(), Instant.now()));
            chatsRelayed.incrementAndGet();
            return null;
        }

        @Override
        public Void visitPrivateChat(PrivateChatFrame frame) {
            if (!requireJoined()) {
                return null;
            }
            String error = validator.validate(frame);
            if (error != null) {
                sendError(session, error);
                return null;
            }

            String senderId = joinedUserId();
            ServerFrame relayed = ServerFrame.privateChat(senderId, displayName(frame.getUsername()),
                    frame.getTargetUserId(), frame.getMessage(), Instant.now());
            try {
                registry.sendTo(frame.getTargetUserId(), relayed);
            } catch (TargetOfflineException e) {
                log.debug("Private message from {} to offline user {}", senderId, frame.getTargetUserId());
                sendError(session, e.getMessage());
                return null;
            }
            if (!frame.getTargetUserId().equals(senderId)) {
                registry.send(session, relayed);
            }
            privateChatsRelayed.incrementAndGet();
            return null;
        }

        @Override
        public Void visitPing(PingFrame frame) {
            registry.send(session, ServerFrame.pong());
            return null;
        }

        private boolean requireJoined() {
            if (stateOf(session) != ConnectionState.JOINED) {
                sendError(session, "Join the chat room first");
                return false;
            }
            return true;
        }

        private String joinedUserId() {
            return (String) session.getAttributes().get(USER_ID_ATTR);
        }

        private String displayName(String claimed) {
            if (claimed != null && !claimed.trim().isEmpty()) {
                return claimed;
            }
            return (String) session.getAttributes().get(USERNAME_ATTR);
        }
    }

    public long getFramesReceived() {
        return framesReceived.get();
    }

    public long getChatsRelayed() {
        return chatsRelayed.get();
    }

    public long getPrivateChatsRelayed() {
        return privateChatsRelayed.get();
    }

    public long getErrorsSent() {
        return errorsSent.get();
    }
}
