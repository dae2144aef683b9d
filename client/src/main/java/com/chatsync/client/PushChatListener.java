package com.chatsync.client;

import com.chatsync.client.model.PushMessage;

import java.util.List;

/**
 * Callbacks of {@link PushChatClient}. They run on the WebSocket read thread.
 */
public interface PushChatListener {

    void onJoined(String message);

    void onChat(PushMessage message);

    void onPrivateChat(PushMessage message);

    void onPresenceChanged(String type, String userId, List<String> onlineUsers);

    /**
     * The server rejected a frame, or the connection failed.
     */
    void onError(String message);

    default void onPong() {
    }

    default void onDisconnected(String reason) {
    }
}
