package com.chatsync.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Every frame the server sends. Fields that do not apply to a type are left null and omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {

    public static final String JOIN_SUCCESS = "join_success";
    public static final String ERROR = "error";
    public static final String CHAT = "chat";
    public static final String PRIVATE_CHAT = "private_chat";
    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";
    public static final String PONG = "pong";

    @JsonProperty("type")
    private String type;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("target_user_id")
    private String targetUserId;

    @JsonProperty("message")
    private String message;

    @JsonProperty("online_users")
    private List<String> onlineUsers;

    @JsonProperty("timestamp")
    private String timestamp;  // ISO-8601

    public static ServerFrame joinSuccess(String message) {
        return ServerFrame.builder().type(JOIN_SUCCESS).message(message).build();
    }

    public static ServerFrame error(String message) {
        return ServerFrame.builder().type(ERROR).message(message).build();
    }

    public static ServerFrame pong() {
        return ServerFrame.builder().type(PONG).build();
    }

    public static ServerFrame chat(String userId, String username, String message, Instant timestamp) {
        return ServerFrame.builder()
                .type(CHAT)
                .userId(userId)
                .username(username)
                .message(message)
                .timestamp(timestamp.toString())
                .build();
    }

    public static ServerFrame privateChat(String userId, String username, String targetUserId,
                                          String message, Instant timestamp) {
        return ServerFrame.builder()
                .type(PRIVATE_CHAT)
                .userId(userId)
                .username(username)
                .targetUserId(targetUserId)
                .message(message)
                .timestamp(timestamp.toString())
                .build();
    }

    public static ServerFrame userJoined(String userId, String username, List<String> onlineUsers, Instant timestamp) {
        return ServerFrame.builder()
                .type(USER_JOINED)
                .userId(userId)
                .username(username)
                .onlineUsers(onlineUsers)
                .timestamp(timestamp.toString())
                .build();
    }

    public static ServerFrame userLeft(String userId, List<String> onlineUsers, Instant timestamp) {
        return ServerFrame.builder()
                .type(USER_LEFT)
                .userId(userId)
                .onlineUsers(onlineUsers)
                .timestamp(timestamp.toString())
                .build();
    }
}
